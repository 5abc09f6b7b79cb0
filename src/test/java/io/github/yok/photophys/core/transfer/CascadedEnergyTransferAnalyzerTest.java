package io.github.yok.photophys.core.transfer;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.yok.photophys.core.solver.BoundaryPolicy;
import io.github.yok.photophys.core.solver.BoxConstrainedOptimizer;
import io.github.yok.photophys.core.solver.BoxConstrainedOptimizer.OptimizationResult;
import io.github.yok.photophys.core.solver.NelderMeadSimplexOptimizer;
import io.github.yok.photophys.core.solver.OptimizationProblem;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

public class CascadedEnergyTransferAnalyzerTest {

    private static final double[] CENTERS = {480, 540, 600};

    private static final double[] QUANTUM_YIELDS = {0.8, 0.6, 0.9};

    private static final double[] TRUE_EFFICIENCIES = {0.4, 0.25, 0.0};

    private CascadedEnergyTransferAnalyzer analyzer;

    private List<SpectralSeries> componentSpectra;

    private SpectralSeries composite;

    @Before
    public void setUp() {
        analyzer = new CascadedEnergyTransferAnalyzer(new NelderMeadSimplexOptimizer());

        componentSpectra = Arrays.asList(triangle("donor", CENTERS[0]),
                triangle("relay", CENTERS[1]), triangle("acceptor", CENTERS[2]));

        double third = 1.0 / 3.0;
        double[] qPrime = TransferCascade.quantumYieldsAfterTransfer(
                new double[] {third, third, third}, QUANTUM_YIELDS, TRUE_EFFICIENCIES);

        // 末尾に値 1 の点を置き、解析波長での正規化を恒等にする
        double[] w = grid();
        double[] wc = Arrays.copyOf(w, w.length + 1);
        double[] vc = new double[wc.length];
        for (int i = 0; i < w.length; i++) {
            for (int j = 0; j < 3; j++) {
                vc[i] += qPrime[j] * componentSpectra.get(j).valueAt(w[i]);
            }
        }
        wc[w.length] = 800.0;
        vc[w.length] = 1.0;
        composite = SpectralSeries.of("mix", SpectrumKind.EMISSION, wc, vc);
    }

    private static double[] grid() {
        double[] w = new double[61];
        for (int i = 0; i < w.length; i++) {
            w[i] = 400 + 5 * i;
        }
        return w;
    }

    private static SpectralSeries triangle(String id, double center) {
        double[] w = grid();
        double[] v = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            v[i] = Math.max(0.0, 1.0 - Math.abs(w[i] - center) / 40.0);
        }
        return SpectralSeries.of(id, SpectrumKind.EMISSION, w, v);
    }

    private ReverseTransferRequest.ReverseTransferRequestBuilder request() {
        ReverseTransferRequest.ReverseTransferRequestBuilder b = ReverseTransferRequest.builder()
                .composite(composite)
                .componentSpectra(componentSpectra)
                // スペクトルとは逆順に与える
                .component(new TransferComponent("acceptor", "Acceptor", 1.0, 0.9, null))
                .component(new TransferComponent("relay", "Relay", 1.0, 0.6, 0.5))
                .component(new TransferComponent("donor", "Donor", 1.0, 0.8, 0.5));
        for (double w = 440; w <= 620; w += 10) {
            b.wavelength(w);
        }
        return b;
    }

    @Test
    public void testForwardComputesQuantumYieldsAfterTransfer() {
        // Arrange
        List<TransferComponent> components =
                Arrays.asList(new TransferComponent("d", "Donor", 1.0, 0.8, 0.5),
                        new TransferComponent("a", "Acceptor", 1.0, 0.6, 0.0));

        // Act
        ForwardTransferResult result = analyzer.forward(components);

        // Assert
        assertEquals(2, result.getComponents().size());
        ComponentTransfer donor = result.getComponents().get(0);
        ComponentTransfer acceptor = result.getComponents().get(1);
        assertEquals("d", donor.getId());
        assertEquals(0.5, donor.getAbsorptionFraction(), 1e-12);
        assertEquals(0.2, donor.getQuantumYieldAfterTransfer(), 1e-12);
        assertEquals(0.45, acceptor.getQuantumYieldAfterTransfer(), 1e-12);
        assertEquals(0.65, result.getTotalQuantumYield(), 1e-12);
    }

    @Test
    public void testForwardTreatsMissingFieldsAsZero() {
        // Arrange
        List<TransferComponent> components =
                Arrays.asList(new TransferComponent("d", null, null, 0.8, null),
                        new TransferComponent("a", null, 2.0, null, 0.3));

        // Act
        ForwardTransferResult result = analyzer.forward(components);

        // Assert
        ComponentTransfer donor = result.getComponents().get(0);
        ComponentTransfer acceptor = result.getComponents().get(1);
        assertEquals(0.0, donor.getAbsorptionFraction(), 0.0);
        assertEquals(0.0, donor.getQuantumYieldAfterTransfer(), 0.0);
        assertEquals(1.0, acceptor.getAbsorptionFraction(), 1e-12);
        assertEquals("missing QY reads as zero", 0.0, acceptor.getQuantumYieldAfterTransfer(), 0.0);
        assertEquals(0.0, result.getTotalQuantumYield(), 0.0);
    }

    @Test
    public void testForwardClampsOutOfRangeInputs() {
        // Act
        ForwardTransferResult result = analyzer.forward(
                Arrays.asList(new TransferComponent("d", "Donor", 1.0, 1.7, -0.4)));

        // Assert
        ComponentTransfer donor = result.getComponents().get(0);
        assertEquals(1.0, donor.getQuantumYield(), 0.0);
        assertEquals(0.0, donor.getTransferEfficiency(), 0.0);
        assertEquals(1.0, result.getTotalQuantumYield(), 1e-12);
    }

    @Test
    public void testReverseRecoversEfficienciesUsedForForward() {
        // Act
        ReverseTransferResult result = analyzer.reverse(request().build());

        // Assert
        double[] t = result.getOptimizedEfficiencies();
        assertEquals(3, t.length);
        assertEquals(0.4, t[0], 1e-3);
        assertEquals(0.25, t[1], 1e-3);
        assertEquals("last efficiency is fixed", 0.0, t[2], 0.0);
        assertEquals("donor", result.getComponents().get(0).getId());
        assertEquals("Acceptor", result.getComponents().get(2).getName());
        assertEquals(0.16, result.getComponents().get(0).getQuantumYieldAfterTransfer(), 1e-3);
        assertEquals(0.405, result.getComponents().get(2).getQuantumYieldAfterTransfer(), 1e-3);
        assertEquals(0.775, result.getTotalQuantumYield(), 1e-3);
        assertTrue(result.getLsq() < 1e-3);
        assertEquals(result.getFitReport().getLsq(), result.getLsq(), 0.0);
        assertEquals(19, result.getFitReport().getResiduals().size());
    }

    @Test
    public void testReverseBuildsRecenteringProblemForLeadingEfficiencies() {
        // Arrange
        BoxConstrainedOptimizer optimizer = mock(BoxConstrainedOptimizer.class);
        when(optimizer.minimize(any(OptimizationProblem.class)))
                .thenReturn(new OptimizationResult(new double[] {0.4, 0.25}, 0.0, 12, true));
        CascadedEnergyTransferAnalyzer mocked = new CascadedEnergyTransferAnalyzer(optimizer);

        // Act
        ReverseTransferResult result = mocked.reverse(request().build());

        // Assert
        ArgumentCaptor<OptimizationProblem> captor =
                ArgumentCaptor.forClass(OptimizationProblem.class);
        verify(optimizer).minimize(captor.capture());
        OptimizationProblem problem = captor.getValue();
        assertEquals(BoundaryPolicy.MID_RANGE_RECENTER, problem.getBoundaryPolicy());
        assertArrayEquals(new double[] {0.5, 0.5}, problem.getInitialGuess(), 0.0);
        assertEquals(0.0, problem.getLow(), 0.0);
        assertEquals(1.0, problem.getHigh(), 0.0);
        assertEquals(1e-9 * 0.405, problem.getTolerance(), 1e-15);
        assertEquals(0.0, problem.getObjective().evaluate(new double[] {0.4, 0.25}), 1e-9);
        assertArrayEquals(new double[] {0.4, 0.25, 0.0}, result.getOptimizedEfficiencies(), 0.0);
        assertEquals(12, result.getIterations());
    }

    @Test
    public void testReverseFitsAllEfficienciesWhenLastIsFree() {
        // Arrange
        BoxConstrainedOptimizer optimizer = mock(BoxConstrainedOptimizer.class);
        when(optimizer.minimize(any(OptimizationProblem.class)))
                .thenReturn(new OptimizationResult(new double[] {0.4, 0.25, 0.1}, 0.0, 3, false));
        CascadedEnergyTransferAnalyzer mocked = new CascadedEnergyTransferAnalyzer(optimizer);

        // Act
        ReverseTransferResult result = mocked.reverse(request()
                .options(ReverseTransferOptions.builder().zeroLastT(false).build())
                .build());

        // Assert
        ArgumentCaptor<OptimizationProblem> captor =
                ArgumentCaptor.forClass(OptimizationProblem.class);
        verify(optimizer).minimize(captor.capture());
        assertArrayEquals(new double[] {0.5, 0.5, 0.0}, captor.getValue().getInitialGuess(), 0.0);
        assertEquals(0.1, result.getComponents().get(2).getTransferEfficiency(), 0.0);
        assertFalse(result.isConverged());
    }

    @Test
    public void testReverseTreatsMissingQuantumYieldAndEfficiencyAsZero() {
        // Arrange
        BoxConstrainedOptimizer optimizer = mock(BoxConstrainedOptimizer.class);
        when(optimizer.minimize(any(OptimizationProblem.class)))
                .thenReturn(new OptimizationResult(new double[] {0.4, 0.25}, 0.0, 4, true));
        CascadedEnergyTransferAnalyzer mocked = new CascadedEnergyTransferAnalyzer(optimizer);
        ReverseTransferRequest request = request()
                .clearComponents()
                .component(new TransferComponent("donor", "Donor", 1.0, 0.8, 0.5))
                .component(new TransferComponent("relay", "Relay", 1.0, null, null))
                .component(new TransferComponent("acceptor", "Acceptor", null, 0.9, null))
                .build();

        // Act
        ReverseTransferResult result = mocked.reverse(request);

        // Assert
        ArgumentCaptor<OptimizationProblem> captor =
                ArgumentCaptor.forClass(OptimizationProblem.class);
        verify(optimizer).minimize(captor.capture());
        assertArrayEquals(new double[] {0.5, 0.0}, captor.getValue().getInitialGuess(), 0.0);
        assertEquals(3, result.getComponents().size());
        ComponentTransfer relay = result.getComponents().get(1);
        assertEquals("relay", relay.getId());
        assertEquals(0.0, relay.getQuantumYield(), 0.0);
        assertEquals(0.0, relay.getQuantumYieldAfterTransfer(), 0.0);
        ComponentTransfer acceptor = result.getComponents().get(2);
        assertEquals("acceptor", acceptor.getId());
        assertEquals(0.0, acceptor.getAbsorptionWeight(), 0.0);
        assertEquals(0.0, acceptor.getAbsorptionFraction(), 0.0);
        assertEquals(0.5, result.getComponents().get(0).getAbsorptionFraction(), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReverseRejectsMissingComposite() {
        analyzer.reverse(request().composite(null).build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReverseRejectsSingleSpectrum() {
        analyzer.reverse(ReverseTransferRequest.builder()
                .composite(composite)
                .wavelength(500.0)
                .build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReverseRejectsEmptyWavelengths() {
        analyzer.reverse(request().clearWavelengths().wavelength(Double.NaN).build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReverseRejectsAbsorptionSpectrum() {
        SpectralSeries absorption = SpectralSeries.of("donor", SpectrumKind.ABSORPTION,
                new double[] {400, 500}, new double[] {0.1, 0.2});
        analyzer.reverse(request().clearComponentSpectra()
                .componentSpectrum(absorption)
                .componentSpectrum(componentSpectra.get(1))
                .build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReverseRejectsSpectrumWithoutComponentInput() {
        analyzer.reverse(request().clearComponents()
                .component(new TransferComponent("donor", "Donor", 1.0, 0.8, 0.5))
                .build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReverseRejectsInvertedRange() {
        analyzer.reverse(request()
                .options(ReverseTransferOptions.builder().low(1.0).high(0.5).build())
                .build());
    }
}
