package io.github.yok.photophys.core.photophysics;

import static org.junit.Assert.assertEquals;

import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import org.junit.Before;
import org.junit.Test;

public class ConcentrationEstimatorTest {

    private ConcentrationEstimator estimator;

    private SpectralSeries absorption;

    @Before
    public void setUp() {
        estimator = new ConcentrationEstimator();
        absorption = SpectralSeries.of("dye", SpectrumKind.ABSORPTION,
                new double[] {500, 450, 400}, new double[] {0.5, 1.0, 0.0});
    }

    @Test
    public void testEstimatesFromNormalizedAbsorbance() {
        // Act
        double c = estimator.estimateMicromolar(absorption, 10000, 500,
                ConcentrationEstimator.DEFAULT_PATH_LENGTH);

        // Assert
        assertEquals(50.0, c, 1e-9);
    }

    @Test
    public void testPathLengthDividesConcentration() {
        // Act
        double c = estimator.estimateMicromolar(absorption, 10000, 500, 2.0);

        // Assert
        assertEquals(25.0, c, 1e-9);
    }

    @Test
    public void testParsesFreeTextInputs() {
        // Act
        double c = estimator.estimateMicromolar(absorption, "ε = 10,000 M-1 cm-1", "500 nm", 1.0);

        // Assert
        assertEquals(50.0, c, 1e-9);
    }

    @Test
    public void testUnusableInputsGiveZero() {
        SpectralSeries emission = SpectralSeries.of("dye", SpectrumKind.EMISSION,
                new double[] {400, 500}, new double[] {0.0, 1.0});

        assertEquals(0.0, estimator.estimateMicromolar(absorption, "n/a", "500", 1.0), 0.0);
        assertEquals(0.0, estimator.estimateMicromolar(absorption, null, "500", 1.0), 0.0);
        assertEquals(0.0, estimator.estimateMicromolar(absorption, 0, 500, 1.0), 0.0);
        assertEquals(0.0, estimator.estimateMicromolar(absorption, 10000, 500, 0.0), 0.0);
        assertEquals("zero absorbance", 0.0,
                estimator.estimateMicromolar(absorption, 10000, 400, 1.0), 0.0);
        assertEquals("outside range", 0.0,
                estimator.estimateMicromolar(absorption, 10000, 800, 1.0), 0.0);
        assertEquals(0.0, estimator.estimateMicromolar(emission, 10000, 500, 1.0), 0.0);
    }
}
