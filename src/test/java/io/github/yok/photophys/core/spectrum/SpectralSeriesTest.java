package io.github.yok.photophys.core.spectrum;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;

public class SpectralSeriesTest {

    private static final double EPS = 1e-12;

    private static SpectralSeries absorption(double[] w, double[] v) {
        return SpectralSeries.of("dye", SpectrumKind.ABSORPTION, w, v);
    }

    @Test
    public void testValueAtReturnsStoredValueAtSampleWavelengths() {
        // Arrange
        double[] w = {400, 410, 420, 430};
        double[] v = {0.1, 0.7, 0.3, 0.9};
        SpectralSeries s = absorption(w, v);

        // Act / Assert
        for (int i = 0; i < w.length; i++) {
            assertEquals("sample " + i, v[i], s.valueAt(w[i]), EPS);
        }
    }

    @Test
    public void testValueAtInterpolatesLinearlyBetweenSamples() {
        // Arrange
        SpectralSeries s = absorption(new double[] {400, 410}, new double[] {1.0, 3.0});

        // Act
        double mid = s.valueAt(405);
        double quarter = s.valueAt(402.5);

        // Assert
        assertEquals(2.0, mid, EPS);
        assertEquals(1.5, quarter, EPS);
    }

    @Test
    public void testValueAtOutsideRangeIsZero() {
        // Arrange
        SpectralSeries s = absorption(new double[] {400, 410, 420}, new double[] {5, 6, 7});

        // Act / Assert
        assertEquals(0.0, s.valueAt(399.9), EPS);
        assertEquals(0.0, s.valueAt(420.1), EPS);
        assertEquals(0.0, s.valueAt(Double.NaN), EPS);
        assertEquals(0.0, s.normalizedValueAt(1000), EPS);
    }

    @Test
    public void testEmptyAndSingleSampleSeries() {
        // Arrange
        SpectralSeries empty = absorption(new double[0], new double[0]);
        SpectralSeries single = absorption(new double[] {450}, new double[] {3.0});

        // Act / Assert
        assertEquals(0.0, empty.valueAt(450), EPS);
        assertTrue(Double.isNaN(empty.maxValue(SpectrumKind.ABSORPTION)));
        assertEquals("single sample is returned everywhere", 3.0, single.valueAt(900), EPS);
        assertEquals("single sample normalizes to the mid value", 0.5,
                single.normalizedValueAt(450), EPS);
    }

    @Test
    public void testNormalizedValuesStayWithinUnitInterval() {
        // Arrange
        double[] w = {400, 410, 420, 430, 440};
        SpectralSeries s = absorption(w, new double[] {-2.0, 5.0, 1.0, 8.0, 3.0});

        // Act / Assert
        for (double x = 400; x <= 440; x += 0.5) {
            double y = s.normalizedValueAt(x);
            assertTrue("λ=" + x + " y=" + y, y >= 0.0 && y <= 1.0);
        }
        assertEquals(0.0, s.normalizedValueAt(400), EPS);
        assertEquals(1.0, s.normalizedValueAt(430), EPS);
        assertEquals(0.7, s.normalizedValueAt(410), EPS);
    }

    @Test
    public void testDegenerateSeriesNormalizesToHalf() {
        // Arrange
        SpectralSeries s = absorption(new double[] {400, 410, 420}, new double[] {4, 4, 4});

        // Act / Assert
        assertEquals(0.5, s.normalizedValueAt(400), EPS);
        assertEquals(0.5, s.normalizedValueAt(415), EPS);
        assertEquals(0.5, s.normalized().get(2).getCoefficient(), EPS);
    }

    @Test
    public void testInterpolationReadsFieldSelectedByKind() {
        // Arrange
        SpectralSeries s = new SpectralSeries("dye", SpectrumKind.EMISSION,
                Arrays.asList(new SpectralSample(500, 10.0, 0.2),
                        new SpectralSample(510, 20.0, 0.4)));

        // Act / Assert
        assertEquals("emission reads normalized", 0.3, s.valueAt(505), EPS);
        assertEquals(15.0, s.valueAt(505, SpectrumKind.ABSORPTION), EPS);
    }

    @Test
    public void testSortAscendingIsStableAndKeepsOriginal() {
        // Arrange
        SpectralSeries s = absorption(new double[] {420, 400, 410, 400},
                new double[] {1.0, 2.0, 3.0, 4.0});

        // Act
        SpectralSeries sorted = s.sortAscending();

        // Assert
        assertFalse(s.isStoredAscending());
        assertTrue(sorted.isStoredAscending());
        assertEquals(420, s.get(0).getWavelength(), EPS);
        assertEquals(400, sorted.get(0).getWavelength(), EPS);
        assertEquals("duplicates keep caller order", 2.0, sorted.get(0).getCoefficient(), EPS);
        assertEquals(4.0, sorted.get(1).getCoefficient(), EPS);
        assertEquals(3.0, sorted.get(2).getCoefficient(), EPS);
        assertEquals(1.0, sorted.get(3).getCoefficient(), EPS);
    }

    @Test
    public void testAreaTrapezoidInWavelengthAndWavenumber() {
        // Arrange
        SpectralSeries s = absorption(new double[] {400, 500}, new double[] {1.0, 3.0});

        // Act
        double areaWavelength = s.areaTrapezoid(SpectralDomain.WAVELENGTH);
        double areaWavenumber = s.areaTrapezoid(SpectralDomain.WAVENUMBER);

        // Assert
        assertEquals(200.0, areaWavelength, EPS);
        assertEquals((1e7 / 400 - 1e7 / 500) * 2.0, areaWavenumber, 1e-9);
    }

    @Test
    public void testEmissionAreasUseNormalizedIntensity() {
        // Arrange
        SpectralSeries s = SpectralSeries.of("dye", SpectrumKind.EMISSION,
                new double[] {500, 510}, new double[] {1.0, 1.0});
        double v1 = 1e7 / 500;
        double v2 = 1e7 / 510;

        // Act
        EmissionAreas areas = s.emissionAreas();

        // Assert
        assertEquals(1e8, areas.getArea(), 1e-3);
        double expectedCube = 1e7 * 10 * (1 / (v1 * v1 * v1) + 1 / (v2 * v2 * v2)) / 2;
        assertEquals(expectedCube, areas.getInverseCubeWeightedArea(), expectedCube * 1e-12);
        assertEquals(areas.getArea() / expectedCube, areas.reciprocalMeanInverseCube(),
                areas.reciprocalMeanInverseCube() * 1e-12);
    }

    @Test
    public void testReciprocalMeanInverseCubeOfEmptyAreasIsNaN() {
        // Act / Assert
        assertTrue(Double.isNaN(new EmissionAreas(0.0, 0.0).reciprocalMeanInverseCube()));
    }
}
