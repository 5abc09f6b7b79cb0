package io.github.yok.photophys.core.fit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class FitReportTest {

    private static final double EPS = 1e-12;

    @Test
    public void testStatistics() {
        // Arrange
        double[] w = {400, 410, 420, 430};
        double[] exp = {1.0, 2.0, 3.0, 4.0};
        double[] calc = {1.5, 2.0, 2.0, 4.0};

        // Act
        FitReport report = FitReport.of(w, calc, exp);

        // Assert
        assertEquals(4, report.getResiduals().size());
        WavelengthResidual first = report.getResiduals().get(0);
        assertEquals(400.0, first.getWavelength(), EPS);
        assertEquals(0.5, first.getResidual(), EPS);
        assertEquals(-1.0, report.getResiduals().get(2).getResidual(), EPS);
        // SSres = 1.25, SStot = 5
        assertEquals(0.75, report.getRSquared(), EPS);
        assertEquals(1.5 / 4, report.getMeanAbsoluteResidual(), EPS);
        assertEquals(1.0, report.getMaxAbsoluteResidual(), EPS);
        assertEquals(Math.sqrt(1.25), report.getLsq(), EPS);
    }

    @Test
    public void testZeroModelAgainstVaryingDataHasNonPositiveRSquared() {
        // Act
        FitReport report = FitReport.of(new double[] {400, 410, 420}, new double[] {0, 0, 0},
                new double[] {1, 2, 3});

        // Assert
        // SSres = 14, SStot = 2
        assertTrue("R2=" + report.getRSquared(), report.getRSquared() <= 0.0);
        assertEquals(-6.0, report.getRSquared(), EPS);
    }

    @Test
    public void testMeanModelHasZeroRSquared() {
        // Act
        FitReport report = FitReport.of(new double[] {400, 410, 420}, new double[] {2, 2, 2},
                new double[] {1, 2, 3});

        // Assert
        assertEquals(0.0, report.getRSquared(), EPS);
    }

    @Test
    public void testConstantExperimentalGivesZeroRSquared() {
        // Act
        FitReport report = FitReport.of(new double[] {1, 2}, new double[] {1, 1},
                new double[] {1, 1});

        // Assert
        assertEquals(0.0, report.getRSquared(), EPS);
        assertEquals(0.0, report.getLsq(), EPS);
    }

    @Test
    public void testEmptyInput() {
        // Act
        FitReport report = FitReport.of(new double[0], new double[0], new double[0]);

        // Assert
        assertEquals(0, report.getResiduals().size());
        assertEquals(0.0, report.getMeanAbsoluteResidual(), EPS);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsLengthMismatch() {
        FitReport.of(new double[] {1, 2}, new double[] {1}, new double[] {1, 2});
    }
}
