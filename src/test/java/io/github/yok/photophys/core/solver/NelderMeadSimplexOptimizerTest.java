package io.github.yok.photophys.core.solver;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import io.github.yok.photophys.core.solver.BoxConstrainedOptimizer.OptimizationResult;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class NelderMeadSimplexOptimizerTest {

    private NelderMeadSimplexOptimizer optimizer;

    private static final ObjectiveFunction QUADRATIC =
            x -> (x[0] - 1.0) * (x[0] - 1.0) + (x[1] - 2.0) * (x[1] - 2.0);

    private static final ObjectiveFunction ROSENBROCK = x -> 100.0
            * (x[1] - x[0] * x[0]) * (x[1] - x[0] * x[0]) + (1.0 - x[0]) * (1.0 - x[0]);

    @Before
    public void setUp() {
        optimizer = new NelderMeadSimplexOptimizer();
    }

    @Test
    public void testQuadraticConvergesToMinimum() {
        // Arrange
        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(new double[] {3.0, 4.0})
                .objective(QUADRATIC)
                .low(-10.0)
                .high(10.0)
                .tolerance(1e-14)
                .maxIterations(5000)
                .build();

        // Act
        OptimizationResult result = optimizer.minimize(problem);

        // Assert
        assertTrue("should converge", result.isConverged());
        assertEquals(1.0, result.getSolution()[0], 1e-3);
        assertEquals(2.0, result.getSolution()[1], 1e-3);
        assertTrue(result.getValue() < 1e-6);
        assertTrue(result.getIterations() >= 1 && result.getIterations() <= 5000);
    }

    @Test
    public void testBestValueIsMonotoneNonIncreasing() {
        // Arrange
        final List<Double> bestValues = new ArrayList<>();
        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(new double[] {-1.2, 1.0})
                .objective(ROSENBROCK)
                .low(-5.0)
                .high(5.0)
                .tolerance(0.0)
                .maxIterations(300)
                .build();

        // Act
        OptimizationResult result =
                optimizer.minimize(problem, (iteration, best) -> bestValues.add(best));

        // Assert
        assertEquals(result.getIterations(), bestValues.size());
        for (int i = 1; i < bestValues.size(); i++) {
            assertTrue("iteration " + (i + 1) + " worsened the best value",
                    bestValues.get(i) <= bestValues.get(i - 1));
        }
        assertEquals(bestValues.get(bestValues.size() - 1), result.getValue(), 0.0);
    }

    @Test
    public void testEveryEvaluatedPointStaysInBoundsWithClamp() {
        assertEvaluatedPointsInBounds(BoundaryPolicy.CLAMP_TO_BOUNDS);
    }

    @Test
    public void testEveryEvaluatedPointStaysInBoundsWithRecenter() {
        assertEvaluatedPointsInBounds(BoundaryPolicy.MID_RANGE_RECENTER);
    }

    private void assertEvaluatedPointsInBounds(BoundaryPolicy policy) {
        // Arrange
        final List<double[]> evaluated = new ArrayList<>();
        // 最小点 (3, -2) は範囲 [0, 1] の外
        ObjectiveFunction f = x -> {
            evaluated.add(x.clone());
            return (x[0] - 3.0) * (x[0] - 3.0) + (x[1] + 2.0) * (x[1] + 2.0);
        };
        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(new double[] {0.5, 0.5})
                .objective(f)
                .low(0.0)
                .high(1.0)
                .boundaryPolicy(policy)
                .maxIterations(200)
                .build();

        // Act
        OptimizationResult result = optimizer.minimize(problem);

        // Assert
        assertFalse(evaluated.isEmpty());
        for (double[] x : evaluated) {
            for (double v : x) {
                assertTrue(policy + " evaluated out of bounds: " + v, v >= 0.0 && v <= 1.0);
            }
        }
        for (double v : result.getSolution()) {
            assertTrue(v >= 0.0 && v <= 1.0);
        }
    }

    @Test
    public void testClampFindsCornerMinimumOutsideBox() {
        // Arrange
        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(new double[] {0.5, 0.5})
                .objective(x -> (x[0] - 3.0) * (x[0] - 3.0) + (x[1] + 2.0) * (x[1] + 2.0))
                .low(0.0)
                .high(1.0)
                .maxIterations(2000)
                .build();

        // Act
        OptimizationResult result = optimizer.minimize(problem);

        // Assert
        assertEquals(1.0, result.getSolution()[0], 1e-3);
        assertEquals(0.0, result.getSolution()[1], 1e-3);
    }

    @Test
    public void testZeroDimensionalProblemEvaluatesOnce() {
        // Arrange
        final int[] calls = {0};
        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(new double[0])
                .objective(x -> {
                    calls[0]++;
                    return 0.42;
                })
                .low(0.0)
                .high(1.0)
                .build();

        // Act
        OptimizationResult result = optimizer.minimize(problem);

        // Assert
        assertEquals(1, calls[0]);
        assertEquals(0, result.getSolution().length);
        assertEquals(0.42, result.getValue(), 0.0);
        assertEquals(0, result.getIterations());
        assertTrue(result.isConverged());
    }

    @Test
    public void testAllZeroInitialGuessCollapsesSimplex() {
        // Arrange
        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(new double[] {0.0, 0.0})
                .objective(QUADRATIC)
                .low(-10.0)
                .high(10.0)
                .build();

        // Act
        OptimizationResult result = optimizer.minimize(problem);

        // Assert
        assertTrue("degenerate simplex has zero spread", result.isConverged());
        assertEquals(1, result.getIterations());
        assertArrayEquals(new double[] {0.0, 0.0}, result.getSolution(), 0.0);
        assertEquals(5.0, result.getValue(), 1e-12);
    }

    @Test
    public void testIterationLimitReportsNotConverged() {
        // Arrange
        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(new double[] {-1.2, 1.0})
                .objective(ROSENBROCK)
                .low(-5.0)
                .high(5.0)
                .tolerance(0.0)
                .maxIterations(1)
                .build();

        // Act
        OptimizationResult result = optimizer.minimize(problem);

        // Assert
        assertFalse(result.isConverged());
        assertEquals(1, result.getIterations());
    }

    @Test
    public void testInitialGuessIsNotModified() {
        // Arrange
        double[] x0 = {3.0, 4.0};
        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(x0)
                .objective(QUADRATIC)
                .low(-10.0)
                .high(10.0)
                .build();

        // Act
        optimizer.minimize(problem);

        // Assert
        assertArrayEquals(new double[] {3.0, 4.0}, x0, 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsInvertedBounds() {
        optimizer.minimize(OptimizationProblem.builder()
                .initialGuess(new double[] {0.5})
                .objective(x -> x[0])
                .low(1.0)
                .high(0.0)
                .build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveIterationLimit() {
        optimizer.minimize(OptimizationProblem.builder()
                .initialGuess(new double[] {0.5})
                .objective(x -> x[0])
                .low(0.0)
                .high(1.0)
                .maxIterations(0)
                .build());
    }

    @Test(expected = NullPointerException.class)
    public void testRejectsMissingObjective() {
        optimizer.minimize(OptimizationProblem.builder()
                .initialGuess(new double[] {0.5})
                .low(0.0)
                .high(1.0)
                .build());
    }
}
