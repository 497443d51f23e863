package seakers.rocketbees.moeaclasses;

import org.junit.jupiter.api.Test;
import org.moeaframework.core.NondominatedPopulation;
import seakers.rocketbees.model.ProblemSettings;
import seakers.rocketbees.search.BeesOptimizer;
import seakers.rocketbees.search.BeesParameters;
import seakers.rocketbees.search.BeesResult;

import static org.junit.jupiter.api.Assertions.*;

class BeesAlgorithmTest {

    private final ProblemSettings settings = ProblemSettings.ofModuleTypes(
            new int[]{10, 10, 10, 10},
            new double[]{39.9175704, 39.9175704, 47.029129, 47.029129},
            new double[][]{
                    {3.22714791, 6.39551519, 5.92349917, 3.02169468},
                    {3.22714791, 6.39551519, 5.92349917, 3.02169468},
                    {9.31912442, 8.56746934, 9.37825445, 1.80524675},
                    {9.31912442, 8.56746934, 9.37825445, 1.80524675}},
            new int[]{6, 15, 9, 5});

    @Test
    void steppingMatchesADirectRun() {
        BeesParameters params = new BeesParameters();
        params.setMaxIterations(50);
        BeesAlgorithm algorithm = new BeesAlgorithm(new RocketAllocationProblem(settings), params, 5L);

        int steps = 0;
        while (!algorithm.isTerminated()) {
            algorithm.step();
            steps++;
        }

        BeesResult direct = new BeesOptimizer(settings, params).run(5L);
        BeesResult stepped = algorithm.getColony().toResult();

        // first step scouts, every later one is an iteration
        assertEquals(51, steps);
        assertEquals(direct.getBestAllocation(), stepped.getBestAllocation());
        assertEquals(direct.getHistory(), stepped.getHistory());
        assertEquals(direct.getEvaluations(), algorithm.getNumberOfEvaluations());
    }

    @Test
    void resultHoldsTheBestAllocation() {
        BeesParameters params = new BeesParameters();
        params.setMaxIterations(20);
        RocketAllocationProblem problem = new RocketAllocationProblem(settings);
        BeesAlgorithm algorithm = new BeesAlgorithm(problem, params, 9L);

        assertTrue(algorithm.getResult().isEmpty());
        while (!algorithm.isTerminated()) {
            algorithm.step();
        }

        NondominatedPopulation result = algorithm.getResult();
        assertEquals(1, result.size());
        assertEquals(algorithm.getColony().getBest().getFuel(), result.get(0).getObjective(0), 1e-9);
        assertFalse(result.get(0).violatesConstraints());
        assertEquals(algorithm.getColony().getBest().getAllocation(), problem.toAllocation(result.get(0)));
    }
}
