package seakers.rocketbees.search;

import org.junit.jupiter.api.Test;
import seakers.rocketbees.model.ProblemSettings;
import seakers.rocketbees.model.Solution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BeesColonyTest {

    private final ProblemSettings settings = new ProblemSettings(3, 7, new int[]{3, 3, 2}, new double[]{10.0, 6.0, 4.0},
            new double[][]{{1, 2, 3, 4, 5, 6, 7}, {7, 6, 5, 4, 3, 2, 1}, {3, 3, 3, 3, 3, 3, 3}});

    private BeesColony newColony(int maxIterations) {
        BeesParameters params = new BeesParameters();
        params.setMaxIterations(maxIterations);
        params.setInitialPatchSize(4.0);
        params.setPatchDecayFactor(0.5);
        return new BeesOptimizer(settings, params).newColony(77L, null);
    }

    @Test
    void walksThroughItsPhases() {
        BeesColony colony = newColony(2);
        assertEquals(BeesColony.Phase.INIT, colony.getPhase());
        assertThrows(IllegalStateException.class, colony::iterate);

        colony.scout();
        assertEquals(BeesColony.Phase.SCOUTING, colony.getPhase());
        assertThrows(IllegalStateException.class, colony::scout);

        colony.iterate();
        assertEquals(BeesColony.Phase.SELECTION, colony.getPhase());
        assertFalse(colony.isFinished());

        colony.iterate();
        assertTrue(colony.isFinished());
        assertEquals(BeesColony.Phase.TERMINATED, colony.getPhase());
        assertThrows(IllegalStateException.class, colony::iterate);
    }

    @Test
    void populationKeepsItsSizeAndStaysFeasible() {
        BeesColony colony = newColony(30);
        colony.scout();
        while (!colony.isFinished()) {
            colony.iterate();
            assertEquals(12, colony.getPopulation().size());
            for (Solution solution : colony.getPopulation()) {
                assertTrue(solution.getAllocation().isFeasible(settings));
            }
            assertTrue(colony.getBest().getFuel() <= colony.currentBestFuel());
        }
    }

    @Test
    void patchSizeDecaysToItsFloor() {
        BeesColony colony = newColony(10);
        colony.scout();
        assertEquals(4, colony.getPatchSize());

        colony.iterate();
        assertEquals(2, colony.getPatchSize());

        for (int i = 0; i < 5; i++) {
            colony.iterate();
        }
        assertEquals(1, colony.getPatchSize());
    }

    @Test
    void countsEveryEvaluatedSolution() {
        BeesColony colony = newColony(1);
        colony.scout();
        assertEquals(12, colony.getEvaluations());

        colony.iterate();
        // 3 elite sites x 2 bees, 3 best sites x 4 bees, 6 scouts; no site can stagnate 10 times in one iteration
        assertEquals(12 + 6 + 12 + 6, colony.getEvaluations());
    }

    @Test
    void patchSizeNeverExceedsTheModuleCount() {
        BeesParameters params = new BeesParameters();
        params.setMaxIterations(5);
        params.setInitialPatchSize(3.0e9);
        BeesColony colony = new BeesOptimizer(settings, params).newColony(77L, null);

        colony.scout();
        assertEquals(7, colony.getPatchSize());
        while (!colony.isFinished()) {
            colony.iterate();
            assertEquals(7, colony.getPatchSize());
        }
        for (Solution solution : colony.getPopulation()) {
            assertTrue(solution.getAllocation().isFeasible(settings));
        }
    }

    private BeesColony idleColony(int stagnationLimit, int maxIterations) {
        // no bees: searched sites can never improve, so each iteration counts towards stagnation
        BeesParameters params = new BeesParameters();
        params.setEliteBeesCount(0);
        params.setBestBeesCount(0);
        params.setStagnationLimit(stagnationLimit);
        params.setMaxIterations(maxIterations);
        return new BeesOptimizer(settings, params).newColony(77L, null);
    }

    @Test
    void sitesBelowTheStagnationLimitAreKept() {
        BeesColony colony = idleColony(2, 1);
        colony.scout();
        List<Solution> ranked = new ArrayList<>(colony.getPopulation());
        ranked.sort(Comparator.comparingDouble(Solution::getFuel));

        colony.iterate();

        // only the 6 scout sites are redrawn
        assertEquals(12 + 6, colony.getEvaluations());
        List<Solution> after = colony.getPopulation();
        for (Solution site : ranked.subList(0, 6)) {
            assertTrue(after.stream().anyMatch(solution -> solution == site));
        }
    }

    @Test
    void stagnantSitesAreAbandoned() {
        BeesColony colony = idleColony(1, 3);
        colony.scout();
        double scoutedBest = colony.getBest().getFuel();

        while (!colony.isFinished()) {
            List<Solution> before = colony.getPopulation();
            colony.iterate();

            for (Solution solution : colony.getPopulation()) {
                assertTrue(solution.getAllocation().isFeasible(settings));
                for (Solution old : before) {
                    assertNotSame(old, solution);
                }
            }
        }

        // every iteration redraws 6 abandoned sites and 6 scouts
        assertEquals(12 + 3 * 12, colony.getEvaluations());
        assertTrue(colony.getBest().getFuel() <= scoutedBest);
        List<Double> history = colony.getHistory();
        assertEquals(3, history.size());
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i) <= history.get(i - 1));
        }
    }
}
