package seakers.rocketbees.gatewayclasses;

import org.junit.jupiter.api.Test;
import seakers.rocketbees.model.InfeasibleProblemException;

import java.util.ArrayList;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class AllocationOperationsTest {

    private static ArrayList<ArrayList<Double>> costRows(Double[]... rows) {
        ArrayList<ArrayList<Double>> matrix = new ArrayList<>();
        for (Double[] row : rows) {
            matrix.add(new ArrayList<>(Arrays.asList(row)));
        }
        return matrix;
    }

    @Test
    void runsFromPlainLists() {
        AllocationOperations operations = new AllocationOperations();
        operations.setProblem(2, 4,
                new ArrayList<>(Arrays.asList(3, 2)),
                new ArrayList<>(Arrays.asList(10.0, 5.0)),
                costRows(new Double[]{1.0, 4.0, 2.0, 6.0}, new Double[]{3.0, 1.0, 5.0, 2.0}));
        operations.setSiteParameters(10, 3, 3, 2, 4);
        operations.setStoppingParameters(20, 10, 0);

        double fuel = operations.run(42L);

        assertEquals(fuel, operations.getBestFuel());
        assertEquals(4, operations.getBestAllocation().size());
        assertEquals(20, operations.getHistory().size());
        assertEquals(20, operations.getIterations());
        assertEquals(1, operations.getRunCount());
    }

    @Test
    void moduleTypeProblemCanBeSet() {
        AllocationOperations operations = new AllocationOperations();
        operations.setProblemByModuleTypes(
                new ArrayList<>(Arrays.asList(4, 4)),
                new ArrayList<>(Arrays.asList(10.0, 12.0)),
                costRows(new Double[]{1.0, 2.0}, new Double[]{2.0, 1.0}),
                new ArrayList<>(Arrays.asList(3, 3)));
        operations.setStoppingParameters(15, 5, 0);

        operations.run(1L);

        assertEquals(6, operations.getBestAllocation().size());
    }

    @Test
    void rocketTypeProblemCanBeSet() {
        AllocationOperations operations = new AllocationOperations();
        operations.setProblemByRocketTypes(
                new ArrayList<>(Arrays.asList(0, 0, 1, 1)),
                new ArrayList<>(Arrays.asList(10, 10)),
                new ArrayList<>(Arrays.asList(39.9175704, 47.029129)),
                costRows(new Double[]{3.22714791, 6.39551519, 5.92349917, 3.02169468},
                        new Double[]{9.31912442, 8.56746934, 9.37825445, 1.80524675}),
                new ArrayList<>(Arrays.asList(6, 15, 9, 5)));
        operations.setStoppingParameters(10, 5, 0);

        operations.run(3L);

        assertEquals(35, operations.getBestAllocation().size());
        for (int rocket : operations.getBestAllocation()) {
            assertTrue(rocket >= 0 && rocket < 4);
        }
    }

    @Test
    void resultsAreUnavailableBeforeARun() {
        AllocationOperations operations = new AllocationOperations();

        assertThrows(IllegalStateException.class, () -> operations.run(1L));
        assertThrows(IllegalStateException.class, operations::getBestFuel);
    }

    @Test
    void infeasibleProblemIsRejected() {
        AllocationOperations operations = new AllocationOperations();

        assertThrows(InfeasibleProblemException.class, () -> operations.setProblem(2, 3,
                new ArrayList<>(Arrays.asList(1, 1)),
                new ArrayList<>(Arrays.asList(1.0, 1.0)),
                costRows(new Double[]{1.0, 1.0, 1.0}, new Double[]{1.0, 1.0, 1.0})));
    }
}
