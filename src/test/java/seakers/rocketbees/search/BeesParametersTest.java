package seakers.rocketbees.search;

import org.junit.jupiter.api.Test;
import seakers.rocketbees.model.ConfigurationException;

import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class BeesParametersTest {

    private static void assertRejected(Consumer<BeesParameters> change) {
        BeesParameters params = new BeesParameters();
        change.accept(params);
        assertThrows(ConfigurationException.class, params::validate);
    }

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(() -> new BeesParameters().validate());
        assertDoesNotThrow(() -> new BeesParameters(10, 3, 3, 2, 4, 20).validate());
    }

    @Test
    void sitesMustFitInThePopulation() {
        assertRejected(p -> p.setPopulationSize(5));
        assertDoesNotThrow(() -> new BeesParameters(6, 3, 3, 2, 4, 20).validate());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertRejected(p -> p.setPopulationSize(0));
        assertRejected(p -> p.setNumEliteSites(-1));
        assertRejected(p -> p.setBestBeesCount(-2));
        assertRejected(p -> p.setPatchDecayFactor(0.0));
        assertRejected(p -> p.setPatchDecayFactor(1.5));
        assertRejected(p -> p.setMinPatchSize(0.5));
        assertRejected(p -> p.setInitialPatchSize(0.0));
        assertRejected(p -> p.setStagnationLimit(0));
        assertRejected(p -> p.setMaxIterations(-1));
        assertRejected(p -> p.setEarlyStopIterations(-1));
        assertRejected(p -> p.setNumThreads(0));
    }

    @Test
    void copyIsIndependent() {
        BeesParameters params = new BeesParameters();
        BeesParameters copy = new BeesParameters(params);
        params.setMaxIterations(7);

        assertEquals(1000, copy.getMaxIterations());
        assertEquals(params.getPatchDecayFactor(), copy.getPatchDecayFactor());
    }
}
