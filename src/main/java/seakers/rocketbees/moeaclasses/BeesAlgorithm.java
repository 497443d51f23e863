package seakers.rocketbees.moeaclasses;

import org.moeaframework.algorithm.AbstractAlgorithm;
import org.moeaframework.core.NondominatedPopulation;
import seakers.rocketbees.search.BeesColony;
import seakers.rocketbees.search.BeesOptimizer;
import seakers.rocketbees.search.BeesParameters;

public class BeesAlgorithm extends AbstractAlgorithm {

    /**
     * Runs the bees search as a MOEA Framework algorithm: the first step scouts the initial population, every later
     * step is one bees iteration. The algorithm reports itself terminated once the colony finishes.
     */

    private final RocketAllocationProblem allocationProblem;
    private final BeesOptimizer optimizer;
    private final long seed;
    private BeesColony colony;

    public BeesAlgorithm(RocketAllocationProblem problem, BeesParameters params, long seed) {
        super(problem);
        this.allocationProblem = problem;
        this.optimizer = new BeesOptimizer(problem.getSettings(), params);
        this.seed = seed;
    }

    @Override
    protected void initialize() {
        super.initialize();
        this.colony = this.optimizer.newColony(this.seed, null);
        this.colony.scout();
    }

    @Override
    protected void iterate() {
        this.colony.iterate();
    }

    @Override
    public boolean isTerminated() {
        return super.isTerminated() || (this.colony != null && this.colony.isFinished());
    }

    @Override
    public int getNumberOfEvaluations() {
        return this.colony == null ? 0 : (int) Math.min(this.colony.getEvaluations(), Integer.MAX_VALUE);
    }

    @Override
    public NondominatedPopulation getResult() {
        NondominatedPopulation result = new NondominatedPopulation();
        if (this.colony != null && this.colony.getBest() != null) {
            result.add(this.allocationProblem.toSolution(this.colony.getBest().getAllocation()));
        }
        return result;
    }

    public BeesColony getColony() {
        return this.colony;
    }
}
