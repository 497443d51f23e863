package seakers.rocketbees.moeaclasses;

import org.moeaframework.core.Solution;
import org.moeaframework.core.variable.EncodingUtils;
import org.moeaframework.problem.AbstractProblem;
import seakers.rocketbees.model.Allocation;
import seakers.rocketbees.model.ProblemSettings;

public class RocketAllocationProblem extends AbstractProblem {

    /**
     * MOEA Framework view of the allocation problem: one integer variable per module holding its rocket index, one
     * objective (total fuel) and one constraint (number of modules above rocket capacity, summed over rockets)
     */

    public static final String FEASIBLE_ATTRIBUTE = "Feasible";

    private final ProblemSettings settings;

    public RocketAllocationProblem(ProblemSettings settings) {
        super(settings.getNumModules(), 1, 1);
        this.settings = settings;
    }

    @Override
    public void evaluate(Solution solution) {
        Allocation allocation = toAllocation(solution);
        int[] loads = allocation.rocketLoads(this.settings.getNumRockets());

        int overflow = 0;
        for (int r = 0; r < loads.length; r++) {
            overflow += Math.max(0, loads[r] - this.settings.getCapacity(r));
        }

        solution.setObjective(0, allocation.evaluate(this.settings));
        solution.setConstraint(0, overflow);
        solution.setAttribute(FEASIBLE_ATTRIBUTE, overflow == 0);
    }

    @Override
    public Solution newSolution() {
        Solution solution = new Solution(getNumberOfVariables(), 1, 1);
        for (int i = 0; i < getNumberOfVariables(); i++) {
            solution.setVariable(i, EncodingUtils.newInt(0, this.settings.getNumRockets() - 1));
        }
        return solution;
    }

    public Allocation toAllocation(Solution solution) {
        int[] rockets = new int[solution.getNumberOfVariables()];
        for (int i = 0; i < rockets.length; i++) {
            rockets[i] = EncodingUtils.getInt(solution.getVariable(i));
        }
        return new Allocation(rockets);
    }

    /**
     * Encodes an allocation as an evaluated MOEA Framework solution
     */
    public Solution toSolution(Allocation allocation) {
        Solution solution = newSolution();
        for (int i = 0; i < solution.getNumberOfVariables(); i++) {
            EncodingUtils.setInt(solution.getVariable(i), allocation.getRocket(i));
        }
        evaluate(solution);
        return solution;
    }

    public ProblemSettings getSettings() {
        return this.settings;
    }
}
