package seakers.rocketbees.search;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import seakers.rocketbees.model.ProblemSettings;
import seakers.rocketbees.model.Solution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * State of a single bees run. Call {@link #scout()} once, then {@link #iterate()} until {@link #isFinished()}.
 *
 * Every iteration ranks the population by fuel, sends bees around the elite and other best sites, keeps a
 * neighbour only when it strictly improves its site, abandons sites that stagnated for too long and replaces all
 * remaining scout sites with fresh random solutions.
 */
public class BeesColony {

    public enum Phase { INIT, SCOUTING, LOCAL_SEARCH, SELECTION, TERMINATED }

    private static final Comparator<Site> BY_FUEL = Comparator.comparingDouble(site -> site.solution.getFuel());

    private static final class Site {
        private Solution solution;
        private int stagnation;

        private Site(Solution solution) {
            this.solution = solution;
        }
    }

    private final ProblemSettings settings;
    private final BeesParameters params;
    private final long seed;
    private final RandomGenerator rng;
    private final ExecutorService pool;

    private final List<Site> population;
    private final List<Double> history;
    private Solution best;
    private double patchSize;
    private int iteration;
    private int iterationsSinceImprovement;
    private long evaluations;
    private Phase phase;

    /**
     * @param pool worker pool for site searches, or null to search sites on the calling thread
     */
    BeesColony(ProblemSettings settings, BeesParameters params, long seed, ExecutorService pool) {
        this.settings = settings;
        this.params = params;
        this.seed = seed;
        this.rng = new MersenneTwister(seed);
        this.pool = pool;
        this.population = new ArrayList<>(params.getPopulationSize());
        this.history = new ArrayList<>();
        this.patchSize = params.getInitialPatchSize();
        this.phase = Phase.INIT;
    }

    /**
     * Fills the population with random solutions
     */
    public void scout() {
        if (this.phase != Phase.INIT) {
            throw new IllegalStateException("Colony already scouted, phase " + this.phase);
        }
        this.phase = Phase.SCOUTING;

        for (int i = 0; i < this.params.getPopulationSize(); i++) {
            Site site = new Site(Solution.generateRandom(this.settings, this.rng));
            this.population.add(site);
            this.evaluations++;
            if (this.best == null || site.solution.getFuel() < this.best.getFuel()) {
                this.best = site.solution;
            }
        }

        if (this.params.getMaxIterations() == 0) {
            this.phase = Phase.TERMINATED;
        }
    }

    /**
     * Runs one local search and selection round
     */
    public void iterate() {
        if (this.phase == Phase.INIT) {
            throw new IllegalStateException("Colony must scout before iterating");
        }
        if (this.phase == Phase.TERMINATED) {
            throw new IllegalStateException("Colony already terminated after " + this.iteration + " iterations");
        }

        this.phase = Phase.LOCAL_SEARCH;
        this.population.sort(BY_FUEL);

        int eliteEnd = this.params.getNumEliteSites();
        int searchedEnd = eliteEnd + this.params.getNumBestSites();
        int patch = getPatchSize();

        // seeds drawn in site order keep the run reproducible whatever thread searches each site
        List<SiteSearch> searches = new ArrayList<>(searchedEnd);
        for (int i = 0; i < searchedEnd; i++) {
            int beesCount = i < eliteEnd ? this.params.getEliteBeesCount() : this.params.getBestBeesCount();
            searches.add(new SiteSearch(this.settings, this.population.get(i).solution, beesCount, patch, this.rng.nextLong()));
        }
        List<Solution> neighbors = searchSites(searches);

        this.phase = Phase.SELECTION;
        for (int i = 0; i < searchedEnd; i++) {
            Site site = this.population.get(i);
            Solution neighbor = neighbors.get(i);
            this.evaluations += searches.get(i).getBeesCount();

            if (neighbor != null && neighbor.getFuel() < site.solution.getFuel()) {
                site.solution = neighbor;
                site.stagnation = 0;
            } else {
                site.stagnation++;
            }

            if (site.stagnation >= this.params.getStagnationLimit()) {
                site.solution = Solution.generateRandom(this.settings, this.rng);
                site.stagnation = 0;
                this.evaluations++;
            }
        }

        for (int i = searchedEnd; i < this.population.size(); i++) {
            Site site = this.population.get(i);
            site.solution = Solution.generateRandom(this.settings, this.rng);
            site.stagnation = 0;
            this.evaluations++;
        }

        boolean improved = false;
        for (Site site : this.population) {
            if (site.solution.getFuel() < this.best.getFuel()) {
                this.best = site.solution;
                improved = true;
            }
        }
        this.history.add(this.best.getFuel());
        this.iteration++;
        this.iterationsSinceImprovement = improved ? 0 : this.iterationsSinceImprovement + 1;

        this.patchSize = Math.max(this.params.getMinPatchSize(), this.patchSize * this.params.getPatchDecayFactor());

        if (this.iteration >= this.params.getMaxIterations()) {
            this.phase = Phase.TERMINATED;
        } else if (this.params.getEarlyStopIterations() > 0 && this.iterationsSinceImprovement >= this.params.getEarlyStopIterations()) {
            this.phase = Phase.TERMINATED;
        }
    }

    private List<Solution> searchSites(List<SiteSearch> searches) {
        List<Solution> neighbors = new ArrayList<>(searches.size());
        if (this.pool == null) {
            for (SiteSearch search : searches) {
                neighbors.add(search.call());
            }
            return neighbors;
        }

        try {
            for (Future<Solution> future : this.pool.invokeAll(searches)) {
                neighbors.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while searching sites", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Site search failed", cause);
        }
        return neighbors;
    }

    public boolean isFinished() {
        return this.phase == Phase.TERMINATED;
    }

    public Phase getPhase() {
        return this.phase;
    }

    public Solution getBest() {
        return this.best;
    }

    /**
     * Fuel of the cheapest solution currently in the population (not the best ever seen)
     */
    public double currentBestFuel() {
        double fuel = Double.POSITIVE_INFINITY;
        for (Site site : this.population) {
            fuel = Math.min(fuel, site.solution.getFuel());
        }
        return fuel;
    }

    public List<Solution> getPopulation() {
        List<Solution> solutions = new ArrayList<>(this.population.size());
        for (Site site : this.population) {
            solutions.add(site.solution);
        }
        return solutions;
    }

    /**
     * Current patch size rounded to a whole number of modules, capped at the number of modules
     */
    public int getPatchSize() {
        return (int) Math.min(Math.round(this.patchSize), (long) this.settings.getNumModules());
    }

    public int getIteration() {
        return this.iteration;
    }

    public long getEvaluations() {
        return this.evaluations;
    }

    public List<Double> getHistory() {
        return Collections.unmodifiableList(this.history);
    }

    public long getSeed() {
        return this.seed;
    }

    public BeesResult toResult() {
        if (this.best == null) {
            throw new IllegalStateException("Colony has not scouted yet");
        }
        return new BeesResult(this.seed, this.best, this.history, this.iteration, this.evaluations);
    }
}
