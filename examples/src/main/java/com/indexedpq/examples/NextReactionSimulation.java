package com.indexedpq.examples;

import com.indexedpq.core.IndexedPriorityQueue;

import org.jgrapht.alg.util.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Gibson and Bruck's Next Reaction Method, a variant of Gillespie's stochastic
 * simulation algorithm for chemical reaction networks.
 * <p>
 * Each reaction channel is scheduled in an indexed priority queue keyed by the
 * reaction, with its next firing time as priority. After an event only the
 * fired reaction and the reactions depending on it are rescheduled, each in
 * O(log n).
 */
public class NextReactionSimulation {

    /**
     * A reaction channel: how it changes the state and how likely it is to fire.
     */
    public abstract static class Reaction {
        private final String name;
        final int[] stoich;
        final double rateConst;
        final int[] reactants;

        Reaction(String name, int[] stoich, double rateConst, int[] reactants) {
            this.name = name;
            this.stoich = stoich;
            this.rateConst = rateConst;
            this.reactants = reactants;
        }

        public abstract double propensity(int[] state);

        public int[] getStoich() {
            return stoich.clone();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static class ZerothOrderReaction extends Reaction {
        ZerothOrderReaction(String name, int[] stoich, double rateConst, int[] reactants) {
            super(name, stoich, rateConst, reactants);
        }

        @Override
        public double propensity(int[] state) {
            return rateConst;
        }
    }

    static class UnimolecularReaction extends Reaction {
        UnimolecularReaction(String name, int[] stoich, double rateConst, int[] reactants) {
            super(name, stoich, rateConst, reactants);
        }

        @Override
        public double propensity(int[] state) {
            return rateConst * state[reactants[0]];
        }
    }

    // Two molecules of the same species
    static class HomogeneousBimolecularReaction extends Reaction {
        HomogeneousBimolecularReaction(String name, int[] stoich, double rateConst, int[] reactants) {
            super(name, stoich, rateConst, reactants);
        }

        @Override
        public double propensity(int[] state) {
            int x = state[reactants[0]];
            return rateConst * x * (x - 1) / 2.0;
        }
    }

    static class BimolecularReaction extends Reaction {
        BimolecularReaction(String name, int[] stoich, double rateConst, int[] reactants) {
            super(name, stoich, rateConst, reactants);
        }

        @Override
        public double propensity(int[] state) {
            return rateConst * state[reactants[0]] * state[reactants[1]];
        }
    }

    /**
     * Event times and the state right after each event, starting with the
     * initial state.
     */
    public static class Trajectory {
        public final List<Double> times;
        public final List<int[]> states;

        public Trajectory(List<Double> times, List<int[]> states) {
            this.times = times;
            this.states = states;
        }

        public int size() {
            return times.size();
        }

        public int[] finalState() {
            return states.get(states.size() - 1);
        }
    }

    /**
     * Builds a reaction from whitespace separated species names, e.g.
     * {@code createReaction(species, "mRNA", "mRNA protein", 0.1)}. An empty
     * string stands for no species.
     *
     * @throws IllegalArgumentException on unknown species or more than two reactants
     */
    public static Reaction createReaction(List<String> species, String reactantsStr, String productsStr,
            double rateConst) {
        List<String> reactants = tokens(reactantsStr);
        List<String> products = tokens(productsStr);

        int[] stoich = new int[species.size()];
        for (String product : products) {
            stoich[indexOf(species, product)]++;
        }
        int[] idx = new int[reactants.size()];
        for (int i = 0; i < reactants.size(); i++) {
            idx[i] = indexOf(species, reactants.get(i));
            stoich[idx[i]]--;
        }

        String name = String.join(" + ", reactants) + " -> " + String.join(" + ", products);
        switch (reactants.size()) {
            case 0:
                return new ZerothOrderReaction(name, stoich, rateConst, idx);
            case 1:
                return new UnimolecularReaction(name, stoich, rateConst, idx);
            case 2:
                if (reactants.get(0).equals(reactants.get(1))) {
                    return new HomogeneousBimolecularReaction(name, stoich, rateConst, idx);
                }
                return new BimolecularReaction(name, stoich, rateConst, idx);
            default:
                throw new IllegalArgumentException("Only 0th, 1st, and 2nd order reactions are allowed: " + name);
        }
    }

    /**
     * Runs the simulation from {@code tStart}, firing events until the next
     * one would happen after {@code tEnd} or no reaction can fire any more.
     *
     * @param dependencies for each reaction, the reactions whose propensity
     *            changes when it fires
     */
    public static Trajectory simulate(double tStart, double tEnd, int[] initialAmounts, List<Reaction> reactions,
            Map<Reaction, ? extends List<Reaction>> dependencies, Random random) {
        double t = tStart;
        int[] x = initialAmounts.clone();
        List<Double> times = new ArrayList<>();
        List<int[]> states = new ArrayList<>();
        times.add(t);
        states.add(x.clone());

        Map<Reaction, Double> a = new HashMap<>();
        IndexedPriorityQueue<Reaction, Double, Double> scheduler = IndexedPriorityQueue.minQueue();
        for (Reaction rxn : reactions) {
            a.put(rxn, rxn.propensity(x));
            scheduler.addItem(rxn, t + drawWaitingTime(a.get(rxn), random));
        }

        while (!scheduler.isEmpty()) {
            Pair<Reaction, Double> next = scheduler.peekTopItem();
            Reaction fired = next.getFirst();
            double tNext = next.getSecond();
            if (tNext > tEnd || Double.isInfinite(tNext)) {
                break;
            }

            // fire
            t = tNext;
            for (int i = 0; i < x.length; i++) {
                x[i] += fired.stoich[i];
            }
            times.add(t);
            states.add(x.clone());

            // reschedule the fired channel with a fresh draw
            a.put(fired, fired.propensity(x));
            scheduler.updateItem(fired, t + drawWaitingTime(a.get(fired), random));

            // rescale the dependents' waiting times to their new propensities
            List<Reaction> dependents = dependencies.get(fired);
            if (dependents == null) {
                dependents = Collections.emptyList();
            }
            for (Reaction rxn : dependents) {
                if (rxn == fired) {
                    continue;
                }
                double aOld = a.get(rxn);
                double aNew = rxn.propensity(x);
                a.put(rxn, aNew);
                double scheduled = scheduler.get(rxn);
                double tau;
                if (aNew == 0.0) {
                    tau = Double.POSITIVE_INFINITY;
                } else if (Double.isInfinite(scheduled)) {
                    tau = drawWaitingTime(aNew, random);
                } else {
                    tau = (aOld / aNew) * (scheduled - t);
                }
                scheduler.updateItem(rxn, t + tau);
            }
        }

        return new Trajectory(times, states);
    }

    // Exponential waiting time with the given rate.
    static double drawWaitingTime(double propensity, Random random) {
        if (propensity <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return -Math.log(1.0 - random.nextDouble()) / propensity;
    }

    private static List<String> tokens(String s) {
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    private static int indexOf(List<String> species, String name) {
        int idx = species.indexOf(name);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown chemical species: " + name);
        }
        return idx;
    }

    public static void main(String[] args) {
        double tEnd = Double.parseDouble(System.getenv().getOrDefault("NRM_T_END", "10000"));
        long seed = Long.parseLong(System.getenv().getOrDefault("NRM_SEED", "1298472"));

        List<String> species = Arrays.asList("mRNA", "protein");
        List<Reaction> reactions = Arrays.asList(
                createReaction(species, "", "mRNA", 0.1),
                createReaction(species, "mRNA", "mRNA protein", 0.1),
                createReaction(species, "mRNA", "", 0.1),
                createReaction(species, "protein", "", 0.002));

        Map<Reaction, List<Reaction>> dependencies = new LinkedHashMap<>();
        dependencies.put(reactions.get(0), Arrays.asList(reactions.get(1), reactions.get(2)));
        dependencies.put(reactions.get(1), Collections.singletonList(reactions.get(3)));
        dependencies.put(reactions.get(2), Collections.singletonList(reactions.get(1)));
        dependencies.put(reactions.get(3), Collections.emptyList());

        System.out.println("Simulating gene expression from t=0 to t=" + tEnd + " (seed " + seed + ")...");
        Trajectory trajectory = simulate(0, tEnd, new int[] {0, 0}, reactions, dependencies, new Random(seed));

        int[] last = trajectory.finalState();
        System.out.println("Fired " + (trajectory.size() - 1) + " events.");
        System.out.println("Final state at t=" + trajectory.times.get(trajectory.size() - 1) + ": "
                + species.get(0) + "=" + last[0] + ", " + species.get(1) + "=" + last[1]);
    }
}
