/*
 * mini-cp is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License  v3
 * as published by the Free Software Foundation.
 *
 * mini-cp is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY.
 * See the GNU Lesser General Public License  for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with mini-cp. If not, see http://www.gnu.org/licenses/lgpl-3.0.en.html
 *
 * Copyright (c)  2018. by Laurent Michel, Pierre Schaus, Pascal Van Hentenryck
 */

package minicw.cp;

import minicw.engine.core.Assignment;
import minicw.engine.core.ConstraintGraph;
import minicw.engine.core.Domains;
import minicw.engine.core.Overlap;
import minicw.engine.core.Slot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Variable and value selection heuristics.
 *
 * <p>A typical branching step of the backtracking search reads</p>
 *  <pre>
 * {@code
 * Slot s = BranchingScheme.selectUnassignedVariable(graph, domains, assignment);
 * if (s == null)
 *    return; // every slot is assigned
 * for (String w : BranchingScheme.orderDomainValues(graph, domains, s, assignment)) {
 *    assignment.assign(s, w);
 *    ...
 *    assignment.unassign(s);
 * }
 * }
 * </pre>
 * @see minicw.search.Backtracking
 */
public final class BranchingScheme {

    private BranchingScheme() {
        throw new UnsupportedOperationException();
    }

    /**
     * Minimum selector.
     * <p>Example of usage.
     * <pre>
     * {@code
     * Slot s = selectMin(domains.slots(), si -> !assignment.contains(si), Comparator.comparingInt(domains::size));
     * }
     * </pre>
     *
     * @param x the elements among which the minimum is searched
     * @param p the predicate that filters the element eligible for selection
     * @param c the order on the elements, the first minimum in iteration order wins ties
     * @param <T> the type of the elements in x, for instance {@link Slot}
     * @return the minimum element in x that satisfies the predicate p
     *         or null if no element satisfies the predicate.
     */
    public static <T> T selectMin(Iterable<T> x, Predicate<T> p, Comparator<T> c) {
        T sel = null;
        for (T xi : x) {
            if (p.test(xi)) {
                sel = sel == null || c.compare(xi, sel) < 0 ? xi : sel;
            }
        }
        return sel;
    }

    /**
     * Minimum-remaining-values strategy with the degree heuristic as tie-break.
     * It selects the unassigned slot with the fewest words left in its domain.
     * Among those, the one crossing the largest number of slots.
     * Remaining ties go to the first slot in the order of the domains.
     *
     * @param graph      the constraint graph
     * @param domains    the current domains
     * @param assignment the partial assignment
     * @return the next slot to assign or null if every slot is assigned
     */
    public static Slot selectUnassignedVariable(ConstraintGraph graph, Domains domains, Assignment assignment) {
        Comparator<Slot> mrv = Comparator.comparingInt(domains::size);
        Comparator<Slot> degree = Comparator.comparingInt((Slot s) -> graph.neighbors(s).size()).reversed();
        return selectMin(domains.slots(), s -> !assignment.contains(s), mrv.thenComparing(degree));
    }

    /**
     * Least-constraining-value strategy.
     * Orders the domain of a slot by the number of words each value
     * rules out in the domains of the neighbors, fewest first.
     * A word w rules out a neighbor word v when they differ on the shared cell.
     * Equal counts keep the order of the domain. Domains are not modified.
     *
     * @param graph      the constraint graph
     * @param domains    the current domains
     * @param slot       the slot whose values are ordered
     * @param assignment the partial assignment
     * @return the words of the domain of {@code slot}, least constraining first
     */
    public static List<String> orderDomainValues(ConstraintGraph graph, Domains domains, Slot slot, Assignment assignment) {
        // letter counts on the shared cell of every neighbor
        List<Overlap> overlaps = new ArrayList<>();
        List<Map<Character, Integer>> letters = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        for (Slot n : graph.neighbors(slot)) {
            Overlap o = graph.requireOverlap(slot, n);
            Map<Character, Integer> count = new HashMap<>();
            for (String v : domains.get(n)) {
                if (o.second < v.length()) count.merge(v.charAt(o.second), 1, Integer::sum);
            }
            overlaps.add(o);
            letters.add(count);
            sizes.add(domains.size(n));
        }

        Map<String, Integer> ruledOut = new HashMap<>();
        for (String w : domains.get(slot)) {
            int n = 0;
            for (int k = 0; k < overlaps.size(); k++) {
                int i = overlaps.get(k).first;
                int same = i < w.length() ? letters.get(k).getOrDefault(w.charAt(i), 0) : 0;
                n += sizes.get(k) - same;
            }
            ruledOut.put(w, n);
        }

        List<String> ordered = new ArrayList<>(domains.get(slot));
        ordered.sort(Comparator.comparingInt(ruledOut::get));
        return ordered;
    }
}
