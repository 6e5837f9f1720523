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

package minicw.engine.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The candidate words still considered legal for each slot.
 *
 * <p>Domains only shrink: values are removed by node consistency
 * and arc consistency and never added back. Enumeration follows
 * the order in which the words were seeded.</p>
 */
public final class Domains {

    private final Map<Slot, Set<String>> domains = new LinkedHashMap<>();

    private Domains() {
    }

    /**
     * Seeds every slot of the graph with the whole word pool.
     *
     * @param graph    the constraint graph
     * @param wordPool the candidate words
     * @return fresh domains, not yet node consistent
     */
    public static Domains seed(ConstraintGraph graph, Collection<String> wordPool) {
        checkNotNull(graph, "graph");
        checkNotNull(wordPool, "wordPool");
        Domains d = new Domains();
        for (Slot s : graph.slots()) {
            d.domains.put(s, new LinkedHashSet<>(wordPool));
        }
        return d;
    }

    /**
     * Seeds each slot with its own candidate list,
     * for word sources that are already scoped per slot.
     *
     * @param candidates the candidates of each slot
     * @return fresh domains, not yet node consistent
     */
    public static Domains seed(Map<Slot, ? extends Collection<String>> candidates) {
        checkNotNull(candidates, "candidates");
        Domains d = new Domains();
        candidates.forEach((s, words) -> d.domains.put(s, new LinkedHashSet<>(words)));
        return d;
    }

    /**
     * Removes every word whose length differs from its slot's length.
     * Domains may become empty; this is left to the caller to detect.
     */
    public void enforceNodeConsistency() {
        domains.forEach((s, words) -> words.removeIf(w -> w.length() != s.length));
    }

    /**
     * @return the slots, in seeding order
     */
    public Set<Slot> slots() {
        return Collections.unmodifiableSet(domains.keySet());
    }

    /**
     * @param s a slot
     * @return a read-only view of the domain of {@code s}
     */
    public Set<String> get(Slot s) {
        return Collections.unmodifiableSet(domain(s));
    }

    /**
     * @param s a slot
     * @return a copy of the domain of {@code s} as it stands now
     */
    public Set<String> snapshot(Slot s) {
        return new LinkedHashSet<>(domain(s));
    }

    public int size(Slot s) {
        return domain(s).size();
    }

    public boolean isEmpty(Slot s) {
        return domain(s).isEmpty();
    }

    /**
     * @return true iff at least one slot has no candidate left
     */
    public boolean hasEmptyDomain() {
        return domains.values().stream().anyMatch(Set::isEmpty);
    }

    /**
     * @param s    a slot
     * @param word the word to remove
     * @return true iff the word was in the domain
     */
    public boolean remove(Slot s, String word) {
        return domain(s).remove(word);
    }

    /**
     * @param s      a slot
     * @param filter the words to remove
     * @return true iff at least one word was removed
     */
    public boolean removeIf(Slot s, Predicate<String> filter) {
        return domain(s).removeIf(filter);
    }

    private Set<String> domain(Slot s) {
        Set<String> words = domains.get(s);
        checkArgument(words != null, "no domain for slot %s", s);
        return words;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        domains.forEach((s, words) -> b.append(s).append(" -> ").append(words).append('\n'));
        return b.toString();
    }
}
