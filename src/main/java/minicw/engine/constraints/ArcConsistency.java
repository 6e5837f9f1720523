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

package minicw.engine.constraints;

import minicw.engine.core.ConstraintGraph;
import minicw.engine.core.Domains;
import minicw.engine.core.Overlap;
import minicw.engine.core.Slot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * AC-3 filtering of the overlap constraints.
 *
 * <p>After a successful {@link #ac3()}, every word left in the domain
 * of a slot x has, for each neighbor y, at least one word in the domain
 * of y carrying the same letter on the shared cell.</p>
 *
 * <p>The all-different constraint on words is not propagated here,
 * it is only checked on assignments (see {@link AllDifferent}).</p>
 */
public class ArcConsistency {

    private static final Logger log = LoggerFactory.getLogger(ArcConsistency.class);

    private final ConstraintGraph graph;
    private final Domains domains;

    private int nRevisions;
    private int nRemoved;

    public ArcConsistency(ConstraintGraph graph, Domains domains) {
        this.graph = checkNotNull(graph, "graph");
        this.domains = checkNotNull(domains, "domains");
    }

    /**
     * Makes x arc consistent with y: removes from the domain of x
     * every word with no support in the domain of y.
     * The domain of y is read as it stands at call time and left untouched.
     *
     * @param x the slot whose domain is filtered
     * @param y a neighbor of x
     * @return true iff at least one word was removed from the domain of x
     * @throws minicw.util.exception.MalformedGraphException if x and y do not cross
     *         or if their overlap falls outside one of them
     */
    public boolean revise(Slot x, Slot y) {
        Overlap o = graph.requireOverlap(x, y);
        nRevisions++;

        Set<Character> supported = new HashSet<>();
        for (String v : domains.snapshot(y)) {
            if (o.second < v.length()) supported.add(v.charAt(o.second));
        }
        int before = domains.size(x);
        boolean revised = domains.removeIf(x,
                w -> o.first >= w.length() || !supported.contains(w.charAt(o.first)));
        if (revised) {
            nRemoved += before - domains.size(x);
        }
        return revised;
    }

    /**
     * Runs AC-3 from every arc of the graph.
     *
     * @return false iff some domain is empty
     * @see #ac3(Collection)
     */
    public boolean ac3() {
        return ac3(null);
    }

    /**
     * Runs AC-3 from the given arcs.
     * Each time the domain of x shrinks while revising (x, y),
     * the arcs (z, x) for every other neighbor z of x are queued again.
     * An arc already waiting in the queue is not queued twice.
     *
     * @param initialArcs the arcs to start from,
     *                    {@code null} for every ordered pair of neighbors
     * @return false iff some domain is empty
     */
    public boolean ac3(Collection<Arc> initialArcs) {
        Deque<Arc> queue = new ArrayDeque<>();
        Set<Arc> pending = new HashSet<>();
        if (initialArcs == null) {
            for (Slot x : domains.slots()) {
                for (Slot y : graph.neighbors(x)) {
                    enqueue(queue, pending, new Arc(x, y));
                }
            }
        } else {
            for (Arc arc : initialArcs) enqueue(queue, pending, arc);
        }

        while (!queue.isEmpty()) {
            Arc arc = queue.poll();
            pending.remove(arc);
            if (revise(arc.x, arc.y)) {
                if (domains.isEmpty(arc.x)) {
                    log.debug("domain of {} wiped out by {}", arc.x, arc.y);
                    return false;
                }
                for (Slot z : graph.neighbors(arc.x)) {
                    if (!z.equals(arc.y)) enqueue(queue, pending, new Arc(z, arc.x));
                }
            }
        }
        log.debug("ac3 fixpoint after {} revisions, {} words removed", nRevisions, nRemoved);
        return !domains.hasEmptyDomain();
    }

    private static void enqueue(Deque<Arc> queue, Set<Arc> pending, Arc arc) {
        if (pending.add(arc)) queue.add(arc);
    }

    /**
     * @return the number of calls to {@link #revise(Slot, Slot)} so far
     */
    public int getRevisions() {
        return nRevisions;
    }

    /**
     * @return the number of words removed by revisions so far
     */
    public int getRemoved() {
        return nRemoved;
    }
}
