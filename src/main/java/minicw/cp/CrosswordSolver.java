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

import minicw.engine.constraints.Arc;
import minicw.engine.constraints.ArcConsistency;
import minicw.engine.constraints.AssignmentChecker;
import minicw.engine.core.Assignment;
import minicw.engine.core.ConstraintGraph;
import minicw.engine.core.Domains;
import minicw.engine.core.Slot;
import minicw.search.Backtracking;
import minicw.search.SearchStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Fills a crossword: node consistency, then AC-3, then backtracking search.
 *
 * <pre>
 * {@code
 * Crossword cw = CrosswordReader.read(structureFile, wordsFile);
 * Assignment a = CrosswordSolver.solve(cw, cw.words());
 * if (a == null)
 *     System.out.println("No solution.");
 * }
 * </pre>
 *
 * A solver owns its domains and shrinks them while solving:
 * use a new instance for every solve.
 */
public class CrosswordSolver {

    private static final Logger log = LoggerFactory.getLogger(CrosswordSolver.class);

    private final ConstraintGraph graph;
    private final Domains domains;
    private final ArcConsistency arcConsistency;
    private final AssignmentChecker checker;
    private final Backtracking search;
    private boolean used = false;

    /**
     * Creates a solver whose domains are all seeded with the whole word pool.
     *
     * @param graph    the constraint graph
     * @param wordPool the candidate words
     */
    public CrosswordSolver(ConstraintGraph graph, Collection<String> wordPool) {
        this(graph, Domains.seed(graph, wordPool));
    }

    /**
     * Creates a solver on already seeded domains.
     *
     * @param graph   the constraint graph
     * @param domains the domains, owned by this solver from now on,
     *                one for every slot of the graph and no other
     * @throws IllegalArgumentException if the domains and the graph have different slots
     */
    public CrosswordSolver(ConstraintGraph graph, Domains domains) {
        this.graph = checkNotNull(graph, "graph");
        this.domains = checkNotNull(domains, "domains");
        checkArgument(domains.slots().equals(graph.slots()),
                "domains must cover exactly the slots of the graph: %s vs %s", domains.slots(), graph.slots());
        this.arcConsistency = new ArcConsistency(graph, domains);
        this.checker = new AssignmentChecker(graph);
        this.search = new Backtracking(graph, domains);
    }

    /**
     * Solves the crossword defined by a graph and a word pool.
     *
     * @param graph    the constraint graph
     * @param wordPool the candidate words
     * @return a complete consistent assignment or {@code null} if there is none
     */
    public static Assignment solve(ConstraintGraph graph, Collection<String> wordPool) {
        return new CrosswordSolver(graph, wordPool).solve();
    }

    /**
     * Enforces node and arc consistency, then searches.
     * Gives up before searching when arc consistency empties a domain.
     *
     * @return a complete consistent assignment or {@code null} if there is none
     */
    public Assignment solve() {
        checkState(!used, "a solver can only solve once");
        used = true;

        enforceNodeConsistency();
        if (domains.hasEmptyDomain()) {
            log.info("no word of the right length for some slot");
            return null;
        }
        if (!ac3()) {
            log.info("arc consistency emptied a domain, no solution");
            return null;
        }
        log.debug("domains after arc consistency:\n{}", domains);

        long t0 = System.currentTimeMillis();
        Assignment result = backtrack(new Assignment());
        log.info("search {} in {} ms {}", result == null ? "failed" : "succeeded",
                System.currentTimeMillis() - t0, search.getStatistics());
        return result;
    }

    public void enforceNodeConsistency() {
        domains.enforceNodeConsistency();
    }

    /**
     * @see ArcConsistency#revise(Slot, Slot)
     */
    public boolean revise(Slot x, Slot y) {
        return arcConsistency.revise(x, y);
    }

    /**
     * @see ArcConsistency#ac3()
     */
    public boolean ac3() {
        return arcConsistency.ac3();
    }

    /**
     * @see ArcConsistency#ac3(Collection)
     */
    public boolean ac3(Collection<Arc> initialArcs) {
        return arcConsistency.ac3(initialArcs);
    }

    public boolean isConsistent(Assignment assignment) {
        return checker.isConsistent(assignment);
    }

    public Slot selectUnassignedVariable(Assignment assignment) {
        return BranchingScheme.selectUnassignedVariable(graph, domains, assignment);
    }

    public List<String> orderDomainValues(Slot slot, Assignment assignment) {
        return BranchingScheme.orderDomainValues(graph, domains, slot, assignment);
    }

    /**
     * @see Backtracking#solve(Assignment)
     */
    public Assignment backtrack(Assignment assignment) {
        return search.solve(assignment);
    }

    public Domains domains() {
        return domains;
    }

    public SearchStatistics statistics() {
        return search.getStatistics();
    }
}
