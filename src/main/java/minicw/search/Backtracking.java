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

package minicw.search;

import minicw.cp.BranchingScheme;
import minicw.engine.constraints.AssignmentChecker;
import minicw.engine.core.Assignment;
import minicw.engine.core.ConstraintGraph;
import minicw.engine.core.Domains;
import minicw.engine.core.Slot;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Chronological backtracking over the slots of a crossword.
 *
 * <p>Slots are chosen with {@link BranchingScheme#selectUnassignedVariable}
 * and their words tried in the order of {@link BranchingScheme#orderDomainValues}.
 * The search stops at the first complete and consistent assignment.</p>
 */
public class Backtracking {

    private final ConstraintGraph graph;
    private final Domains domains;
    private final AssignmentChecker checker;
    private final SearchStatistics statistics = new SearchStatistics();

    public Backtracking(ConstraintGraph graph, Domains domains) {
        this.graph = checkNotNull(graph, "graph");
        this.domains = checkNotNull(domains, "domains");
        this.checker = new AssignmentChecker(graph);
    }

    /**
     * Extends a partial assignment into a complete one.
     * On success the given assignment is completed in place and returned.
     * On failure it is left as it was given.
     *
     * @param assignment a consistent partial assignment
     * @return the completed assignment or {@code null} if no completion exists
     */
    public Assignment solve(Assignment assignment) {
        checkNotNull(assignment, "assignment");
        if (dfs(assignment)) {
            statistics.incrSolutions();
            return assignment;
        }
        statistics.setCompleted();
        return null;
    }

    /**
     * @return true iff {@code assignment} was completed, false if this subtree has no solution,
     *         in which case {@code assignment} holds the same entries as on entry
     */
    private boolean dfs(Assignment assignment) {
        statistics.incrNodes();
        if (assignment.isComplete(domains)) return true;

        Slot slot = BranchingScheme.selectUnassignedVariable(graph, domains, assignment);
        if (slot == null) return false;

        for (String word : BranchingScheme.orderDomainValues(graph, domains, slot, assignment)) {
            assignment.assign(slot, word);
            if (checker.isConsistent(assignment) && dfs(assignment)) {
                return true;
            }
            assignment.unassign(slot);
        }
        statistics.incrFailures();
        return false;
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }
}
