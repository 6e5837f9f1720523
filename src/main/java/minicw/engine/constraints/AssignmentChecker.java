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

import minicw.engine.core.Assignment;
import minicw.engine.core.ConstraintGraph;
import minicw.engine.core.Overlap;
import minicw.engine.core.Slot;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Checks a partial assignment against the constraints
 * between the slots it assigns: word length, all-different
 * and equal letters on every shared cell.
 * Unassigned slots are ignored.
 */
public class AssignmentChecker {

    private final ConstraintGraph graph;

    public AssignmentChecker(ConstraintGraph graph) {
        this.graph = checkNotNull(graph, "graph");
    }

    /**
     * @param assignment a partial assignment, not modified
     * @return true iff the assigned slots satisfy every constraint among them
     */
    public boolean isConsistent(Assignment assignment) {
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            if (e.getValue().length() != e.getKey().length) return false;
        }
        if (!AllDifferent.isSatisfied(assignment)) return false;

        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            Slot x = e.getKey();
            String wx = e.getValue();
            for (Slot y : graph.neighbors(x)) {
                String wy = assignment.get(y);
                if (wy == null) continue;
                Overlap o = graph.requireOverlap(x, y);
                if (wx.charAt(o.first) != wy.charAt(o.second)) return false;
            }
        }
        return true;
    }
}
