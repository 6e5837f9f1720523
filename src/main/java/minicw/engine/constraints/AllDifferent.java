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
import minicw.engine.core.Slot;

import java.util.HashMap;
import java.util.Map;

/**
 * AllDifferent constraint on the words of the assigned slots.
 *
 * It is only checked on assigned slots: a word placed in one slot
 * may still sit in the domains of the other slots.
 */
public final class AllDifferent {

    private AllDifferent() {
        throw new UnsupportedOperationException();
    }

    /**
     * @param assignment a partial assignment
     * @return true iff no two assigned slots hold the same word
     */
    public static boolean isSatisfied(Assignment assignment) {
        return firstDuplicate(assignment) == null;
    }

    /**
     * @param assignment a partial assignment
     * @return a slot holding the same word as a slot assigned before it,
     *         or {@code null} if all the words differ
     */
    public static Slot firstDuplicate(Assignment assignment) {
        Map<String, Slot> seen = new HashMap<>();
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            if (seen.putIfAbsent(e.getValue(), e.getKey()) != null) {
                return e.getKey();
            }
        }
        return null;
    }
}
