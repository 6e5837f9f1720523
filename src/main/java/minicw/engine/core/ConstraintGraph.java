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

import minicw.util.exception.MalformedGraphException;

import java.util.Set;

/**
 * Read-only view of the binary constraint network of a crossword:
 * the slots, which slots cross, and where they cross.
 */
public interface ConstraintGraph {

    /**
     * @return every slot of the grid, in a deterministic order
     */
    Set<Slot> slots();

    /**
     * @param slot a slot of this graph
     * @return the slots crossing {@code slot}, in a deterministic order
     */
    Set<Slot> neighbors(Slot slot);

    /**
     * Returns the overlap between two slots.
     *
     * @param a a slot
     * @param b another slot
     * @return the letter index of the shared cell in {@code a} and in {@code b},
     *         or {@code null} if the slots do not cross
     */
    Overlap overlap(Slot a, Slot b);

    /**
     * @return the number of rows of the grid
     */
    int height();

    /**
     * @return the number of columns of the grid
     */
    int width();

    /**
     * Returns the overlap of two crossing slots, checked against
     * the length of both slots.
     *
     * @param a a slot
     * @param b a neighbor of {@code a}
     * @return the overlap of {@code a} and {@code b}
     * @throws MalformedGraphException if the slots do not cross or
     *         if an index falls outside its slot
     */
    default Overlap requireOverlap(Slot a, Slot b) {
        Overlap o = overlap(a, b);
        if (o == null) {
            throw new MalformedGraphException("no overlap between " + a + " and " + b);
        }
        if (o.first < 0 || o.first >= a.length || o.second < 0 || o.second >= b.length) {
            throw new MalformedGraphException("overlap " + o + " out of range for " + a + " and " + b);
        }
        return o;
    }
}
