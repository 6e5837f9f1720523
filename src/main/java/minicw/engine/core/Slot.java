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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A variable of the crossword problem: a run of cells
 * starting at ({@code row}, {@code column}) that must hold
 * one word of exactly {@code length} letters.
 *
 * <p>Slots are immutable and compared by value.
 * The natural order (row, column, direction, length) is
 * consistent with {@link #equals} and gives the
 * solver a deterministic enumeration order.</p>
 */
public final class Slot implements Comparable<Slot> {

    /**
     * Orientation of a slot in the grid.
     */
    public enum Direction {
        ACROSS, DOWN
    }

    private static final Comparator<Slot> ORDER =
            Comparator.<Slot>comparingInt(s -> s.row)
                    .thenComparingInt(s -> s.column)
                    .thenComparing(s -> s.direction)
                    .thenComparingInt(s -> s.length);

    public final int row;
    public final int column;
    public final int length;
    public final Direction direction;

    /**
     * Creates a slot.
     *
     * @param row       zero-based row of the first cell
     * @param column    zero-based column of the first cell
     * @param length    number of cells, at least one
     * @param direction orientation of the slot
     */
    public Slot(int row, int column, int length, Direction direction) {
        checkArgument(row >= 0 && column >= 0, "negative origin (%s, %s)", row, column);
        checkArgument(length > 0, "length must be positive: %s", length);
        this.row = row;
        this.column = column;
        this.length = length;
        this.direction = checkNotNull(direction, "direction");
    }

    /**
     * @return the cells covered by this slot, in word order,
     *         each cell as {@code {row, column}}
     */
    public List<int[]> cells() {
        List<int[]> cells = new ArrayList<>(length);
        for (int k = 0; k < length; k++) {
            int i = row + (direction == Direction.DOWN ? k : 0);
            int j = column + (direction == Direction.ACROSS ? k : 0);
            cells.add(new int[]{i, j});
        }
        return Collections.unmodifiableList(cells);
    }

    @Override
    public int compareTo(Slot other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot)) return false;
        Slot other = (Slot) o;
        return row == other.row && column == other.column
                && length == other.length && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, length, direction);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ") " + direction + " : " + length;
    }
}
