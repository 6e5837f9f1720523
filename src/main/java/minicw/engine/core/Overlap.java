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

/**
 * The shared cell of two crossing slots, expressed as
 * the letter index within each slot's word.
 */
public final class Overlap {

    public final int first;
    public final int second;

    public Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    /**
     * @return the same cell seen from the other slot
     */
    public Overlap reverse() {
        return new Overlap(second, first);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap other = (Overlap) o;
        return first == other.first && second == other.second;
    }

    @Override
    public int hashCode() {
        return 31 * first + second;
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
