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

import minicw.engine.core.Slot;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Ordered pair of crossing slots: revising the arc (x, y)
 * filters the domain of x against the domain of y.
 */
public final class Arc {

    public final Slot x;
    public final Slot y;

    public Arc(Slot x, Slot y) {
        this.x = checkNotNull(x, "x");
        this.y = checkNotNull(y, "y");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arc)) return false;
        Arc other = (Arc) o;
        return x.equals(other.x) && y.equals(other.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "[" + x + " -> " + y + "]";
    }
}
