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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A partial mapping from slots to words, grown and shrunk
 * one entry at a time by the search.
 */
public final class Assignment {

    private final Map<Slot, String> values = new LinkedHashMap<>();

    /**
     * Sets the word of a slot, replacing any previous one.
     *
     * @param s    the slot
     * @param word its word
     */
    public void assign(Slot s, String word) {
        values.put(checkNotNull(s, "slot"), checkNotNull(word, "word"));
    }

    /**
     * @param s the slot to clear
     * @return the word it held, or {@code null}
     */
    public String unassign(Slot s) {
        return values.remove(s);
    }

    /**
     * @param s a slot
     * @return its word, or {@code null} if unassigned
     */
    public String get(Slot s) {
        return values.get(s);
    }

    public boolean contains(Slot s) {
        return values.containsKey(s);
    }

    public int size() {
        return values.size();
    }

    /**
     * @param domains the domains of the problem
     * @return true iff every slot having a domain is assigned
     */
    public boolean isComplete(Domains domains) {
        return domains.slots().stream().allMatch(values::containsKey);
    }

    /**
     * @return a read-only view, in assignment order
     */
    public Map<Slot, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
