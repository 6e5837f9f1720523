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

import minicw.engine.core.Slot.Direction;
import minicw.util.Grids;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DomainsTest {

    @Test
    public void seedGivesTheWholePoolToEverySlot() {
        Crossword cw = Grids.crossword(Grids.LADDER, "crane", "cue", "to");
        Domains d = Domains.seed(cw, cw.words());
        assertEquals(cw.slots(), d.slots());
        for (Slot s : d.slots()) {
            assertEquals(List.of("CRANE", "CUE", "TO"), List.copyOf(d.get(s)));
        }
    }

    @Test
    public void nodeConsistencyKeepsWordsOfTheSlotLength() {
        Crossword cw = Grids.crossword(Grids.LADDER, "crane", "cue", "to", "eaten", "ant");
        Domains d = Domains.seed(cw, cw.words());
        d.enforceNodeConsistency();
        for (Slot s : d.slots()) {
            assertFalse(d.isEmpty(s));
            for (String w : d.get(s)) {
                assertEquals(s.length, w.length());
            }
        }
        assertEquals(Set.of("CRANE", "EATEN"), d.get(new Slot(0, 0, 5, Direction.ACROSS)));
        assertEquals(Set.of("CUE", "ANT"), d.get(new Slot(0, 2, 3, Direction.DOWN)));
        assertFalse(d.hasEmptyDomain());
    }

    @Test
    public void nodeConsistencyMayEmptyADomain() {
        Crossword cw = Grids.crossword(Grids.LADDER, "crane");
        Domains d = Domains.seed(cw, cw.words());
        d.enforceNodeConsistency();
        assertTrue(d.hasEmptyDomain());
        assertTrue(d.isEmpty(new Slot(0, 4, 3, Direction.DOWN)));
    }

    @Test
    public void slotScopedSeed() {
        Slot a = new Slot(0, 0, 3, Direction.ACROSS);
        Slot b = new Slot(0, 0, 3, Direction.DOWN);
        Domains d = Domains.seed(Map.of(a, List.of("CAT", "DOGS"), b, List.of("ART")));
        d.enforceNodeConsistency();
        assertEquals(Set.of("CAT"), d.get(a));
        assertEquals(1, d.size(b));
    }

    @Test
    public void viewsAreReadOnlyAndSnapshotsAreCopies() {
        Slot a = new Slot(0, 0, 3, Direction.ACROSS);
        Domains d = Domains.seed(Map.of(a, List.of("CAT", "ART")));
        assertThrows(UnsupportedOperationException.class, () -> d.get(a).remove("CAT"));
        Set<String> snapshot = d.snapshot(a);
        assertTrue(d.remove(a, "CAT"));
        assertFalse(d.remove(a, "CAT"));
        assertEquals(Set.of("CAT", "ART"), snapshot);
        assertEquals(Set.of("ART"), d.get(a));
        assertThrows(IllegalArgumentException.class, () -> d.size(new Slot(9, 9, 3, Direction.DOWN)));
    }
}
