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

import minicw.engine.constraints.AssignmentChecker;
import minicw.engine.core.Assignment;
import minicw.engine.core.Crossword;
import minicw.engine.core.Domains;
import minicw.engine.core.Slot;
import minicw.engine.core.Slot.Direction;
import minicw.util.Grids;
import minicw.util.io.CrosswordReader;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class BacktrackingTest {

    private static final Slot ACROSS0 = new Slot(0, 1, 3, Direction.ACROSS);

    private static Backtracking search(Crossword cw) {
        Domains d = Domains.seed(cw, cw.words());
        d.enforceNodeConsistency();
        return new Backtracking(cw, d);
    }

    @Test
    public void findsTheSolutionWithoutArcConsistency() throws IOException {
        Crossword cw = CrosswordReader.read(Grids.data("structure0.txt"), Grids.data("words0.txt"));
        Backtracking search = search(cw);
        Assignment a = search.solve(new Assignment());

        assertNotNull(a);
        assertEquals(4, a.size());
        assertTrue(new AssignmentChecker(cw).isConsistent(a));
        assertEquals("SIX", a.get(ACROSS0));
        assertEquals(1, search.getStatistics().numberOfSolutions());
        assertTrue(search.getStatistics().numberOfNodes() >= 5);
        assertFalse(search.getStatistics().isCompleted());
    }

    @Test
    public void completesAPartialAssignment() throws IOException {
        Crossword cw = CrosswordReader.read(Grids.data("structure0.txt"), Grids.data("words0.txt"));
        Assignment start = new Assignment();
        start.assign(ACROSS0, "SIX");
        Assignment a = search(cw).solve(start);
        assertSame(start, a);
        assertEquals("NINE", a.get(new Slot(4, 1, 4, Direction.ACROSS)));
    }

    @Test
    public void failureLeavesTheAssignmentAsGiven() throws IOException {
        Crossword cw = CrosswordReader.read(Grids.data("structure0.txt"), Grids.data("words0.txt"));
        Assignment start = new Assignment();
        start.assign(ACROSS0, "TWO");
        Backtracking search = search(cw);

        assertNull(search.solve(start));
        assertEquals(1, start.size());
        assertEquals("TWO", start.get(ACROSS0));
        assertTrue(search.getStatistics().isCompleted());
        assertTrue(search.getStatistics().numberOfFailures() > 0);
        assertEquals(0, search.getStatistics().numberOfSolutions());
    }

    @Test
    public void repeatedWordsAreNeverAccepted() {
        // the middle letters of CAT, DOG and ART all differ, only a repeated word would fit
        Crossword cw = Grids.crossword(Grids.PLUS, "cat", "dog", "art");
        Assignment start = new Assignment();
        assertNull(search(cw).solve(start));
        assertEquals(0, start.size());
    }
}
