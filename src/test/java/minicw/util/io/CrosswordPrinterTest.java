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

package minicw.util.io;

import minicw.cp.CrosswordSolver;
import minicw.engine.core.Assignment;
import minicw.engine.core.Crossword;
import minicw.engine.core.Slot;
import minicw.engine.core.Slot.Direction;
import minicw.util.Grids;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CrosswordPrinterTest {

    private static final String SOLVED0 =
            "█SIX█\n" +
            "█E██F\n" +
            "█V██I\n" +
            "█E██V\n" +
            "█NINE\n";

    @TempDir
    Path dir;

    @Test
    public void renderSolvedGrid() throws IOException {
        Crossword cw = CrosswordReader.read(Grids.data("structure0.txt"), Grids.data("words0.txt"));
        Assignment a = CrosswordSolver.solve(cw, cw.words());
        assertEquals(SOLVED0, CrosswordPrinter.render(cw, a));
    }

    @Test
    public void partialAssignmentLeavesBlanks() {
        Crossword cw = Grids.crossword(Grids.CORNER, "cat");
        Assignment a = new Assignment();
        a.assign(new Slot(0, 0, 3, Direction.ACROSS), "CAT");

        Character[][] letters = CrosswordPrinter.letterGrid(cw, a);
        assertEquals(Character.valueOf('A'), letters[0][1]);
        assertNull(letters[1][1]);
        assertNull(letters[1][0]);
        assertEquals("CAT\n█ █\n█ █\n", CrosswordPrinter.render(cw, a));
    }

    @Test
    public void saveWritesTheRendering() throws IOException {
        Crossword cw = Grids.crossword(Grids.CORNER, "cat", "art");
        Assignment a = new Assignment();
        a.assign(new Slot(0, 0, 3, Direction.ACROSS), "CAT");
        a.assign(new Slot(0, 1, 3, Direction.DOWN), "ART");
        Path out = dir.resolve("out.txt");
        CrosswordPrinter.save(cw, a, out);
        assertEquals("CAT\n█R█\n█T█\n", Files.readString(out, StandardCharsets.UTF_8));
    }
}
