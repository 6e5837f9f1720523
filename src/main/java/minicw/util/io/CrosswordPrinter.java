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

import minicw.engine.core.Assignment;
import minicw.engine.core.ConstraintGraph;
import minicw.engine.core.Crossword;
import minicw.engine.core.Slot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Text rendering of a filled crossword.
 */
public final class CrosswordPrinter {

    public static final char BLOCKED = '█';

    private CrosswordPrinter() {
        throw new UnsupportedOperationException();
    }

    /**
     * @param graph      the grid
     * @param assignment a possibly partial assignment
     * @return the letter of every cell, {@code null} where no word is placed
     */
    public static Character[][] letterGrid(ConstraintGraph graph, Assignment assignment) {
        Character[][] letters = new Character[graph.height()][graph.width()];
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            List<int[]> cells = e.getKey().cells();
            String word = e.getValue();
            for (int k = 0; k < word.length() && k < cells.size(); k++) {
                letters[cells.get(k)[0]][cells.get(k)[1]] = word.charAt(k);
            }
        }
        return letters;
    }

    /**
     * @param crossword  the grid
     * @param assignment a possibly partial assignment
     * @return one line per row, {@link #BLOCKED} on blocked cells
     *         and a space on open cells without a letter
     */
    public static String render(Crossword crossword, Assignment assignment) {
        Character[][] letters = letterGrid(crossword, assignment);
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < crossword.height(); i++) {
            for (int j = 0; j < crossword.width(); j++) {
                if (!crossword.isOpen(i, j)) b.append(BLOCKED);
                else b.append(letters[i][j] == null ? ' ' : letters[i][j]);
            }
            b.append('\n');
        }
        return b.toString();
    }

    /**
     * Writes {@link #render} to a UTF-8 text file.
     *
     * @throws IOException if the file cannot be written
     */
    public static void save(Crossword crossword, Assignment assignment, Path file) throws IOException {
        Files.write(file, render(crossword, assignment).getBytes(StandardCharsets.UTF_8));
    }
}
