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

import minicw.engine.core.Crossword;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads crossword instances.
 *
 * <p>A structure file has one line per row, {@code _} for a cell
 * that takes a letter and any other character for a blocked cell.
 * A words file has one word per line, blank lines are skipped.</p>
 */
public final class CrosswordReader {

    public static final char OPEN = '_';

    private CrosswordReader() {
        throw new UnsupportedOperationException();
    }

    /**
     * @param structureFile the grid layout
     * @param wordsFile     the word pool
     * @return the crossword
     * @throws IOException if a file cannot be read
     */
    public static Crossword read(Path structureFile, Path wordsFile) throws IOException {
        return new Crossword(readStructure(structureFile), readWords(wordsFile));
    }

    /**
     * @param file the grid layout
     * @return {@code s[i][j]} true iff the cell at row i and column j is open,
     *         every row as wide as the longest line
     * @throws IOException if the file cannot be read
     */
    public static boolean[][] readStructure(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        int width = lines.stream().mapToInt(String::length).max().orElse(0);
        boolean[][] structure = new boolean[lines.size()][width];
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            for (int j = 0; j < line.length(); j++) {
                structure[i][j] = line.charAt(j) == OPEN;
            }
        }
        return structure;
    }

    /**
     * @param file the word pool
     * @return the words, trimmed and upper-cased, in file order
     * @throws IOException if the file cannot be read
     */
    public static List<String> readWords(Path file) throws IOException {
        List<String> words = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String w = line.trim();
            if (!w.isEmpty()) words.add(w.toUpperCase(Locale.ROOT));
        }
        return words;
    }
}
