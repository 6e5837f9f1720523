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

package minicw.examples;

import minicw.cp.CrosswordSolver;
import minicw.engine.core.Assignment;
import minicw.engine.core.Crossword;
import minicw.util.io.CrosswordPrinter;
import minicw.util.io.CrosswordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Crossword generation.
 * Given the layout of a grid and a list of words, place one word
 * in every horizontal and vertical run of open cells such that
 * crossing words share their letter and no word is used twice.
 *
 * <pre>
 * Usage: CrosswordGenerator structure words [output]
 * </pre>
 */
public class CrosswordGenerator {

    private static final Logger log = LoggerFactory.getLogger(CrosswordGenerator.class);

    public static void main(String[] args) {
        if (args.length != 2 && args.length != 3) {
            System.err.println("Usage: CrosswordGenerator structure words [output]");
            System.exit(1);
        }
        Path structure = Path.of(args[0]);
        Path words = Path.of(args[1]);
        Path output = args.length == 3 ? Path.of(args[2]) : null;

        try {
            Crossword crossword = CrosswordReader.read(structure, words);
            log.info("{}x{} grid, {} slots, {} words", crossword.height(), crossword.width(),
                    crossword.slots().size(), crossword.words().size());

            Assignment assignment = CrosswordSolver.solve(crossword, crossword.words());
            if (assignment == null) {
                System.out.println("No solution.");
                return;
            }
            System.out.print(CrosswordPrinter.render(crossword, assignment));
            if (output != null) {
                CrosswordPrinter.save(crossword, assignment, output);
                log.info("saved to {}", output);
            }
        } catch (IOException e) {
            log.error("cannot read or write crossword files", e);
            System.exit(1);
        }
    }
}
