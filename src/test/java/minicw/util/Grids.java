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

package minicw.util;

import minicw.engine.core.Assignment;
import minicw.engine.core.ConstraintGraph;
import minicw.engine.core.Crossword;
import minicw.engine.core.Overlap;
import minicw.engine.core.Slot;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Small crossword instances and a naive reference solver for tests.
 */
public final class Grids {

    /** One ACROSS word on row 0 and one DOWN word on column 1, crossing at (1, 0). */
    public static final String[] CORNER = {"___", "#_#", "#_#"};

    /** One DOWN word on column 1 and one ACROSS word on row 1, crossing at their middle letters. */
    public static final String[] PLUS = {"#_#", "___", "#_#"};

    /** Two ACROSS words of 5 letters joined by three DOWN words of 3 letters. */
    public static final String[] LADDER = {"_____", "_#_#_", "_____"};

    private Grids() {
        throw new UnsupportedOperationException();
    }

    /**
     * @param name a file under {@code src/test/resources/data}
     * @return its path
     */
    public static Path data(String name) {
        try {
            return Path.of(Grids.class.getResource("/data/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static boolean[][] structure(String... rows) {
        boolean[][] s = new boolean[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            s[i] = new boolean[rows[i].length()];
            for (int j = 0; j < rows[i].length(); j++) {
                s[i][j] = rows[i].charAt(j) == '_';
            }
        }
        return s;
    }

    public static Crossword crossword(String[] rows, String... words) {
        return new Crossword(structure(rows), Arrays.asList(words));
    }

    /**
     * @return true iff the words can be placed, found by plain
     *         enumeration in slot order without any filtering
     */
    public static boolean hasSolution(ConstraintGraph graph, Collection<String> pool) {
        return enumerate(graph, new ArrayList<>(graph.slots()), 0, pool, new Assignment());
    }

    private static boolean enumerate(ConstraintGraph graph, List<Slot> slots, int k,
                                     Collection<String> pool, Assignment a) {
        if (k == slots.size()) return true;
        Slot s = slots.get(k);
        for (String w : pool) {
            a.assign(s, w);
            if (fits(graph, a, s) && enumerate(graph, slots, k + 1, pool, a)) return true;
            a.unassign(s);
        }
        return false;
    }

    private static boolean fits(ConstraintGraph graph, Assignment a, Slot s) {
        String w = a.get(s);
        if (w.length() != s.length) return false;
        Set<String> seen = new HashSet<>(a.asMap().values());
        if (seen.size() != a.size()) return false;
        for (Slot n : graph.neighbors(s)) {
            String v = a.get(n);
            Overlap o = graph.overlap(s, n);
            if (v != null && w.charAt(o.first) != v.charAt(o.second)) return false;
        }
        return true;
    }
}
