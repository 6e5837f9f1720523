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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A crossword grid together with its word pool.
 *
 * <p>Every maximal horizontal or vertical run of at least two
 * open cells is a {@link Slot}. Two slots are neighbors when
 * they share a cell.</p>
 *
 * <pre>
 * {@code
 * boolean[][] structure = {
 *     {true,  true,  true},
 *     {false, true,  false},
 *     {false, true,  false}};
 * Crossword cw = new Crossword(structure, List.of("cat", "art", "dog"));
 * // one ACROSS slot at (0,0) and one DOWN slot at (0,1), crossing at (1, 0)
 * }
 * </pre>
 */
public class Crossword implements ConstraintGraph {

    private final int height;
    private final int width;
    private final boolean[][] structure;
    private final Set<String> words;
    private final Set<Slot> slots;
    private final Map<Slot, Map<Slot, Overlap>> overlaps = new HashMap<>();

    /**
     * Creates a crossword.
     *
     * @param structure {@code structure[i][j]} is true iff the cell
     *                  at row i and column j can hold a letter,
     *                  rows shorter than the widest one are padded with blocked cells
     * @param words     the word pool, upper-cased, duplicates dropped,
     *                  first occurrence order kept
     */
    public Crossword(boolean[][] structure, Collection<String> words) {
        checkNotNull(structure, "structure");
        checkNotNull(words, "words");
        this.height = structure.length;
        int w = 0;
        for (boolean[] row : structure) w = Math.max(w, row.length);
        this.width = w;
        this.structure = new boolean[height][width];
        for (int i = 0; i < height; i++) {
            System.arraycopy(structure[i], 0, this.structure[i], 0, structure[i].length);
        }

        Set<String> pool = new LinkedHashSet<>();
        for (String word : words) {
            checkArgument(word != null && !word.isEmpty(), "empty word in pool");
            pool.add(word.toUpperCase(Locale.ROOT));
        }
        this.words = Collections.unmodifiableSet(pool);

        this.slots = Collections.unmodifiableSet(findSlots());
        for (Slot a : slots) overlaps.put(a, new LinkedHashMap<>());
        List<Slot> ordered = new ArrayList<>(slots);
        for (int k = 0; k < ordered.size(); k++) {
            for (int l = k + 1; l < ordered.size(); l++) {
                Slot a = ordered.get(k);
                Slot b = ordered.get(l);
                Overlap o = intersect(a, b);
                if (o != null) {
                    overlaps.get(a).put(b, o);
                    overlaps.get(b).put(a, o.reverse());
                }
            }
        }
    }

    private Set<Slot> findSlots() {
        Set<Slot> found = new LinkedHashSet<>();
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                if (!structure[i][j]) continue;
                if (j == 0 || !structure[i][j - 1]) {
                    int length = 1;
                    while (j + length < width && structure[i][j + length]) length++;
                    if (length > 1) found.add(new Slot(i, j, length, Direction.ACROSS));
                }
                if (i == 0 || !structure[i - 1][j]) {
                    int length = 1;
                    while (i + length < height && structure[i + length][j]) length++;
                    if (length > 1) found.add(new Slot(i, j, length, Direction.DOWN));
                }
            }
        }
        return found;
    }

    private static Overlap intersect(Slot a, Slot b) {
        List<int[]> ca = a.cells();
        List<int[]> cb = b.cells();
        for (int k = 0; k < ca.size(); k++) {
            for (int l = 0; l < cb.size(); l++) {
                if (ca.get(k)[0] == cb.get(l)[0] && ca.get(k)[1] == cb.get(l)[1]) {
                    return new Overlap(k, l);
                }
            }
        }
        return null;
    }

    /**
     * @return the word pool, upper-cased
     */
    public Set<String> words() {
        return words;
    }

    /**
     * @param i row
     * @param j column
     * @return true iff the cell exists and can hold a letter
     */
    public boolean isOpen(int i, int j) {
        return i >= 0 && i < height && j >= 0 && j < width && structure[i][j];
    }

    @Override
    public Set<Slot> slots() {
        return slots;
    }

    @Override
    public Set<Slot> neighbors(Slot slot) {
        Map<Slot, Overlap> row = overlaps.get(slot);
        checkArgument(row != null, "unknown slot %s", slot);
        return Collections.unmodifiableSet(row.keySet());
    }

    @Override
    public Overlap overlap(Slot a, Slot b) {
        Map<Slot, Overlap> row = overlaps.get(a);
        return row == null ? null : row.get(b);
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int width() {
        return width;
    }
}
