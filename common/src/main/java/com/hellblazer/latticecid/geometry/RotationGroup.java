/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.latticecid.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The 24 proper rotations of the cube, which are exactly the orientation preserving symmetries of the FCC lattice
 * about a lattice point.
 * <p>
 * The group is not transcribed. It is generated once per process as the closure of the three quarter turns about the
 * coordinate axes under composition, filtered to determinant +1, and verified to have order 24. Element 0 is always
 * the identity; the remaining order is the breadth first discovery order and is stable across runs.
 *
 * @author hal.hildebrand
 */
public final class RotationGroup {

    public static final int ORDER = 24;

    private static final Logger log = LoggerFactory.getLogger(RotationGroup.class);

    private static final List<RotationMatrix> GENERATORS = List.of(RotationMatrix.QUARTER_TURN_X,
                                                                   RotationMatrix.QUARTER_TURN_Y,
                                                                   RotationMatrix.QUARTER_TURN_Z);

    private static final List<RotationMatrix> ROTATIONS = generate();

    private RotationGroup() {
    }

    /**
     * @return the 24 rotations, identity first; the list is unmodifiable
     */
    public static List<RotationMatrix> rotations() {
        return ROTATIONS;
    }

    public static int size() {
        return ROTATIONS.size();
    }

    public static RotationMatrix get(int index) {
        if (index < 0 || index >= ORDER) {
            throw new IllegalArgumentException("Rotation index out of range: " + index);
        }
        return ROTATIONS.get(index);
    }

    public static RotationMatrix identity() {
        return ROTATIONS.get(0);
    }

    /**
     * @param matrix candidate
     * @return index of the matrix in {@link #rotations()}, or -1 if it is not a member
     */
    public static int indexOf(RotationMatrix matrix) {
        return ROTATIONS.indexOf(matrix);
    }

    public static boolean contains(RotationMatrix matrix) {
        return ROTATIONS.contains(matrix);
    }

    /**
     * Rotate a point by the group element at the given index.
     */
    public static LatticePoint rotate(LatticePoint point, int index) {
        return get(index).apply(point);
    }

    /**
     * @return the index of the inverse of the element at {@code index}
     */
    public static int inverseOf(int index) {
        // orthogonal, so the inverse is the transpose
        return indexOf(get(index).transpose());
    }

    private static List<RotationMatrix> generate() {
        var seen = new LinkedHashSet<RotationMatrix>();
        var pending = new ArrayDeque<RotationMatrix>();
        seen.add(RotationMatrix.IDENTITY);
        pending.add(RotationMatrix.IDENTITY);
        while (!pending.isEmpty()) {
            var current = pending.poll();
            for (var generator : GENERATORS) {
                var next = generator.multiply(current);
                if (seen.add(next)) {
                    pending.add(next);
                }
            }
        }

        var proper = new ArrayList<RotationMatrix>(ORDER);
        for (var matrix : seen) {
            if (matrix.isProperRotation()) {
                proper.add(matrix);
            }
        }
        if (proper.size() != ORDER) {
            throw new IllegalStateException(
            "Rotation group generation produced " + proper.size() + " proper rotations, expected " + ORDER);
        }
        log.debug("Generated cubic rotation group: {} elements from {} generators", proper.size(),
                  GENERATORS.size());
        return Collections.unmodifiableList(proper);
    }
}
