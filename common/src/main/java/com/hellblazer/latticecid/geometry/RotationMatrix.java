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

import java.util.Arrays;

/**
 * Immutable 3x3 integer matrix acting on lattice points by left multiplication. Instances of interest are the
 * signed permutation matrices of the cube, but the arithmetic is general.
 *
 * @author hal.hildebrand
 */
public final class RotationMatrix {

    public static final RotationMatrix IDENTITY = new RotationMatrix(1, 0, 0, 0, 1, 0, 0, 0, 1);

    /** 90 degrees about +X, carrying +Y to +Z */
    public static final RotationMatrix QUARTER_TURN_X = new RotationMatrix(1, 0, 0, 0, 0, -1, 0, 1, 0);

    /** 90 degrees about +Y, carrying +Z to +X */
    public static final RotationMatrix QUARTER_TURN_Y = new RotationMatrix(0, 0, 1, 0, 1, 0, -1, 0, 0);

    /** 90 degrees about +Z, carrying +X to +Y */
    public static final RotationMatrix QUARTER_TURN_Z = new RotationMatrix(0, -1, 0, 1, 0, 0, 0, 0, 1);

    // row major
    private final int[] m;

    public RotationMatrix(int m00, int m01, int m02, int m10, int m11, int m12, int m20, int m21, int m22) {
        this.m = new int[] { m00, m01, m02, m10, m11, m12, m20, m21, m22 };
    }

    /**
     * Rotate a lattice point: exact integer matrix-vector product.
     *
     * @param p point to rotate
     * @return the image of p
     */
    public LatticePoint apply(LatticePoint p) {
        return new LatticePoint(m[0] * p.x + m[1] * p.y + m[2] * p.z, m[3] * p.x + m[4] * p.y + m[5] * p.z,
                                m[6] * p.x + m[7] * p.y + m[8] * p.z);
    }

    /**
     * @param other right hand operand
     * @return {@code this * other}, the transform applying {@code other} first
     */
    public RotationMatrix multiply(RotationMatrix other) {
        var r = new int[9];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                int sum = 0;
                for (int k = 0; k < 3; k++) {
                    sum += m[i * 3 + k] * other.m[k * 3 + j];
                }
                r[i * 3 + j] = sum;
            }
        }
        return new RotationMatrix(r[0], r[1], r[2], r[3], r[4], r[5], r[6], r[7], r[8]);
    }

    public RotationMatrix transpose() {
        return new RotationMatrix(m[0], m[3], m[6], m[1], m[4], m[7], m[2], m[5], m[8]);
    }

    public int determinant() {
        return m[0] * (m[4] * m[8] - m[5] * m[7]) - m[1] * (m[3] * m[8] - m[5] * m[6]) + m[2] * (m[3] * m[7]
                                                                                                 - m[4] * m[6]);
    }

    /**
     * @return true if every entry is in {-1, 0, 1} and each row and column holds exactly one non-zero entry
     */
    public boolean isSignedPermutation() {
        var columnHits = new int[3];
        for (int i = 0; i < 3; i++) {
            int rowHits = 0;
            for (int j = 0; j < 3; j++) {
                int e = m[i * 3 + j];
                if (e < -1 || e > 1) {
                    return false;
                }
                if (e != 0) {
                    rowHits++;
                    columnHits[j]++;
                }
            }
            if (rowHits != 1) {
                return false;
            }
        }
        return columnHits[0] == 1 && columnHits[1] == 1 && columnHits[2] == 1;
    }

    /**
     * @return true if {@code M * M^T} is the identity
     */
    public boolean isOrthogonal() {
        return multiply(transpose()).equals(IDENTITY);
    }

    /**
     * @return true for an orientation preserving isometry of the integer lattice
     */
    public boolean isProperRotation() {
        return isSignedPermutation() && determinant() == 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RotationMatrix other)) return false;
        return Arrays.equals(m, other.m);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(m);
    }

    @Override
    public String toString() {
        return String.format("[[%d, %d, %d], [%d, %d, %d], [%d, %d, %d]]", m[0], m[1], m[2], m[3], m[4], m[5], m[6],
                             m[7], m[8]);
    }
}
