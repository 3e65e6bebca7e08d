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

import java.util.Objects;

/**
 * Immutable point of the FCC lattice, addressed by three signed integer coordinates.
 *
 * @author hal.hildebrand
 */
public final class LatticePoint {

    /** X coordinate */
    public final int x;

    /** Y coordinate */
    public final int y;

    /** Z coordinate */
    public final int z;

    /**
     * Create a new lattice point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     * @param z Z coordinate
     */
    public LatticePoint(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Create a point at the origin (0, 0, 0).
     *
     * @return Point at origin
     */
    public static LatticePoint origin() {
        return new LatticePoint(0, 0, 0);
    }

    /**
     * Translate this point by another point taken as a vector.
     *
     * @param other Translation vector
     * @return New point with summed coordinates
     */
    public LatticePoint add(LatticePoint other) {
        return new LatticePoint(x + other.x, y + other.y, z + other.z);
    }

    /**
     * Subtract another point from this point.
     *
     * @param other Point to subtract
     * @return New point with subtracted coordinates
     */
    public LatticePoint subtract(LatticePoint other) {
        return new LatticePoint(x - other.x, y - other.y, z - other.z);
    }

    /**
     * @return Point reflected through the origin
     */
    public LatticePoint negate() {
        return new LatticePoint(-x, -y, -z);
    }

    /**
     * Component-wise minimum of this point and another.
     *
     * @param other Other point
     * @return Corner point holding the smaller coordinate on each axis
     */
    public LatticePoint min(LatticePoint other) {
        return new LatticePoint(Math.min(x, other.x), Math.min(y, other.y), Math.min(z, other.z));
    }

    /**
     * Component-wise maximum of this point and another.
     *
     * @param other Other point
     * @return Corner point holding the larger coordinate on each axis
     */
    public LatticePoint max(LatticePoint other) {
        return new LatticePoint(Math.max(x, other.x), Math.max(y, other.y), Math.max(z, other.z));
    }

    /**
     * Render as the decimal triple {@code x,y,z} used by canonical serialization. No padding and no spaces; negative
     * values carry a leading minus sign.
     *
     * @return Canonical text of this point
     */
    public String toCanonicalString() {
        return x + "," + y + "," + z;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LatticePoint other)) return false;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    @Override
    public String toString() {
        return String.format("LatticePoint(%d, %d, %d)", x, y, z);
    }

    /**
     * Create point from array [x, y, z].
     *
     * @param array Array with exactly 3 elements
     * @return Point from array
     * @throws IllegalArgumentException if array length is not 3
     */
    public static LatticePoint fromArray(int[] array) {
        if (array.length != 3) {
            throw new IllegalArgumentException("Array must have exactly 3 elements, got: " + array.length);
        }
        return new LatticePoint(array[0], array[1], array[2]);
    }
}
