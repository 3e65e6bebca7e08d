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

package com.hellblazer.latticecid.cid;

import com.hellblazer.latticecid.cid.CidException.InvalidCoordinateException;
import com.hellblazer.latticecid.geometry.LatticePoint;
import com.hellblazer.latticecid.geometry.RotationMatrix;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * An immutable collection of lattice points forming one rigid body.
 * <p>
 * Points are kept in the order supplied, duplicates included; whether duplicates count is decided at
 * canonicalization time by {@link CanonicalizationConfig#isDeduplicate()}. Every factory enforces the input contract:
 * each coordinate is an integer within {@code [-COORDINATE_LIMIT, COORDINATE_LIMIT]}, which keeps every rotation and
 * re-centring of the shape inside {@code int} range.
 *
 * @author hal.hildebrand
 */
public final class Shape implements Iterable<LatticePoint> {

    /** Largest magnitude of a coordinate; the widest shape then spans at most {@code 2^31 - 2} per axis */
    public static final int COORDINATE_LIMIT = (1 << 30) - 1;

    private static final Shape EMPTY = new Shape(List.of());

    private final List<LatticePoint> points;

    private Shape(List<LatticePoint> points) {
        this.points = points;
    }

    public static Shape empty() {
        return EMPTY;
    }

    public static Shape of(LatticePoint... points) {
        return of(points == null ? null : Arrays.asList(points));
    }

    /**
     * @param points lattice points in any order
     * @return the shape
     * @throws InvalidCoordinateException if a point is null or lies outside the supported range
     */
    public static Shape of(Collection<LatticePoint> points) {
        Objects.requireNonNull(points, "points cannot be null");
        var copy = new ArrayList<LatticePoint>(points.size());
        int index = 0;
        for (var p : points) {
            if (p == null) {
                throw new InvalidCoordinateException(index, "point is null");
            }
            checkRange(index, p.x);
            checkRange(index, p.y);
            checkRange(index, p.z);
            copy.add(p);
            index++;
        }
        return copy.isEmpty() ? EMPTY : new Shape(Collections.unmodifiableList(copy));
    }

    /**
     * @param coordinates one {@code [x, y, z]} row per point
     */
    public static Shape fromIntArrays(int[][] coordinates) {
        Objects.requireNonNull(coordinates, "coordinates cannot be null");
        var result = new ArrayList<LatticePoint>(coordinates.length);
        for (int i = 0; i < coordinates.length; i++) {
            var row = coordinates[i];
            checkArity(i, row == null ? -1 : row.length);
            result.add(LatticePoint.fromArray(row));
        }
        return of(result);
    }

    /**
     * Accept floating point input, such as decoded JSON numbers, rejecting anything that is not exactly an integer.
     *
     * @param coordinates one {@code [x, y, z]} row per point
     * @throws InvalidCoordinateException for NaN, infinite, fractional or out of range values
     */
    public static Shape fromCoordinates(double[][] coordinates) {
        Objects.requireNonNull(coordinates, "coordinates cannot be null");
        var result = new ArrayList<LatticePoint>(coordinates.length);
        for (int i = 0; i < coordinates.length; i++) {
            var row = coordinates[i];
            checkArity(i, row == null ? -1 : row.length);
            result.add(new LatticePoint(toCoordinate(i, row[0]), toCoordinate(i, row[1]), toCoordinate(i, row[2])));
        }
        return of(result);
    }

    /**
     * @param coordinates one {@code [x, y, z]} list per point, of any {@link Number} type
     * @throws InvalidCoordinateException if a value is null or not an in-range integer
     */
    public static Shape fromNumbers(List<? extends List<? extends Number>> coordinates) {
        Objects.requireNonNull(coordinates, "coordinates cannot be null");
        var result = new ArrayList<LatticePoint>(coordinates.size());
        int i = 0;
        for (var row : coordinates) {
            checkArity(i, row == null ? -1 : row.size());
            result.add(new LatticePoint(toCoordinate(i, row.get(0)), toCoordinate(i, row.get(1)),
                                        toCoordinate(i, row.get(2))));
            i++;
        }
        return of(result);
    }

    public List<LatticePoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return the points with later duplicates removed, first occurrence order preserved
     */
    public List<LatticePoint> distinctPoints() {
        return List.copyOf(new LinkedHashSet<>(points));
    }

    public boolean hasDuplicates() {
        return new LinkedHashSet<>(points).size() != points.size();
    }

    /**
     * @return this shape with every point multiplied by the matrix
     */
    public Shape rotate(RotationMatrix rotation) {
        var result = new ArrayList<LatticePoint>(points.size());
        for (var p : points) {
            result.add(rotation.apply(p));
        }
        return of(result);
    }

    /**
     * @return this shape shifted by the given vector
     * @throws InvalidCoordinateException if the shift carries a point out of range
     */
    public Shape translate(LatticePoint offset) {
        var result = new ArrayList<LatticePoint>(points.size());
        for (int i = 0; i < points.size(); i++) {
            var p = points.get(i);
            result.add(new LatticePoint(checkRange(i, (long) p.x + offset.x), checkRange(i, (long) p.y + offset.y),
                                        checkRange(i, (long) p.z + offset.z)));
        }
        return of(result);
    }

    @Override
    public Iterator<LatticePoint> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Shape other)) return false;
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "Shape" + points;
    }

    private static void checkArity(int index, int length) {
        if (length < 0) {
            throw new InvalidCoordinateException(index, "point is null");
        }
        if (length != 3) {
            throw new InvalidCoordinateException(index, "expected [x, y, z], got " + length + " values");
        }
    }

    private static int checkRange(int index, long value) {
        if (value < -COORDINATE_LIMIT || value > COORDINATE_LIMIT) {
            throw new InvalidCoordinateException(index,
                                                 value + " is outside [-" + COORDINATE_LIMIT + ", " + COORDINATE_LIMIT
                                                 + "]");
        }
        return (int) value;
    }

    private static int toCoordinate(int index, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidCoordinateException(index, "non-finite value " + value);
        }
        if (Math.rint(value) != value) {
            throw new InvalidCoordinateException(index, "non-integer value " + value);
        }
        if (Math.abs(value) > COORDINATE_LIMIT) {
            throw new InvalidCoordinateException(index,
                                                 value + " is outside [-" + COORDINATE_LIMIT + ", " + COORDINATE_LIMIT
                                                 + "]");
        }
        return (int) value;
    }

    private static int toCoordinate(int index, Number value) {
        if (value == null) {
            throw new InvalidCoordinateException(index, "coordinate is null");
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return checkRange(index, value.longValue());
        }
        if (value instanceof BigInteger big) {
            if (big.bitLength() > 62) {
                throw new InvalidCoordinateException(index, big + " is outside the supported range");
            }
            return checkRange(index, big.longValue());
        }
        if (value instanceof BigDecimal decimal) {
            BigInteger exact;
            try {
                exact = decimal.toBigIntegerExact();
            } catch (ArithmeticException e) {
                throw new InvalidCoordinateException(index, "non-integer value " + decimal);
            }
            return toCoordinate(index, exact);
        }
        return toCoordinate(index, value.doubleValue());
    }
}
