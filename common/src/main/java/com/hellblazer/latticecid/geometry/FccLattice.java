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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Coordinate helpers for the face centered cubic lattice in engine coordinates.
 * <p>
 * Engine coordinates (i, j, k) address lattice sites through the primitive basis (1,1,0), (1,0,1), (0,1,1), each
 * scaled by half the sphere spacing when converted to world space.
 *
 * @author hal.hildebrand
 */
public final class FccLattice {

    /** Distance between neighbouring sphere centres in world units */
    public static final float DEFAULT_SPACING = 0.8f;

    /** The six axis aligned engine offsets of a site's nearest neighbours */
    public static final List<LatticePoint> NEIGHBOR_OFFSETS = List.of(new LatticePoint(1, 0, 0),
                                                                      new LatticePoint(-1, 0, 0),
                                                                      new LatticePoint(0, 1, 0),
                                                                      new LatticePoint(0, -1, 0),
                                                                      new LatticePoint(0, 0, 1),
                                                                      new LatticePoint(0, 0, -1));

    private FccLattice() {
    }

    /**
     * @return true if the coordinate sum is even, the parity condition of the cubic FCC sub-lattice
     */
    public static boolean isFccSite(LatticePoint p) {
        long sum = (long) p.x + p.y + p.z;
        return Math.floorMod(sum, 2L) == 0L;
    }

    /**
     * @return the six engine neighbours of p, in {@link #NEIGHBOR_OFFSETS} order
     */
    public static List<LatticePoint> neighbors(LatticePoint p) {
        var result = new ArrayList<LatticePoint>(NEIGHBOR_OFFSETS.size());
        for (var offset : NEIGHBOR_OFFSETS) {
            result.add(p.add(offset));
        }
        return result;
    }

    public static Point3f toWorld(LatticePoint p) {
        return toWorld(p, DEFAULT_SPACING);
    }

    /**
     * Convert engine coordinates to world space.
     *
     * @param p       lattice site
     * @param spacing world distance between neighbouring sites
     * @return world position of the site centre
     */
    public static Point3f toWorld(LatticePoint p, float spacing) {
        float half = spacing * 0.5f;
        return new Point3f((p.x + p.y) * half, (p.x + p.z) * half, (p.y + p.z) * half);
    }

    public static LatticePoint fromWorld(Tuple3f world) {
        return fromWorld(world, DEFAULT_SPACING);
    }

    /**
     * Snap a world position to the nearest engine coordinate by inverting {@link #toWorld(LatticePoint, float)} and
     * rounding each axis.
     */
    public static LatticePoint fromWorld(Tuple3f world, float spacing) {
        float inv = 1.0f / (spacing * 0.5f);
        float a = world.x * inv;
        float b = world.y * inv;
        float c = world.z * inv;
        return new LatticePoint(Math.round((a + b - c) * 0.5f), Math.round((a - b + c) * 0.5f),
                                Math.round((-a + b + c) * 0.5f));
    }

    /**
     * Shift points so the centre of their bounding box sits at the origin. Used for display only; the result is
     * generally not integral.
     *
     * @param points lattice sites
     * @return centred positions in engine units, in input order
     */
    public static List<Point3f> center(Collection<LatticePoint> points) {
        if (points.isEmpty()) {
            return List.of();
        }
        LatticePoint lo = null;
        LatticePoint hi = null;
        for (var p : points) {
            lo = lo == null ? p : lo.min(p);
            hi = hi == null ? p : hi.max(p);
        }
        float cx = (lo.x + (float) hi.x) / 2f;
        float cy = (lo.y + (float) hi.y) / 2f;
        float cz = (lo.z + (float) hi.z) / 2f;

        var result = new ArrayList<Point3f>(points.size());
        for (var p : points) {
            result.add(new Point3f(p.x - cx, p.y - cy, p.z - cz));
        }
        return result;
    }
}
