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

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class FccLatticeTest {

    private static final float EPSILON = 1e-5f;

    @Test
    public void testParity() {
        assertTrue(FccLattice.isFccSite(LatticePoint.origin()));
        assertTrue(FccLattice.isFccSite(new LatticePoint(1, 1, 0)));
        assertTrue(FccLattice.isFccSite(new LatticePoint(-1, 0, -1)));
        assertFalse(FccLattice.isFccSite(new LatticePoint(1, 0, 0)));
        assertFalse(FccLattice.isFccSite(new LatticePoint(-3, 0, 0)));
        assertTrue(FccLattice.isFccSite(new LatticePoint(Integer.MAX_VALUE, Integer.MAX_VALUE, 0)));
    }

    @Test
    public void testNeighbors() {
        var p = new LatticePoint(2, -1, 5);
        var neighbors = FccLattice.neighbors(p);
        assertEquals(6, neighbors.size());
        assertEquals(new LatticePoint(3, -1, 5), neighbors.get(0));
        assertEquals(new LatticePoint(2, -1, 4), neighbors.get(5));
        for (var n : neighbors) {
            assertEquals(1, Math.abs(n.x - p.x) + Math.abs(n.y - p.y) + Math.abs(n.z - p.z));
        }
    }

    @Test
    public void testToWorld() {
        var w = FccLattice.toWorld(new LatticePoint(1, 0, 0));
        assertEquals(0.4f, w.x, EPSILON);
        assertEquals(0.4f, w.y, EPSILON);
        assertEquals(0.0f, w.z, EPSILON);

        var scaled = FccLattice.toWorld(new LatticePoint(1, 2, 3), 2.0f);
        assertEquals(3.0f, scaled.x, EPSILON);
        assertEquals(4.0f, scaled.y, EPSILON);
        assertEquals(5.0f, scaled.z, EPSILON);
    }

    @Test
    public void testWorldRoundTrip() {
        for (int x = -3; x <= 3; x++) {
            for (int y = -3; y <= 3; y++) {
                for (int z = -3; z <= 3; z++) {
                    var p = new LatticePoint(x, y, z);
                    assertEquals(p, FccLattice.fromWorld(FccLattice.toWorld(p)));
                }
            }
        }
    }

    @Test
    public void testFromWorldSnapsToNearest() {
        var world = FccLattice.toWorld(new LatticePoint(2, 1, 0));
        world.add(new Point3f(0.05f, -0.03f, 0.02f));
        assertEquals(new LatticePoint(2, 1, 0), FccLattice.fromWorld(world));
    }

    @Test
    public void testCenter() {
        var centered = FccLattice.center(List.of(new LatticePoint(0, 0, 0), new LatticePoint(2, 4, 1)));
        assertEquals(2, centered.size());
        assertEquals(new Point3f(-1f, -2f, -0.5f), centered.get(0));
        assertEquals(new Point3f(1f, 2f, 0.5f), centered.get(1));
        assertTrue(FccLattice.center(List.of()).isEmpty());
    }
}
