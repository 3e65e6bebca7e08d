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
import com.hellblazer.latticecid.cid.CidException.MalformedCidException;
import com.hellblazer.latticecid.geometry.LatticePoint;
import com.hellblazer.latticecid.geometry.RotationGroup;
import com.hellblazer.latticecid.geometry.RotationMatrix;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end identifier computation.
 *
 * @author hal.hildebrand
 */
public class ShapeIdentifierTest {

    private static final String EMPTY_CID     = "sha256:e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    private static final String SINGLETON_CID = "sha256:7c01691d53eb209bba1ea4ade72c86e6e85b6efbec920cc9ca5756e7c4e98c55";
    private static final String TETRA_CID     = "sha256:b8cb96c0d3a265485077c2cd57242451f3f0275227623eddbb7b635925ec4fc9";
    private static final String L_CID         = "sha256:ebaa05b917c79a8cfd1608d0b9a82f50f95eb059c1c01cd644455a54b62b24fa";
    private static final String SQUARE_CID    = "sha256:eb2c0619190018e435efb39f8cd5b2c5e51f1a3665739dd2f2965cdaa3333242";
    private static final String LINE_CID      = "sha256:8804f60f6e011fd03b578b617a35f961fd320b510a2ca2464bcd9c6f168516cb";
    private static final String CHIRAL_CID    = "sha256:3b8212caeb391755aacbb68563a181d3233d971d48ef105e4c1eee0b19e6822d";
    private static final String MIRROR_CID    = "sha256:0243f0738e4f2d77dabc98eac0d39347678e365e324231a2b648f348b21f1a4e";
    private static final String PAIR_CID      = "sha256:486cf2f681be3dc2348d615930d8df1d1918fe4b6e867c07e93d23d29b509a88";
    private static final String PAIR_DUPLICATE_LEGACY_CID = "sha256:7121833d3fad34d65c536ff0582032b282b950f1b06d2a6ce06e2bc62afca735";

    private static final Shape TETRA  = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } });
    private static final Shape L      = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 2, 0, 0 }, { 0, 1, 0 } });
    private static final Shape SQUARE = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 0, 1, 0 }, { 1, 1, 0 } });
    private static final Shape LINE   = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 2, 0, 0 }, { 3, 0, 0 } });
    private static final Shape CHIRAL = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 1, 1, 0 }, { 1, 1, 1 } });
    private static final Shape MIRROR = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { -1, 0, 0 }, { -1, 1, 0 }, { -1, 1, 1 } });

    private final ShapeIdentifier identifier = new ShapeIdentifier();

    @Test
    public void testEmptyShapeHashesEmptyInput() {
        var cid = identifier.cid(Shape.empty());
        assertEquals(EMPTY_CID, cid.toString());
        assertEquals("e3b0c442", identifier.shortCid(Shape.empty()));
    }

    @Test
    public void testSingletonCollapse() {
        var far = identifier.cid(Shape.of(new LatticePoint(5, -3, 2)));
        var origin = identifier.cid(Shape.of(LatticePoint.origin()));
        assertEquals(origin, far);
        assertEquals(SINGLETON_CID, far.toString());
    }

    @Test
    public void testKnownIdentifiers() {
        assertEquals(TETRA_CID, identifier.cid(TETRA).toString());
        assertEquals(L_CID, identifier.cid(L).toString());
        assertEquals(SQUARE_CID, identifier.cid(SQUARE).toString());
        assertEquals(LINE_CID, identifier.cid(LINE).toString());
    }

    @Test
    public void testDistinctFourPointShapes() {
        var cids = new HashSet<Cid>();
        for (var shape : List.of(TETRA, L, SQUARE, LINE, CHIRAL)) {
            cids.add(identifier.cid(shape));
        }
        assertEquals(5, cids.size());
        assertFalse(identifier.congruent(TETRA, SQUARE));
    }

    @Test
    public void testMirrorImagesAreNotIdentified() {
        assertEquals(CHIRAL_CID, identifier.cid(CHIRAL).toString());
        assertEquals(MIRROR_CID, identifier.cid(MIRROR).toString());
        assertFalse(identifier.congruent(CHIRAL, MIRROR));
    }

    @Test
    public void testRotationInvarianceForEveryGroupElement() {
        for (var shape : List.of(TETRA, L, SQUARE, LINE, CHIRAL)) {
            var expected = identifier.cid(shape);
            for (var rotation : RotationGroup.rotations()) {
                assertEquals(expected, identifier.cid(shape.rotate(rotation)), "Rotation " + rotation);
            }
        }
    }

    @Test
    public void testTranslationInvariance() {
        var expected = identifier.cid(L);
        for (var offset : List.of(new LatticePoint(1, 0, 0), new LatticePoint(-7, 3, 100),
                                  new LatticePoint(1000, -1000, 5))) {
            assertEquals(expected, identifier.cid(L.translate(offset)));
        }
    }

    @Test
    public void testRotatedAndTranslatedTogether() {
        var moved = CHIRAL.rotate(RotationMatrix.QUARTER_TURN_X.multiply(RotationMatrix.QUARTER_TURN_Y))
                          .translate(new LatticePoint(-12, 40, 3));
        assertTrue(identifier.congruent(CHIRAL, moved));
        assertEquals(CHIRAL_CID, identifier.cid(moved).toString());
    }

    @Test
    public void testDeterminism() {
        var first = identifier.cid(CHIRAL);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, identifier.cid(CHIRAL));
        }
        assertEquals(first, new ShapeIdentifier().cid(CHIRAL));
    }

    @Test
    public void testShortCidConsistency() {
        for (var shape : List.of(Shape.empty(), TETRA, L, SQUARE, LINE, CHIRAL, MIRROR)) {
            var full = identifier.cid(shape).toString();
            assertEquals(full.substring(7, 15), identifier.shortCid(shape));
            assertEquals(full.substring(7, 15), ShapeIdentifier.shortCid(full));
        }
        assertThrows(MalformedCidException.class, () -> ShapeIdentifier.shortCid("sha256:xyz"));
    }

    @Test
    public void testDuplicatePointsCollapseByDefault() {
        var pair = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 0, 0 } });
        var pairWithDuplicate = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 1, 0, 0 } });
        assertEquals(PAIR_CID, identifier.cid(pair).toString());
        assertEquals(PAIR_CID, identifier.cid(pairWithDuplicate).toString());

        var legacy = new ShapeIdentifier(CanonicalizationConfig.legacy());
        assertEquals(PAIR_CID, legacy.cid(pair).toString());
        assertEquals(PAIR_DUPLICATE_LEGACY_CID, legacy.cid(pairWithDuplicate).toString());
    }

    @Test
    public void testMatches() {
        assertTrue(identifier.matches(TETRA, TETRA_CID));
        assertFalse(identifier.matches(SQUARE, TETRA_CID));
        assertFalse(identifier.matches(TETRA, "sha256:xyz"));
        assertFalse(identifier.matches(TETRA, null));
    }

    @Test
    public void testStaticValidator() {
        assertTrue(ShapeIdentifier.isValidCid("sha256:" + "a".repeat(64)));
        assertFalse(ShapeIdentifier.isValidCid("sha256:xyz"));
        assertFalse(ShapeIdentifier.isValidCid("md5:abcd"));
    }

    @Test
    public void testStrictConfigRejectsOffLatticePoints() {
        var strict = new ShapeIdentifier(CanonicalizationConfig.strict());
        var offLattice = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 0, 0 } });
        assertThrows(InvalidCoordinateException.class, () -> strict.cid(offLattice));
        var fcc = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 1, 0 } });
        assertEquals(identifier.cid(fcc), strict.cid(fcc));
    }

    @Test
    public void testAsync() throws Exception {
        var executor = Executors.newFixedThreadPool(4);
        try {
            var async = new ShapeIdentifier(CanonicalizationConfig.defaults(), executor);
            assertEquals(TETRA_CID, async.cidAsync(TETRA).get(10, TimeUnit.SECONDS).toString());

            var shapes = new ArrayList<Shape>();
            for (int i = 0; i < 50; i++) {
                shapes.add(L.translate(new LatticePoint(i, -i, 2 * i)).rotate(RotationGroup.get(i % 24)));
            }
            var cids = async.cidAllAsync(shapes).get(30, TimeUnit.SECONDS);
            assertEquals(50, cids.size());
            for (var cid : cids) {
                assertEquals(L_CID, cid.toString());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testAsyncFailurePropagatesCause() {
        var strict = new ShapeIdentifier(CanonicalizationConfig.strict());
        var offLattice = Shape.of(new LatticePoint(1, 0, 0));
        var e = assertThrows(CompletionException.class, () -> strict.cidAsync(offLattice).join());
        assertInstanceOf(InvalidCoordinateException.class, e.getCause());
    }
}
