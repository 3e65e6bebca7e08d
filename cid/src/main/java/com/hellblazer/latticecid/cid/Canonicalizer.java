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
import com.hellblazer.latticecid.geometry.FccLattice;
import com.hellblazer.latticecid.geometry.LatticePoint;
import com.hellblazer.latticecid.geometry.RotationGroup;
import com.hellblazer.latticecid.geometry.RotationMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reduces a shape to the canonical form of its equivalence class under the 24 proper lattice rotations and all
 * integer translations.
 * <p>
 * For every rotation the shape is rotated, re-centred so its minimum corner is the origin, rendered as {@code x,y,z}
 * strings, sorted and joined with {@code |}. The lexicographically smallest of the 24 candidates is the canonical
 * form. All candidates consist only of digits, commas and bars, so {@link String#compareTo} agrees with byte order.
 * <p>
 * Instances are immutable and safe for concurrent use.
 *
 * @author hal.hildebrand
 */
public final class Canonicalizer {

    public static final char POINT_SEPARATOR = '|';

    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    private final boolean deduplicate;
    private final boolean requireFccParity;

    public Canonicalizer() {
        this(CanonicalizationConfig.defaults());
    }

    public Canonicalizer(CanonicalizationConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.deduplicate = config.isDeduplicate();
        this.requireFccParity = config.isRequireFccParity();
    }

    /**
     * @param shape shape to reduce
     * @return the canonical form; {@link CanonicalForm#EMPTY} for an empty shape
     * @throws InvalidCoordinateException if FCC parity is required and a point is off the sub-lattice
     */
    public CanonicalForm canonicalize(Shape shape) {
        var points = prepare(shape);
        if (points.isEmpty()) {
            return CanonicalForm.EMPTY;
        }
        String best = null;
        for (var rotation : RotationGroup.rotations()) {
            var candidate = candidate(points, rotation);
            if (best == null || candidate.compareTo(best) < 0) {
                best = candidate;
            }
        }
        return new CanonicalForm(best);
    }

    /**
     * @return the 24 candidate serializations in rotation group order; empty for an empty shape
     */
    public List<String> candidates(Shape shape) {
        var points = prepare(shape);
        if (points.isEmpty()) {
            return List.of();
        }
        var result = new ArrayList<String>(RotationGroup.ORDER);
        for (var rotation : RotationGroup.rotations()) {
            var candidate = candidate(points, rotation);
            log.trace("Candidate {}: {}", result.size(), candidate);
            result.add(candidate);
        }
        return result;
    }

    /**
     * Serialize one rotated image of the points, re-centred on its own minimum corner.
     */
    static String candidate(List<LatticePoint> points, RotationMatrix rotation) {
        var rotated = new LatticePoint[points.size()];
        LatticePoint corner = null;
        for (int i = 0; i < rotated.length; i++) {
            rotated[i] = rotation.apply(points.get(i));
            corner = corner == null ? rotated[i] : corner.min(rotated[i]);
        }

        var rendered = new String[rotated.length];
        for (int i = 0; i < rotated.length; i++) {
            rendered[i] = rotated[i].subtract(corner).toCanonicalString();
        }
        Arrays.sort(rendered);
        return String.join(String.valueOf(POINT_SEPARATOR), rendered);
    }

    private List<LatticePoint> prepare(Shape shape) {
        Objects.requireNonNull(shape, "shape cannot be null");
        if (requireFccParity) {
            var points = shape.points();
            for (int i = 0; i < points.size(); i++) {
                if (!FccLattice.isFccSite(points.get(i))) {
                    throw new InvalidCoordinateException(i, points.get(i).toCanonicalString()
                                                            + " is not an FCC lattice site (odd coordinate sum)");
                }
            }
        }
        return deduplicate ? shape.distinctPoints() : shape.points();
    }
}
