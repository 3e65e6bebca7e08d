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

package com.hellblazer.latticecid.cid.container;

import com.hellblazer.latticecid.cid.Cid;
import com.hellblazer.latticecid.cid.Shape;
import com.hellblazer.latticecid.geometry.LatticePoint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A shape container document: the cells of one shape plus its identifier and descriptive metadata.
 *
 * @param version     format version, always {@value #VERSION} for documents this library accepts
 * @param lattice     lattice type, always {@value #LATTICE}
 * @param cells       the shape's lattice points in document order
 * @param cid         embedded content identifier, or null
 * @param name        display name, or null
 * @param description free text, or null
 * @param designer    attribution, or null
 * @author hal.hildebrand
 */
public record ShapeContainer(String version, String lattice, List<LatticePoint> cells, String cid, String name,
                             String description, Designer designer) {

    public static final String VERSION = "1.0";
    public static final String LATTICE = "fcc";

    public ShapeContainer {
        Objects.requireNonNull(version, "version cannot be null");
        Objects.requireNonNull(lattice, "lattice cannot be null");
        cells = List.copyOf(Objects.requireNonNull(cells, "cells cannot be null"));
    }

    /**
     * @return a current-version FCC container without identifier or metadata
     */
    public static ShapeContainer of(List<LatticePoint> cells) {
        return new ShapeContainer(VERSION, LATTICE, cells, null, null, null, null);
    }

    public Shape shape() {
        return Shape.of(cells);
    }

    /**
     * @return the embedded identifier if present and well formed
     */
    public Optional<Cid> parsedCid() {
        return Cid.isValid(cid) ? Optional.of(Cid.parse(cid)) : Optional.empty();
    }

    public ShapeContainer withCid(String cid) {
        return new ShapeContainer(version, lattice, cells, cid, name, description, designer);
    }

    public ShapeContainer withName(String name) {
        return new ShapeContainer(version, lattice, cells, cid, name, description, designer);
    }

    public ShapeContainer withDescription(String description) {
        return new ShapeContainer(version, lattice, cells, cid, name, description, designer);
    }

    public ShapeContainer withDesigner(Designer designer) {
        return new ShapeContainer(version, lattice, cells, cid, name, description, designer);
    }
}
