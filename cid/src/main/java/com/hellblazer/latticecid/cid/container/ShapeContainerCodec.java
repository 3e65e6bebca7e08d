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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.latticecid.cid.Cid;
import com.hellblazer.latticecid.cid.CidException.InvalidContainerException;
import com.hellblazer.latticecid.cid.CidException.InvalidCoordinateException;
import com.hellblazer.latticecid.cid.Shape;
import com.hellblazer.latticecid.cid.ShapeIdentifier;
import com.hellblazer.latticecid.geometry.LatticePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads, validates, writes and verifies shape container files ({@code *.fcc.json}).
 *
 * <pre>{@code
 * {
 *   "version": "1.0",
 *   "lattice": "fcc",
 *   "cells": [[0,0,0],[1,1,0]],
 *   "cid": "sha256:...",
 *   "name": "...",
 *   "description": "...",
 *   "designer": { "name": "...", "date": "...", "email": "..." }
 * }
 * }</pre>
 * <p>
 * Older documents carry their points under {@code coordinates} instead of {@code cells}; both are accepted and
 * {@code cells} wins when both are present. Output always uses {@code cells}.
 *
 * @author hal.hildebrand
 */
public class ShapeContainerCodec {
    private static final Logger log = LoggerFactory.getLogger(ShapeContainerCodec.class);

    public static final String FILE_SUFFIX = ".fcc.json";

    private final ObjectMapper objectMapper;
    private final ShapeIdentifier identifier;

    public ShapeContainerCodec() {
        this(new ShapeIdentifier());
    }

    public ShapeContainerCodec(ShapeIdentifier identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier cannot be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @throws InvalidContainerException if the text is not JSON or breaks a container rule
     */
    public ShapeContainer read(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidContainerException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ShapeContainer read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "input cannot be null");
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new InvalidContainerException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    public ShapeContainer read(Path file) throws IOException {
        try (var in = Files.newInputStream(file)) {
            var container = read(in);
            log.debug("Read container {} with {} cell(s)", file, container.cells().size());
            return container;
        }
    }

    /**
     * Validate a parsed document. Rules are checked in order and the first failure is reported.
     */
    public ShapeContainer fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidContainerException("Invalid JSON: not an object");
        }

        var lattice = root.get("lattice");
        if (specified(lattice) && !ShapeContainer.LATTICE.equals(lattice.asText())) {
            throw new InvalidContainerException(
            "Unsupported lattice type: " + lattice.asText() + ". Only '" + ShapeContainer.LATTICE + "' is supported.");
        }

        var coords = present(root.get("cells")) ? root.get("cells") : root.get("coordinates");
        if (!present(coords)) {
            throw new InvalidContainerException("Missing coordinate data. Expected \"cells\" or \"coordinates\" field.");
        }
        if (!coords.isArray()) {
            throw new InvalidContainerException("Coordinates must be an array");
        }
        if (coords.isEmpty()) {
            throw new InvalidContainerException("Container cannot be empty");
        }
        var cells = parseCells(coords);

        var cid = root.get("cid");
        if (specified(cid) && !(cid.isTextual() && Cid.isValid(cid.asText()))) {
            throw new InvalidContainerException("Invalid CID format. Expected sha256:... with 64 hex characters.");
        }

        var version = root.get("version");
        if (specified(version) && !ShapeContainer.VERSION.equals(version.asText())) {
            throw new InvalidContainerException(
            "Unsupported version: " + version.asText() + ". Expected '" + ShapeContainer.VERSION + "'.");
        }

        return new ShapeContainer(ShapeContainer.VERSION, ShapeContainer.LATTICE, cells,
                                  specified(cid) ? cid.asText() : null,
                                  text(root.get("name")), text(root.get("description")),
                                  designer(root.get("designer")));
    }

    /**
     * @return pretty printed JSON; absent optional fields are omitted
     */
    public String write(ShapeContainer container) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(container));
        } catch (JsonProcessingException e) {
            // tree nodes always serialize
            throw new IllegalStateException("Unable to serialize container", e);
        }
    }

    public void writeTo(ShapeContainer container, Path file) {
        try {
            Files.writeString(file, write(container), StandardCharsets.UTF_8);
            log.debug("Wrote container {} to {}", container.cid(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write container to " + file, e);
        }
    }

    public ObjectNode toTree(ShapeContainer container) {
        var root = objectMapper.createObjectNode();
        root.put("version", container.version());
        root.put("lattice", container.lattice());
        ArrayNode cells = root.putArray("cells");
        for (var p : container.cells()) {
            cells.addArray().add(p.x).add(p.y).add(p.z);
        }
        putIfPresent(root, "cid", container.cid());
        putIfPresent(root, "name", container.name());
        putIfPresent(root, "description", container.description());
        var designer = container.designer();
        if (designer != null && !designer.isEmpty()) {
            var node = root.putObject("designer");
            putIfPresent(node, "name", designer.name());
            putIfPresent(node, "date", designer.date());
            putIfPresent(node, "email", designer.email());
        }
        return root;
    }

    /**
     * Build a container for a shape with its identifier computed and embedded.
     */
    public ShapeContainer create(Shape shape, String name, Designer designer) {
        var cid = identifier.cid(shape);
        return new ShapeContainer(ShapeContainer.VERSION, ShapeContainer.LATTICE, shape.points(), cid.toString(), name,
                                  null, designer);
    }

    /**
     * Recompute the identifier from the cells and compare it with the embedded one.
     *
     * @return true only if an identifier is embedded and matches
     */
    public boolean verify(ShapeContainer container) {
        if (container.cid() == null) {
            log.debug("Container {} has no embedded CID", container.name());
            return false;
        }
        var computed = identifier.cid(container.shape());
        if (!computed.toString().equals(container.cid())) {
            log.warn("Container {} embeds {} but its cells hash to {}", container.name(), container.cid(), computed);
            return false;
        }
        return true;
    }

    /**
     * @return the container with its identifier recomputed from its cells
     */
    public ShapeContainer withComputedCid(ShapeContainer container) {
        return container.withCid(identifier.cid(container.shape()).toString());
    }

    /**
     * @return library file name {@code Shape_<short cid>.fcc.json}, from the embedded identifier when present
     */
    public String fileName(ShapeContainer container) {
        var cid = container.parsedCid().orElseGet(() -> identifier.cid(container.shape()));
        return "Shape_" + cid.shortForm() + FILE_SUFFIX;
    }

    private List<LatticePoint> parseCells(JsonNode coords) {
        var numbers = new ArrayList<List<Number>>(coords.size());
        for (int i = 0; i < coords.size(); i++) {
            var entry = coords.get(i);
            if (!entry.isArray() || entry.size() != 3) {
                throw new InvalidContainerException("Invalid coordinate at index " + i + ": expected [x, y, z] array");
            }
            for (var value : entry) {
                if (!isInteger(value)) {
                    throw new InvalidContainerException(
                    "Invalid coordinate at index " + i + ": expected integer values");
                }
            }
            numbers.add(List.of(entry.get(0).numberValue(), entry.get(1).numberValue(), entry.get(2).numberValue()));
        }
        try {
            return Shape.fromNumbers(numbers).points();
        } catch (InvalidCoordinateException e) {
            throw new InvalidContainerException(e.getMessage(), e);
        }
    }

    private static boolean isInteger(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return false;
        }
        if (value.isIntegralNumber()) {
            return true;
        }
        double d = value.asDouble();
        return !Double.isNaN(d) && !Double.isInfinite(d) && Math.rint(d) == d;
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }

    // empty text counts as absent for the optional header fields
    private static boolean specified(JsonNode node) {
        return present(node) && !(node.isTextual() && node.asText().isEmpty());
    }

    private static String text(JsonNode node) {
        return present(node) ? node.asText() : null;
    }

    private static Designer designer(JsonNode node) {
        if (!present(node) || !node.isObject()) {
            return null;
        }
        return new Designer(text(node.get("name")), text(node.get("date")), text(node.get("email")));
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
