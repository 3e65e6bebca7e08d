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

import com.hellblazer.latticecid.cid.CidException.HashUnavailableException;
import com.hellblazer.latticecid.cid.CidException.MalformedCidException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Computes content identifiers for lattice shapes.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>{@link Canonicalizer} reduces the shape to its {@link CanonicalForm}</li>
 * <li>the configured hash algorithm digests the UTF-8 bytes of the form</li>
 * <li>the digest is rendered as a {@link Cid}</li>
 * </ol>
 * The empty shape hashes the empty byte string, so its identifier is the well known SHA-256 of no input.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * var identifier = new ShapeIdentifier();
 * var shape = Shape.fromIntArrays(new int[][] { { 0, 0, 0 }, { 1, 1, 0 }, { 1, 0, 1 } });
 * var cid = identifier.cid(shape);          // sha256:...
 * var label = identifier.shortCid(shape);   // 8 hex characters
 * }</pre>
 * <p>
 * Stateless apart from its configuration; any number of threads may share one instance.
 *
 * @author hal.hildebrand
 */
public class ShapeIdentifier {
    private static final Logger log = LoggerFactory.getLogger(ShapeIdentifier.class);

    private final CanonicalizationConfig config;
    private final Canonicalizer canonicalizer;
    private final Executor executor;

    public ShapeIdentifier() {
        this(CanonicalizationConfig.defaults());
    }

    public ShapeIdentifier(CanonicalizationConfig config) {
        this(config, ForkJoinPool.commonPool());
    }

    /**
     * @param config   canonicalization and hashing options
     * @param executor executor for the asynchronous variants
     */
    public ShapeIdentifier(CanonicalizationConfig config, Executor executor) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.canonicalizer = new Canonicalizer(config);
    }

    /**
     * Syntactic CID check for callers holding plain strings.
     *
     * @see Cid#isValid(String)
     */
    public static boolean isValidCid(String cid) {
        return Cid.isValid(cid);
    }

    /**
     * @return the display abbreviation of a CID string
     * @throws MalformedCidException if the string is not a valid CID
     */
    public static String shortCid(String cid) {
        return Cid.parse(cid).shortForm();
    }

    public CanonicalizationConfig getConfig() {
        return config;
    }

    public CanonicalForm canonicalForm(Shape shape) {
        return canonicalizer.canonicalize(shape);
    }

    /**
     * @return the content identifier of the shape's rotation and translation class
     * @throws CidException.InvalidCoordinateException if the shape violates the configured lattice constraints
     * @throws HashUnavailableException                if the hash primitive is missing
     */
    public Cid cid(Shape shape) {
        var form = canonicalForm(shape);
        var cid = hash(form);
        if (log.isDebugEnabled()) {
            log.debug("Computed {} for {} point(s) from {} canonical point(s)", cid, shape.size(), form.pointCount());
        }
        return cid;
    }

    /**
     * Digest an already canonical form.
     */
    public Cid hash(CanonicalForm form) {
        var algorithm = config.getHashAlgorithm();
        var hasher = algorithm.createHasher();
        hasher.update(form.toBytes());
        return Cid.of(algorithm, hasher.digest());
    }

    /**
     * Always derived from the full identifier, so the two can never disagree.
     *
     * @return the first 8 digest characters of {@link #cid(Shape)}
     */
    public String shortCid(Shape shape) {
        return cid(shape).shortForm();
    }

    /**
     * @return true if the shape's identifier equals the given CID string; false for malformed strings
     */
    public boolean matches(Shape shape, String cid) {
        if (!Cid.isValid(cid)) {
            return false;
        }
        return cid(shape).toString().equals(cid);
    }

    /**
     * @return true if one shape can be carried onto the other by a proper lattice rotation and a translation
     */
    public boolean congruent(Shape a, Shape b) {
        return canonicalForm(a).equals(canonicalForm(b));
    }

    /**
     * Compute the identifier on the configured executor. Failures complete the future exceptionally with the
     * original exception.
     */
    public CompletableFuture<Cid> cidAsync(Shape shape) {
        Objects.requireNonNull(shape, "shape cannot be null");
        return CompletableFuture.supplyAsync(() -> cid(shape), executor);
    }

    /**
     * Compute identifiers for many shapes concurrently.
     *
     * @return identifiers in input order
     */
    public CompletableFuture<List<Cid>> cidAllAsync(List<Shape> shapes) {
        Objects.requireNonNull(shapes, "shapes cannot be null");
        var futures = new ArrayList<CompletableFuture<Cid>>(shapes.size());
        for (var shape : shapes) {
            futures.add(cidAsync(shape));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).thenApply(v -> {
            var result = new ArrayList<Cid>(futures.size());
            for (var future : futures) {
                result.add(future.join());
            }
            return result;
        });
    }
}
