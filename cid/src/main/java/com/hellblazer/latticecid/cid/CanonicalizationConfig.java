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

import com.hellblazer.latticecid.cid.hash.HashAlgorithm;

import java.util.Objects;

/**
 * Configuration for shape canonicalization and identifier computation.
 *
 * @author hal.hildebrand
 */
public class CanonicalizationConfig {

    private boolean deduplicate = true;
    private boolean requireFccParity = false;
    private HashAlgorithm hashAlgorithm = HashAlgorithm.SHA256;

    /**
     * Whether repeated points collapse to one before canonicalization. When disabled the multiset is hashed and two
     * shapes differing only by a repeated point get different identifiers.
     */
    public boolean isDeduplicate() {
        return deduplicate;
    }

    /**
     * Whether points with an odd coordinate sum are rejected as lying off the FCC sub-lattice.
     */
    public boolean isRequireFccParity() {
        return requireFccParity;
    }

    public HashAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }

    // Fluent API for configuration

    public CanonicalizationConfig withDeduplication(boolean deduplicate) {
        this.deduplicate = deduplicate;
        return this;
    }

    public CanonicalizationConfig withFccParity(boolean require) {
        this.requireFccParity = require;
        return this;
    }

    public CanonicalizationConfig withHashAlgorithm(HashAlgorithm algorithm) {
        this.hashAlgorithm = Objects.requireNonNull(algorithm, "hash algorithm cannot be null");
        return this;
    }

    /**
     * Point set semantics, any integer coordinates.
     */
    public static CanonicalizationConfig defaults() {
        return new CanonicalizationConfig();
    }

    /**
     * Point set semantics, FCC sites only.
     */
    public static CanonicalizationConfig strict() {
        return new CanonicalizationConfig().withDeduplication(true).withFccParity(true);
    }

    /**
     * Multiset semantics, matching identifiers computed before duplicate points were collapsed.
     */
    public static CanonicalizationConfig legacy() {
        return new CanonicalizationConfig().withDeduplication(false).withFccParity(false);
    }

    @Override
    public String toString() {
        return "CanonicalizationConfig[deduplicate=" + deduplicate + ", requireFccParity=" + requireFccParity
        + ", hashAlgorithm=" + hashAlgorithm + "]";
    }
}
