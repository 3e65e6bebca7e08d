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

package com.hellblazer.latticecid.cid.hash;

import java.util.Optional;

/**
 * Supported hash algorithms for content identifiers. The prefix names the algorithm inside a CID string.
 */
public enum HashAlgorithm {
    SHA256("sha256", "SHA-256", 32);

    private final String prefix;
    private final String jcaName;
    private final int digestLength;

    HashAlgorithm(String prefix, String jcaName, int digestLength) {
        this.prefix = prefix;
        this.jcaName = jcaName;
        this.digestLength = digestLength;
    }

    /**
     * Create a new hasher instance for this algorithm
     */
    public Hasher createHasher() {
        return new MessageDigestHasher(jcaName);
    }

    public String prefix() {
        return prefix;
    }

    public String jcaName() {
        return jcaName;
    }

    /**
     * @return digest length in bytes
     */
    public int digestLength() {
        return digestLength;
    }

    /**
     * @return digest length in hexadecimal characters
     */
    public int hexLength() {
        return digestLength * 2;
    }

    public static Optional<HashAlgorithm> fromPrefix(String prefix) {
        for (var algorithm : values()) {
            if (algorithm.prefix.equals(prefix)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return jcaName;
    }
}
