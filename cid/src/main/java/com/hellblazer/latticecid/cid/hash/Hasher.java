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

/**
 * Incremental cryptographic hash computation. Instances are single use and not thread-safe; obtain a fresh one from
 * {@link HashAlgorithm#createHasher()} per digest.
 */
public interface Hasher {
    /**
     * Update the hash with a byte array
     */
    void update(byte[] bytes);

    /**
     * Finalize and return the full digest. This method can be called multiple times and will return the same result;
     * further updates start a new digest.
     *
     * @return a copy of the digest bytes
     */
    byte[] digest();
}
