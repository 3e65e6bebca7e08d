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

import com.hellblazer.latticecid.cid.CidException.HashUnavailableException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hasher backed by a JCA {@link MessageDigest}.
 */
public class MessageDigestHasher implements Hasher {
    private final MessageDigest digest;
    private byte[] cachedDigest;

    /**
     * @param algorithm JCA algorithm name, e.g. {@code SHA-256}
     * @throws HashUnavailableException if the platform does not provide the algorithm
     */
    public MessageDigestHasher(String algorithm) {
        try {
            this.digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new HashUnavailableException(algorithm, e);
        }
    }

    @Override
    public void update(byte[] bytes) {
        cachedDigest = null; // Invalidate cache
        digest.update(bytes);
    }

    @Override
    public byte[] digest() {
        if (cachedDigest == null) {
            cachedDigest = digest.digest();
        }
        return cachedDigest.clone();
    }
}
