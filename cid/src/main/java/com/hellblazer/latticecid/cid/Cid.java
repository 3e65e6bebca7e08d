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

import com.hellblazer.latticecid.cid.CidException.MalformedCidException;
import com.hellblazer.latticecid.cid.hash.HashAlgorithm;

import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Content identifier of a shape's equivalence class.
 *
 * <p>String format: {@code sha256:} followed by 64 lowercase hexadecimal characters, 71 characters in all. The short
 * form is the first 8 digest characters, for display only; it is not collision free.
 *
 * @author hal.hildebrand
 */
public record Cid(HashAlgorithm algorithm, String digestHex) {

    public static final char PREFIX_SEPARATOR = ':';
    public static final int SHORT_LENGTH = 8;

    private static final Pattern SHA256_CID = Pattern.compile("^sha256:[0-9a-f]{64}$");
    private static final HexFormat HEX = HexFormat.of();

    public Cid {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(digestHex, "digest cannot be null");
        if (digestHex.length() != algorithm.hexLength()) {
            throw new MalformedCidException(
            algorithm + " digest must be " + algorithm.hexLength() + " hex characters, got: " + digestHex.length());
        }
        for (int i = 0; i < digestHex.length(); i++) {
            char c = digestHex.charAt(i);
            if (!(c >= '0' && c <= '9') && !(c >= 'a' && c <= 'f')) {
                throw new MalformedCidException("Digest must be lowercase hex: " + digestHex);
            }
        }
    }

    /**
     * @param algorithm algorithm that produced the digest
     * @param digest    raw digest bytes
     */
    public static Cid of(HashAlgorithm algorithm, byte[] digest) {
        Objects.requireNonNull(digest, "digest cannot be null");
        return new Cid(algorithm, HEX.formatHex(digest));
    }

    /**
     * Purely syntactic check: does {@code s} have the exact form {@code sha256:<64 lowercase hex>}. Never throws.
     *
     * @param s candidate string, may be null
     * @return true if well formed
     */
    public static boolean isValid(String s) {
        return s != null && SHA256_CID.matcher(s).matches();
    }

    /**
     * @throws MalformedCidException if {@link #isValid(String)} is false
     */
    public static Cid parse(String s) {
        if (!isValid(s)) {
            throw new MalformedCidException("Invalid CID format, expected sha256: followed by 64 hex characters: " + s);
        }
        int separator = s.indexOf(PREFIX_SEPARATOR);
        var algorithm = HashAlgorithm.fromPrefix(s.substring(0, separator))
                                     .orElseThrow(() -> new MalformedCidException("Unknown CID algorithm: " + s));
        return new Cid(algorithm, s.substring(separator + 1));
    }

    /**
     * @return the first {@value #SHORT_LENGTH} characters of the digest
     */
    public String shortForm() {
        return digestHex.substring(0, SHORT_LENGTH);
    }

    public byte[] digest() {
        return HEX.parseHex(digestHex);
    }

    @Override
    public String toString() {
        return algorithm.prefix() + PREFIX_SEPARATOR + digestHex;
    }
}
