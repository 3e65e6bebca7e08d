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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The single representative serialization of a shape's rotation and translation equivalence class: sorted
 * {@code x,y,z} triples joined by {@code |}. The empty shape's form is the empty string.
 *
 * @author hal.hildebrand
 */
public record CanonicalForm(String text) {

    public static final CanonicalForm EMPTY = new CanonicalForm("");

    public CanonicalForm {
        Objects.requireNonNull(text, "canonical text cannot be null");
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * @return number of points serialized into this form
     */
    public int pointCount() {
        if (text.isEmpty()) {
            return 0;
        }
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == Canonicalizer.POINT_SEPARATOR) {
                count++;
            }
        }
        return count;
    }

    public byte[] toBytes() {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return text;
    }
}
