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

/**
 * Sealed exception hierarchy for content identifier computation.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link InvalidCoordinateException} - a coordinate violates the integer input contract</li>
 * <li>{@link HashUnavailableException} - the platform hash primitive could not be obtained</li>
 * <li>{@link MalformedCidException} - a string could not be parsed as a content identifier</li>
 * <li>{@link InvalidContainerException} - a shape container document is malformed</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class CidException extends RuntimeException
    permits CidException.InvalidCoordinateException,
            CidException.HashUnavailableException,
            CidException.MalformedCidException,
            CidException.InvalidContainerException {

    public CidException(String message) {
        super(message);
    }

    public CidException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown before canonicalization when a supplied coordinate is null, NaN, infinite, fractional, out of the
     * supported range, or when a point does not have exactly three coordinates. Correctable by the caller.
     */
    public static final class InvalidCoordinateException extends CidException {
        private final int pointIndex;

        /**
         * @param pointIndex index of the offending point in the caller's input, or -1 if not attributable
         * @param message    the detail message
         */
        public InvalidCoordinateException(int pointIndex, String message) {
            super(pointIndex >= 0 ? "Invalid coordinate at index " + pointIndex + ": " + message : message);
            this.pointIndex = pointIndex;
        }

        /**
         * @return index of the offending point, or -1
         */
        public int getPointIndex() {
            return pointIndex;
        }
    }

    /**
     * The hash primitive is missing from the running platform. Fatal and never retried.
     */
    public static final class HashUnavailableException extends CidException {

        public HashUnavailableException(String algorithm, Throwable cause) {
            super("Hash algorithm not available: " + algorithm, cause);
        }
    }

    /**
     * Thrown by {@link Cid#parse(String)}. Validity checks never throw this; they return false.
     */
    public static final class MalformedCidException extends CidException {

        public MalformedCidException(String message) {
            super(message);
        }
    }

    /**
     * A shape container document violates the container format. The message names the rule that failed.
     */
    public static final class InvalidContainerException extends CidException {

        public InvalidContainerException(String message) {
            super(message);
        }

        public InvalidContainerException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
