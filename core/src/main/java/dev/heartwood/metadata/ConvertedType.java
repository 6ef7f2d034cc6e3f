/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.metadata;

/**
 * Legacy converted type annotations, superseded by {@link LogicalType} but still
 * written by many producers (e.g. for LIST and MAP groups).
 */
public enum ConvertedType {
    UTF8,
    MAP,
    MAP_KEY_VALUE,
    LIST,
    ENUM,
    DECIMAL,
    DATE,
    TIME_MILLIS,
    TIME_MICROS,
    TIMESTAMP_MILLIS,
    TIMESTAMP_MICROS,
    UINT_8,
    UINT_16,
    UINT_32,
    UINT_64,
    INT_8,
    INT_16,
    INT_32,
    INT_64,
    JSON,
    BSON,
    INTERVAL;

    private static final ConvertedType[] BY_THRIFT_VALUE = values();

    /**
     * Returns the converted type for the given Thrift enum value. Unknown values yield null,
     * as newer writers may use annotations this reader doesn't know about.
     */
    public static ConvertedType fromThriftValue(int value) {
        if (value < 0 || value >= BY_THRIFT_VALUE.length) {
            return null;
        }
        return BY_THRIFT_VALUE[value];
    }
}
