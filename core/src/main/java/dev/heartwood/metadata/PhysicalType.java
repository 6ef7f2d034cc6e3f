/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.metadata;

/**
 * Physical (primitive) types of leaf columns, as stored on disk.
 */
public enum PhysicalType {
    BOOLEAN,
    INT32,
    INT64,
    INT96, // Deprecated, used for legacy timestamp
    FLOAT,
    DOUBLE,
    BYTE_ARRAY,
    FIXED_LEN_BYTE_ARRAY;

    private static final PhysicalType[] BY_THRIFT_VALUE = values();

    /**
     * Returns the type for the given Thrift enum value, or null if the value is unknown.
     */
    public static PhysicalType fromThriftValue(int value) {
        if (value < 0 || value >= BY_THRIFT_VALUE.length) {
            return null;
        }
        return BY_THRIFT_VALUE[value];
    }
}
