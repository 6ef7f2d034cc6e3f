/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.metadata;

/**
 * Field repetition types in Parquet schema.
 */
public enum RepetitionType {
    REQUIRED, // Field must be present
    OPTIONAL, // Field may be null, adds one definition level
    REPEATED; // Field may appear any number of times, adds a definition and a repetition level

    private static final RepetitionType[] BY_THRIFT_VALUE = values();

    /**
     * Returns the repetition type for the given Thrift enum value, or null if the value is unknown.
     */
    public static RepetitionType fromThriftValue(int value) {
        if (value < 0 || value >= BY_THRIFT_VALUE.length) {
            return null;
        }
        return BY_THRIFT_VALUE[value];
    }

    /**
     * Number of definition levels a node with this repetition contributes.
     */
    public int definitionLevelIncrement() {
        return this == REQUIRED ? 0 : 1;
    }

    /**
     * Number of repetition levels a node with this repetition contributes.
     */
    public int repetitionLevelIncrement() {
        return this == REPEATED ? 1 : 0;
    }
}
