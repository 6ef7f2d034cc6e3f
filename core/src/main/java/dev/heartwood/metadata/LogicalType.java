/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.metadata;

/**
 * Logical type annotations giving semantic meaning to physical types.
 * Rendered in the notation of the Parquet message syntax, e.g. {@code DECIMAL(10,2)}.
 */
public sealed interface LogicalType
        permits LogicalType.StringType, LogicalType.MapType, LogicalType.ListType, LogicalType.EnumType,
        LogicalType.DecimalType, LogicalType.DateType, LogicalType.TimeType, LogicalType.TimestampType,
        LogicalType.IntType, LogicalType.UnknownType, LogicalType.JsonType, LogicalType.BsonType,
        LogicalType.UuidType, LogicalType.Float16Type {

    enum TimeUnit {
        MILLIS,
        MICROS,
        NANOS
    }

    record StringType() implements LogicalType {
        @Override
        public String toString() {
            return "STRING";
        }
    }

    record MapType() implements LogicalType {
        @Override
        public String toString() {
            return "MAP";
        }
    }

    record ListType() implements LogicalType {
        @Override
        public String toString() {
            return "LIST";
        }
    }

    record EnumType() implements LogicalType {
        @Override
        public String toString() {
            return "ENUM";
        }
    }

    record DecimalType(int scale, int precision) implements LogicalType {
        @Override
        public String toString() {
            return "DECIMAL(" + precision + "," + scale + ")";
        }
    }

    record DateType() implements LogicalType {
        @Override
        public String toString() {
            return "DATE";
        }
    }

    record TimeType(boolean isAdjustedToUTC, TimeUnit unit) implements LogicalType {
        @Override
        public String toString() {
            return "TIME(" + unit + "," + isAdjustedToUTC + ")";
        }
    }

    record TimestampType(boolean isAdjustedToUTC, TimeUnit unit) implements LogicalType {
        @Override
        public String toString() {
            return "TIMESTAMP(" + unit + "," + isAdjustedToUTC + ")";
        }
    }

    record IntType(int bitWidth, boolean isSigned) implements LogicalType {
        @Override
        public String toString() {
            return "INTEGER(" + bitWidth + "," + isSigned + ")";
        }
    }

    // Always-null column
    record UnknownType() implements LogicalType {
        @Override
        public String toString() {
            return "UNKNOWN";
        }
    }

    record JsonType() implements LogicalType {
        @Override
        public String toString() {
            return "JSON";
        }
    }

    record BsonType() implements LogicalType {
        @Override
        public String toString() {
            return "BSON";
        }
    }

    record UuidType() implements LogicalType {
        @Override
        public String toString() {
            return "UUID";
        }
    }

    record Float16Type() implements LogicalType {
        @Override
        public String toString() {
            return "FLOAT16";
        }
    }
}
