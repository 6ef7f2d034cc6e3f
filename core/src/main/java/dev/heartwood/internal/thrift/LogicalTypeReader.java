/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.internal.thrift;

import dev.heartwood.MalformedMetadataException;
import dev.heartwood.metadata.LogicalType;
import dev.heartwood.metadata.LogicalType.TimeUnit;

import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_BOOLEAN_FALSE;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_BOOLEAN_TRUE;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_BYTE;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Reader for the LogicalType union from Thrift Compact Protocol.
 * <p>
 * Each variant of the union is a (possibly empty) struct identified by its field id.
 * Variants this reader doesn't know are skipped, yielding null.
 * </p>
 */
public class LogicalTypeReader {

    public static LogicalType read(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            return readInternal(reader);
        }
        finally {
            reader.popStruct();
        }
    }

    private static LogicalType readInternal(ThriftCompactReader reader) throws MalformedMetadataException {
        LogicalType result = null;

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                return result;
            }

            // Union: only one field should be set; anything beyond the first is skipped
            if (result != null || header.type() != TYPE_STRUCT) {
                reader.skipField(header.type());
                continue;
            }

            result = switch (header.fieldId()) {
                case 1 -> skipEmpty(reader, new LogicalType.StringType());
                case 2 -> skipEmpty(reader, new LogicalType.MapType());
                case 3 -> skipEmpty(reader, new LogicalType.ListType());
                case 4 -> skipEmpty(reader, new LogicalType.EnumType());
                case 5 -> readDecimalType(reader);
                case 6 -> skipEmpty(reader, new LogicalType.DateType());
                case 7 -> readTimeType(reader);
                case 8 -> readTimestampType(reader);
                case 10 -> readIntType(reader);
                case 11 -> skipEmpty(reader, new LogicalType.UnknownType());
                case 12 -> skipEmpty(reader, new LogicalType.JsonType());
                case 13 -> skipEmpty(reader, new LogicalType.BsonType());
                case 14 -> skipEmpty(reader, new LogicalType.UuidType());
                case 15 -> skipEmpty(reader, new LogicalType.Float16Type());
                default -> skipEmpty(reader, null);
            };
        }
    }

    private static LogicalType skipEmpty(ThriftCompactReader reader, LogicalType type) throws MalformedMetadataException {
        reader.skipStruct();
        return type;
    }

    private static LogicalType.DecimalType readDecimalType(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            Integer scale = null;
            Integer precision = null;

            while (true) {
                ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
                if (header == null) {
                    break;
                }

                if (header.fieldId() == 1 && header.type() == TYPE_I32) {
                    scale = reader.readI32();
                }
                else if (header.fieldId() == 2 && header.type() == TYPE_I32) {
                    precision = reader.readI32();
                }
                else {
                    reader.skipField(header.type());
                }
            }

            if (scale == null || precision == null) {
                throw new MalformedMetadataException("DecimalType missing required field: " + (scale == null ? "scale" : "precision"));
            }
            return new LogicalType.DecimalType(scale, precision);
        }
        finally {
            reader.popStruct();
        }
    }

    private static LogicalType.TimeType readTimeType(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            boolean isAdjustedToUTC = false;
            TimeUnit unit = TimeUnit.MILLIS;

            while (true) {
                ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
                if (header == null) {
                    break;
                }

                if (header.fieldId() == 1 && isBoolean(header)) {
                    isAdjustedToUTC = reader.readBoolean();
                }
                else if (header.fieldId() == 2 && header.type() == TYPE_STRUCT) {
                    unit = readTimeUnit(reader);
                }
                else {
                    reader.skipField(header.type());
                }
            }

            return new LogicalType.TimeType(isAdjustedToUTC, unit);
        }
        finally {
            reader.popStruct();
        }
    }

    private static LogicalType.TimestampType readTimestampType(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            boolean isAdjustedToUTC = false;
            TimeUnit unit = TimeUnit.MILLIS;

            while (true) {
                ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
                if (header == null) {
                    break;
                }

                if (header.fieldId() == 1 && isBoolean(header)) {
                    isAdjustedToUTC = reader.readBoolean();
                }
                else if (header.fieldId() == 2 && header.type() == TYPE_STRUCT) {
                    unit = readTimeUnit(reader);
                }
                else {
                    reader.skipField(header.type());
                }
            }

            return new LogicalType.TimestampType(isAdjustedToUTC, unit);
        }
        finally {
            reader.popStruct();
        }
    }

    private static LogicalType.IntType readIntType(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            int bitWidth = 32;
            boolean isSigned = true;

            while (true) {
                ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
                if (header == null) {
                    break;
                }

                if (header.fieldId() == 1 && header.type() == TYPE_BYTE) {
                    bitWidth = reader.readByte();
                }
                else if (header.fieldId() == 2 && isBoolean(header)) {
                    isSigned = reader.readBoolean();
                }
                else {
                    reader.skipField(header.type());
                }
            }

            return new LogicalType.IntType(bitWidth, isSigned);
        }
        finally {
            reader.popStruct();
        }
    }

    /**
     * TimeUnit is itself a union of empty structs: MILLIS(1), MICROS(2), NANOS(3).
     */
    private static TimeUnit readTimeUnit(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            TimeUnit unit = null;

            while (true) {
                ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
                if (header == null) {
                    break;
                }

                if (unit == null) {
                    unit = switch (header.fieldId()) {
                        case 1 -> TimeUnit.MILLIS;
                        case 2 -> TimeUnit.MICROS;
                        case 3 -> TimeUnit.NANOS;
                        default -> null;
                    };
                }
                reader.skipField(header.type());
            }

            if (unit == null) {
                throw new MalformedMetadataException("TimeUnit has no known variant set");
            }
            return unit;
        }
        finally {
            reader.popStruct();
        }
    }

    private static boolean isBoolean(ThriftCompactReader.FieldHeader header) {
        return header.type() == TYPE_BOOLEAN_TRUE || header.type() == TYPE_BOOLEAN_FALSE;
    }
}
