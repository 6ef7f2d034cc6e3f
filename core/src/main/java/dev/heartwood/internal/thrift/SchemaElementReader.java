/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.internal.thrift;

import dev.heartwood.MalformedMetadataException;
import dev.heartwood.metadata.ConvertedType;
import dev.heartwood.metadata.LogicalType;
import dev.heartwood.metadata.PhysicalType;
import dev.heartwood.metadata.RepetitionType;
import dev.heartwood.metadata.SchemaElement;

import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Reader for SchemaElement from Thrift Compact Protocol.
 */
public class SchemaElementReader {

    public static SchemaElement read(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            return readInternal(reader);
        }
        finally {
            reader.popStruct();
        }
    }

    private static SchemaElement readInternal(ThriftCompactReader reader) throws MalformedMetadataException {
        String name = null;
        PhysicalType type = null;
        Integer typeLength = null;
        RepetitionType repetitionType = null;
        Integer numChildren = null;
        ConvertedType convertedType = null;
        Integer scale = null;
        Integer precision = null;
        Integer fieldId = null;
        LogicalType logicalType = null;

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }

            if (!hasExpectedType(header)) {
                reader.skipField(header.type());
                continue;
            }

            switch (header.fieldId()) {
                case 1: // type
                    int typeValue = reader.readI32();
                    type = PhysicalType.fromThriftValue(typeValue);
                    if (type == null) {
                        throw new MalformedMetadataException("Unknown physical type " + typeValue + " in schema element");
                    }
                    break;
                case 2: // type_length
                    typeLength = reader.readI32();
                    break;
                case 3: // repetition_type
                    int repetitionValue = reader.readI32();
                    repetitionType = RepetitionType.fromThriftValue(repetitionValue);
                    if (repetitionType == null) {
                        throw new MalformedMetadataException("Unknown repetition type " + repetitionValue + " in schema element");
                    }
                    break;
                case 4: // name (required)
                    name = reader.readString();
                    break;
                case 5: // num_children
                    numChildren = reader.readI32();
                    break;
                case 6: // converted_type
                    convertedType = ConvertedType.fromThriftValue(reader.readI32());
                    break;
                case 7: // scale, legacy DECIMAL
                    scale = reader.readI32();
                    break;
                case 8: // precision, legacy DECIMAL
                    precision = reader.readI32();
                    break;
                case 9: // field_id
                    fieldId = reader.readI32();
                    break;
                case 10: // logicalType
                    logicalType = LogicalTypeReader.read(reader);
                    break;
                default:
                    reader.skipField(header.type());
                    break;
            }
        }

        if (name == null) {
            throw new MalformedMetadataException("SchemaElement missing required field: name");
        }
        return new SchemaElement(name, type, typeLength, repetitionType, numChildren, convertedType, scale, precision, fieldId, logicalType);
    }

    private static boolean hasExpectedType(ThriftCompactReader.FieldHeader header) {
        switch (header.fieldId()) {
            case 4:
                return header.type() == TYPE_BINARY;
            case 10:
                return header.type() == TYPE_STRUCT;
            default:
                // Fields 1-9 besides the name are all i32; unknown fields get skipped either way
                return header.fieldId() < 1 || header.fieldId() > 9 || header.type() == TYPE_I32;
        }
    }
}
