/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.internal.thrift;

import java.util.ArrayList;
import java.util.List;

import dev.heartwood.MalformedMetadataException;
import dev.heartwood.metadata.FileMetaData;
import dev.heartwood.metadata.KeyValue;
import dev.heartwood.metadata.SchemaElement;

import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_I64;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_LIST;
import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Reader for FileMetaData from Thrift Compact Protocol.
 * <p>
 * Row groups are skipped without being materialized, only their number is recorded.
 * </p>
 */
public class FileMetaDataReader {

    public static FileMetaData read(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            return readInternal(reader);
        }
        finally {
            reader.popStruct();
        }
    }

    private static FileMetaData readInternal(ThriftCompactReader reader) throws MalformedMetadataException {
        Integer version = null;
        List<SchemaElement> schema = null;
        Long numRows = null;
        Integer rowGroupCount = null;
        List<KeyValue> keyValueMetadata = List.of();
        String createdBy = null;

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }

            switch (header.fieldId()) {
                case 1: // version
                    if (header.type() == TYPE_I32) {
                        version = reader.readI32();
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 2: // schema
                    if (header.type() == TYPE_LIST) {
                        schema = readSchema(reader);
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 3: // num_rows
                    if (header.type() == TYPE_I64) {
                        numRows = reader.readI64();
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 4: // row_groups
                    if (header.type() == TYPE_LIST) {
                        rowGroupCount = skipRowGroups(reader);
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 5: // key_value_metadata (optional)
                    if (header.type() == TYPE_LIST) {
                        keyValueMetadata = readKeyValueMetadata(reader);
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 6: // created_by (optional)
                    if (header.type() == TYPE_BINARY) {
                        createdBy = reader.readString();
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                default:
                    reader.skipField(header.type());
                    break;
            }
        }

        if (version == null) {
            throw missing("version");
        }
        if (schema == null) {
            throw missing("schema");
        }
        if (numRows == null) {
            throw missing("num_rows");
        }
        if (rowGroupCount == null) {
            throw missing("row_groups");
        }

        return new FileMetaData(version, schema, numRows, rowGroupCount, keyValueMetadata, createdBy);
    }

    private static List<SchemaElement> readSchema(ThriftCompactReader reader) throws MalformedMetadataException {
        ThriftCompactReader.CollectionHeader listHeader = reader.readListHeader();
        List<SchemaElement> schema = new ArrayList<>(Math.min(listHeader.size(), reader.remaining()));
        for (int i = 0; i < listHeader.size(); i++) {
            if (listHeader.elementType() == TYPE_STRUCT) {
                schema.add(SchemaElementReader.read(reader));
            }
            else {
                reader.skipField(listHeader.elementType());
            }
        }
        return schema;
    }

    private static int skipRowGroups(ThriftCompactReader reader) throws MalformedMetadataException {
        ThriftCompactReader.CollectionHeader listHeader = reader.readListHeader();
        for (int i = 0; i < listHeader.size(); i++) {
            reader.skipField(listHeader.elementType());
        }
        return listHeader.size();
    }

    private static List<KeyValue> readKeyValueMetadata(ThriftCompactReader reader) throws MalformedMetadataException {
        ThriftCompactReader.CollectionHeader listHeader = reader.readListHeader();
        List<KeyValue> keyValues = new ArrayList<>(Math.min(listHeader.size(), reader.remaining()));
        for (int i = 0; i < listHeader.size(); i++) {
            if (listHeader.elementType() == TYPE_STRUCT) {
                keyValues.add(KeyValueReader.read(reader));
            }
            else {
                reader.skipField(listHeader.elementType());
            }
        }
        return keyValues;
    }

    private static MalformedMetadataException missing(String field) {
        return new MalformedMetadataException("FileMetaData missing required field: " + field);
    }
}
