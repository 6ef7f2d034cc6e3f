/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.internal.thrift;

import dev.heartwood.MalformedMetadataException;
import dev.heartwood.metadata.KeyValue;

import static dev.heartwood.internal.thrift.ThriftCompactReader.TYPE_BINARY;

/**
 * Reader for KeyValue from Thrift Compact Protocol.
 */
public class KeyValueReader {

    public static KeyValue read(ThriftCompactReader reader) throws MalformedMetadataException {
        reader.pushStruct();
        try {
            String key = null;
            String value = null;

            while (true) {
                ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
                if (header == null) {
                    break;
                }

                if (header.fieldId() == 1 && header.type() == TYPE_BINARY) {
                    key = reader.readString();
                }
                else if (header.fieldId() == 2 && header.type() == TYPE_BINARY) {
                    value = reader.readString();
                }
                else {
                    reader.skipField(header.type());
                }
            }

            if (key == null) {
                throw new MalformedMetadataException("KeyValue missing required field: key");
            }
            return new KeyValue(key, value);
        }
        finally {
            reader.popStruct();
        }
    }
}
