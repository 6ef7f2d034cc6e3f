/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.reader;

import java.nio.ByteBuffer;

import dev.heartwood.MalformedMetadataException;
import dev.heartwood.ParquetFormatException;
import dev.heartwood.internal.thrift.FileMetaDataReader;
import dev.heartwood.internal.thrift.ThriftCompactReader;
import dev.heartwood.metadata.FileMetaData;
import dev.heartwood.schema.FileSchema;

/**
 * Entry point for decoding the Thrift-encoded footer of a Parquet file.
 * <p>
 * The footer bytes are supplied by the caller; locating them in a file and fetching
 * them is up to the I/O layer. The caller's buffer position and limit are not modified,
 * so the same buffer may be decoded concurrently by several threads.
 * </p>
 */
public final class ParquetMetadataReader {

    private static final System.Logger LOG = System.getLogger(ParquetMetadataReader.class.getName());

    private ParquetMetadataReader() {
        // Utility class
    }

    /**
     * Decodes file metadata from the remaining bytes of the given buffer.
     *
     * @param footer the Thrift compact encoded {@code FileMetaData} struct
     * @return the decoded metadata
     * @throws MalformedMetadataException if the footer is not valid compact protocol data
     *         or lacks required fields
     */
    public static FileMetaData readFileMetaData(ByteBuffer footer) throws MalformedMetadataException {
        ThriftCompactReader reader = new ThriftCompactReader(footer);
        FileMetaData metaData = FileMetaDataReader.read(reader);

        LOG.log(System.Logger.Level.DEBUG, "Decoded footer of {0} bytes: version {1}, {2} schema elements, {3} rows in {4} row groups, created by ''{5}''",
                reader.getBytesRead(), metaData.version(), metaData.schema().size(), metaData.numRows(),
                metaData.rowGroupCount(), metaData.createdBy());

        return metaData;
    }

    /**
     * Decodes file metadata and reconstructs the schema from it.
     *
     * @throws ParquetFormatException if either the footer or its schema is malformed
     */
    public static FileSchema readSchema(ByteBuffer footer) throws ParquetFormatException {
        return FileSchema.fromSchemaElements(readFileMetaData(footer).schema());
    }
}
