/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.metadata;

import java.util.List;

/**
 * Top-level file metadata decoded from a Parquet footer.
 * <p>
 * Row groups are counted but not decoded; their column chunk and page layout is
 * handled by the readers that fetch column data.
 * </p>
 *
 * @param version format version
 * @param schema flattened schema elements, in pre-order
 * @param numRows total number of rows across all row groups
 * @param rowGroupCount number of row groups
 * @param keyValueMetadata application metadata, empty if absent
 * @param createdBy name of the writing application, may be null
 */
public record FileMetaData(
        int version,
        List<SchemaElement> schema,
        long numRows,
        int rowGroupCount,
        List<KeyValue> keyValueMetadata,
        String createdBy) {

    public FileMetaData {
        schema = List.copyOf(schema);
        keyValueMetadata = List.copyOf(keyValueMetadata);
    }
}
