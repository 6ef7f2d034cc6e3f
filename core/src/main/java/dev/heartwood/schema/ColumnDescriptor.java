/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.schema;

import java.util.List;

import dev.heartwood.metadata.LogicalType;
import dev.heartwood.metadata.PhysicalType;
import dev.heartwood.metadata.RepetitionType;
import dev.heartwood.metadata.SchemaElement;

/**
 * Describes a leaf column of the schema: its path, physical type and the maximum
 * definition and repetition levels needed to reassemble its values.
 *
 * @param path names from (but excluding) the root down to the leaf
 * @param type physical type of the column
 * @param typeLength byte length for {@code FIXED_LEN_BYTE_ARRAY}, may be null
 * @param columnIndex position of the column in pre-order; column chunks are stored in the same order
 * @param maxDefinitionLevel number of optional or repeated nodes on the path
 * @param maxRepetitionLevel number of repeated nodes on the path
 * @param element the leaf's schema element
 * @param node the leaf's node in the schema tree
 */
public record ColumnDescriptor(
        List<String> path,
        PhysicalType type,
        Integer typeLength,
        int columnIndex,
        int maxDefinitionLevel,
        int maxRepetitionLevel,
        SchemaElement element,
        SchemaNode node) {

    public ColumnDescriptor {
        path = List.copyOf(path);
    }

    /**
     * Returns the path segments joined by {@code .}, e.g. {@code address.street}.
     */
    public String dottedPath() {
        return String.join(".", path);
    }

    /**
     * Returns the name of the leaf field.
     */
    public String name() {
        return element.name();
    }

    public RepetitionType repetitionType() {
        return element.repetitionType();
    }

    public LogicalType logicalType() {
        return element.logicalType();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(dottedPath());
        sb.append(" ").append(type.name().toLowerCase());
        if (typeLength != null) {
            sb.append("(").append(typeLength).append(")");
        }
        if (element.logicalType() != null) {
            sb.append(" (").append(element.logicalType()).append(")");
        }
        sb.append(" [def=").append(maxDefinitionLevel);
        sb.append(", rep=").append(maxRepetitionLevel).append("]");
        return sb.toString();
    }
}
