/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.metadata;

/**
 * One element of the flattened Parquet schema, as stored in the file footer.
 * <p>
 * Elements are stored in pre-order: each group element is immediately followed by
 * the flattened subtrees of its {@code numChildren} children.
 * </p>
 *
 * @param name element name
 * @param type physical type; null for group elements
 * @param typeLength byte length for {@code FIXED_LEN_BYTE_ARRAY}, otherwise usually null
 * @param repetitionType repetition; may be null for the root element
 * @param numChildren number of children for group elements; null or 0 for leaves
 * @param convertedType legacy type annotation, may be null
 * @param scale legacy decimal scale, may be null
 * @param precision legacy decimal precision, may be null
 * @param fieldId writer-assigned field id, may be null
 * @param logicalType logical type annotation, may be null
 */
public record SchemaElement(
        String name,
        PhysicalType type,
        Integer typeLength,
        RepetitionType repetitionType,
        Integer numChildren,
        ConvertedType convertedType,
        Integer scale,
        Integer precision,
        Integer fieldId,
        LogicalType logicalType) {

    public static SchemaElement group(String name, RepetitionType repetitionType, int numChildren) {
        return new SchemaElement(name, null, null, repetitionType, numChildren, null, null, null, null, null);
    }

    public static SchemaElement primitive(String name, PhysicalType type, RepetitionType repetitionType) {
        return new SchemaElement(name, type, null, repetitionType, null, null, null, null, null, null);
    }

    public boolean isGroup() {
        return type == null;
    }

    public boolean isPrimitive() {
        return type != null;
    }

    /**
     * Returns the declared number of children, treating an absent count as zero.
     */
    public int childCount() {
        return numChildren != null ? numChildren : 0;
    }
}
