/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import dev.heartwood.MalformedSchemaException;
import dev.heartwood.metadata.RepetitionType;
import dev.heartwood.metadata.SchemaElement;

/**
 * Root schema container representing the complete Parquet schema.
 * <p>
 * Rebuilds the schema tree from the flat, pre-order list of schema elements stored in
 * the file footer and computes for each leaf column its path and its maximum definition
 * and repetition levels (Dremel encoding). Instances are immutable and may be shared
 * between threads.
 * </p>
 */
public class FileSchema {

    static final String MAX_DEPTH_PROPERTY = "heartwood.schema.maxDepth";

    private static final int DEFAULT_MAX_DEPTH = 64;

    private static final System.Logger LOG = System.getLogger(FileSchema.class.getName());

    private final SchemaNode rootNode;
    private final List<ColumnDescriptor> columns;
    private final Map<String, Integer> columnIndexByPath;
    private final int maxNestingDepth;

    private FileSchema(SchemaNode rootNode, List<ColumnDescriptor> columns) {
        this.rootNode = rootNode;
        this.columns = List.copyOf(columns);

        Map<String, Integer> indexByPath = new HashMap<>();
        int maxDepth = 0;
        for (int i = 0; i < columns.size(); i++) {
            ColumnDescriptor column = columns.get(i);
            indexByPath.putIfAbsent(column.dottedPath(), i);
            maxDepth = Math.max(maxDepth, column.node().depth());
        }
        this.columnIndexByPath = Map.copyOf(indexByPath);
        this.maxNestingDepth = maxDepth;
    }

    /**
     * Reconstruct schema from the flat schema element list, guarding the tree depth
     * with the limit configured via the {@code heartwood.schema.maxDepth} system property.
     */
    public static FileSchema fromSchemaElements(List<SchemaElement> elements) throws MalformedSchemaException {
        return fromSchemaElements(elements, Integer.getInteger(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH));
    }

    /**
     * Reconstruct schema from the flat schema element list.
     *
     * @param elements schema elements in pre-order, starting with the root
     * @param maxDepth maximum distance of any node from the root
     * @throws MalformedSchemaException if the list is empty or the declared child counts
     *         don't match the number of elements
     */
    public static FileSchema fromSchemaElements(List<SchemaElement> elements, int maxDepth) throws MalformedSchemaException {
        if (elements.isEmpty()) {
            throw new MalformedSchemaException("Schema must contain at least a root element");
        }
        if (elements.get(0).isPrimitive()) {
            throw new MalformedSchemaException("Root schema element must be a group: " + elements.get(0).name());
        }

        int[] index = { 0 }; // Shared cursor into the element list
        SchemaNode root = buildTree(elements, index, null, maxDepth);

        if (index[0] != elements.size()) {
            throw new MalformedSchemaException(
                    "Schema element count mismatch: consumed " + index[0] + " of " + elements.size() + " elements");
        }

        List<ColumnDescriptor> columns = new ArrayList<>();
        collectColumns(root, new ArrayList<>(), 0, 0, columns);

        LOG.log(System.Logger.Level.DEBUG, "Reconstructed schema ''{0}'' from {1} elements: {2} columns",
                root.name(), elements.size(), columns.size());

        return new FileSchema(root, columns);
    }

    /**
     * Consume one element and, recursively, the subtrees of its declared children.
     */
    private static SchemaNode buildTree(List<SchemaElement> elements, int[] index, SchemaNode parent, int maxDepth)
            throws MalformedSchemaException {
        if (index[0] >= elements.size()) {
            throw new MalformedSchemaException(
                    "Unexpected end of schema elements: " + elements.size() + " elements, but child counts declare more");
        }

        SchemaElement element = elements.get(index[0]++);
        SchemaNode node = new SchemaNode(element, parent);
        if (node.depth() > maxDepth) {
            throw new MalformedSchemaException("Schema nesting too deep at '" + element.name() + "' (max " + maxDepth + ")");
        }

        int numChildren = element.childCount();
        if (numChildren < 0) {
            throw new MalformedSchemaException("Negative child count " + numChildren + " for schema element '" + element.name() + "'");
        }
        if (numChildren > 0 && element.isPrimitive()) {
            throw new MalformedSchemaException("Primitive schema element '" + element.name() + "' declares " + numChildren + " children");
        }

        if (numChildren > 0) {
            List<SchemaNode> children = new ArrayList<>(Math.min(numChildren, elements.size()));
            for (int i = 0; i < numChildren; i++) {
                children.add(buildTree(elements, index, node, maxDepth));
            }
            node.setChildren(children);
        }

        return node;
    }

    /**
     * Pre-order walk accumulating definition and repetition levels; emits one column per leaf.
     * The root contributes neither a path segment nor a level.
     */
    private static void collectColumns(SchemaNode node, List<String> path, int definitionLevel, int repetitionLevel,
                                       List<ColumnDescriptor> columns) {
        if (!node.isRoot()) {
            path.add(node.name());
            RepetitionType repetitionType = node.repetitionType();
            if (repetitionType != null) {
                definitionLevel += repetitionType.definitionLevelIncrement();
                repetitionLevel += repetitionType.repetitionLevelIncrement();
            }
        }

        if (node.isLeaf()) {
            SchemaElement element = node.element();
            ColumnDescriptor column = new ColumnDescriptor(path, element.type(), element.typeLength(), columns.size(),
                    definitionLevel, repetitionLevel, element, node);
            LOG.log(System.Logger.Level.TRACE, "Column {0}: {1}", column.columnIndex(), column);
            columns.add(column);
        }
        else {
            for (SchemaNode child : node.children()) {
                collectColumns(child, path, definitionLevel, repetitionLevel, columns);
            }
        }

        if (!node.isRoot()) {
            path.remove(path.size() - 1);
        }
    }

    public String getName() {
        return rootNode.name();
    }

    /**
     * Returns the hierarchical schema tree representation.
     */
    public SchemaNode getRootNode() {
        return rootNode;
    }

    /**
     * Returns all leaf columns in pre-order, which is the order of column chunks in a row group.
     */
    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    public ColumnDescriptor getColumn(int index) {
        return columns.get(index);
    }

    /**
     * Returns the column with the given dotted path, e.g. {@code address.street}.
     */
    public ColumnDescriptor getColumn(String dottedPath) {
        return findColumn(dottedPath)
                .orElseThrow(() -> new IllegalArgumentException("Column not found: " + dottedPath));
    }

    public Optional<ColumnDescriptor> findColumn(String dottedPath) {
        Integer index = columnIndexByPath.get(dottedPath);
        return index != null ? Optional.of(columns.get(index)) : Optional.empty();
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Returns the depth of the deepest leaf column; top-level columns have depth 1.
     */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    /**
     * Finds a top-level field by name in the schema tree.
     */
    public SchemaNode getField(String name) {
        SchemaNode field = rootNode.getChild(name);
        if (field == null) {
            throw new IllegalArgumentException("Field not found: " + name);
        }
        return field;
    }

    /**
     * Returns true if all top-level fields are primitives, i.e. no column needs
     * record assembly and no column has repetition.
     */
    public boolean isFlatSchema() {
        for (SchemaNode child : rootNode.children()) {
            if (!child.isLeaf()) {
                return false;
            }
        }
        for (ColumnDescriptor column : columns) {
            if (column.maxRepetitionLevel() > 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("message ").append(rootNode.name()).append(" {\n");
        for (SchemaNode child : rootNode.children()) {
            appendNode(sb, child, 1);
        }
        sb.append("}");
        return sb.toString();
    }

    private static void appendNode(StringBuilder sb, SchemaNode node, int indent) {
        SchemaElement element = node.element();
        sb.append("  ".repeat(indent));
        if (node.repetitionType() != null) {
            sb.append(node.repetitionType().name().toLowerCase()).append(" ");
        }

        if (node.isLeaf()) {
            sb.append(element.type().name().toLowerCase());
            if (element.typeLength() != null) {
                sb.append("(").append(element.typeLength()).append(")");
            }
            sb.append(" ").append(node.name());
            appendAnnotation(sb, element);
            sb.append(";\n");
        }
        else {
            sb.append("group ").append(node.name());
            appendAnnotation(sb, element);
            sb.append(" {\n");
            for (SchemaNode child : node.children()) {
                appendNode(sb, child, indent + 1);
            }
            sb.append("  ".repeat(indent)).append("}\n");
        }
    }

    private static void appendAnnotation(StringBuilder sb, SchemaElement element) {
        if (element.logicalType() != null) {
            sb.append(" (").append(element.logicalType()).append(")");
        }
        else if (element.convertedType() != null) {
            sb.append(" (").append(element.convertedType()).append(")");
        }
    }
}
