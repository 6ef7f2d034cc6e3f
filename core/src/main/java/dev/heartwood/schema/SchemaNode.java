/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dev.heartwood.metadata.RepetitionType;
import dev.heartwood.metadata.SchemaElement;

/**
 * A node of the reconstructed schema tree, wrapping one {@link SchemaElement}.
 * <p>
 * The tree is owned top-down by the root. The parent link is a back-reference used
 * for navigation only. Nodes are immutable once {@link FileSchema} has built them.
 * </p>
 */
public final class SchemaNode {

    private final SchemaElement element;
    private final SchemaNode parent;
    private final int depth;
    private List<SchemaNode> children = List.of();

    SchemaNode(SchemaElement element, SchemaNode parent) {
        this.element = element;
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    void setChildren(List<SchemaNode> children) {
        this.children = List.copyOf(children);
    }

    public SchemaElement element() {
        return element;
    }

    public String name() {
        return element.name();
    }

    /**
     * Returns the repetition of this node; null for a root that doesn't declare one.
     */
    public RepetitionType repetitionType() {
        return element.repetitionType();
    }

    /**
     * Returns the parent node, or null for the root.
     */
    public SchemaNode parent() {
        return parent;
    }

    public List<SchemaNode> children() {
        return children;
    }

    /**
     * Returns the distance from the root; the root itself has depth 0.
     */
    public int depth() {
        return depth;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * A node is a leaf iff its element carries a physical type.
     */
    public boolean isLeaf() {
        return element.isPrimitive();
    }

    /**
     * Returns the child with the given name, or null if there is none.
     */
    public SchemaNode getChild(String name) {
        for (SchemaNode child : children) {
            if (child.name().equals(name)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Returns the names from (but excluding) the root down to this node.
     */
    public List<String> path() {
        List<String> path = new ArrayList<>(depth);
        for (SchemaNode node = this; !node.isRoot(); node = node.parent) {
            path.add(node.name());
        }
        Collections.reverse(path);
        return path;
    }

    @Override
    public String toString() {
        return "SchemaNode[" + (isRoot() ? name() : String.join(".", path())) + (isLeaf() ? ", " + element.type() : ", children=" + children.size()) + "]";
    }
}
