/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood;

/**
 * Raised when the flat list of schema elements cannot be turned into a schema tree,
 * e.g. because it is empty or its child counts don't add up to the number of elements.
 */
public class MalformedSchemaException extends ParquetFormatException {

    public MalformedSchemaException(String message) {
        super(message);
    }
}
