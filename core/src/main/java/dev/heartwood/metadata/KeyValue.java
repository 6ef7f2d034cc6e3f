/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.metadata;

/**
 * Application-defined key/value pair from the file footer.
 *
 * @param key the key, never null
 * @param value the value, may be null
 */
public record KeyValue(String key, String value) {
}
