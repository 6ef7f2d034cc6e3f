/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood;

/**
 * Raised by the Thrift compact protocol decoder and the metadata readers built on it:
 * premature end of data, invalid binary lengths, over-long varints, struct nesting
 * overflow or underflow, unknown wire types and missing required fields.
 */
public class MalformedMetadataException extends ParquetFormatException {

    public MalformedMetadataException(String message) {
        super(message);
    }
}
