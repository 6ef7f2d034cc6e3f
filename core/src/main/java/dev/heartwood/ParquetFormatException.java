/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood;

import java.io.IOException;

/**
 * Base class for errors raised when Parquet metadata is malformed or contains unexpected data.
 * <p>
 * Decoding is all-or-nothing: when one of these is thrown, no partially decoded
 * metadata or schema is handed out.
 * </p>
 */
public class ParquetFormatException extends IOException {

    public ParquetFormatException(String message) {
        super(message);
    }
}
