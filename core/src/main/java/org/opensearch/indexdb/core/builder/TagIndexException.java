/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.builder;

import org.opensearch.OpenSearchException;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.rest.RestStatus;

import java.io.IOException;

/**
 * Exception thrown when a record cannot be added to a tag index, such as a posting list that does not decode
 * or a tag name beyond the configured limit. Only raised when malformed records are not ignored.
 */
public class TagIndexException extends OpenSearchException {

    public TagIndexException(String msg, Object... args) {
        super(msg, args);
    }

    public TagIndexException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }

    public TagIndexException(StreamInput in) throws IOException {
        super(in);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
