/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import io.oplogrelay.RelayException;

/**
 * Signals that checkpoints could not be persisted and the previously persisted checkpoints could not be restored either.
 */
public class CheckpointStoreException extends RelayException {

    private static final long serialVersionUID = 6251883467205914371L;

    public CheckpointStoreException(String message) {
        super(message);
    }

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
