/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay;

/**
 * Base runtime exception raised by the relay components.
 */
public class RelayException extends RuntimeException {

    private static final long serialVersionUID = 4186223905112458317L;

    public RelayException() {
    }

    public RelayException(String message) {
        super(message);
    }

    public RelayException(Throwable cause) {
        super(cause);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
