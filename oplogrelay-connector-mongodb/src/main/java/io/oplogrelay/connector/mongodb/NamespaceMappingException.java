/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import org.apache.kafka.common.config.ConfigException;

/**
 * Signals an invalid namespace mapping: conflicting field scopes, malformed patterns, or two source namespaces that would
 * be routed to the same target namespace.
 */
public class NamespaceMappingException extends ConfigException {

    private static final long serialVersionUID = -3349280711870862194L;

    public NamespaceMappingException(String message) {
        super(message);
    }

    public NamespaceMappingException(String name, Object value, String message) {
        super(name, value, message);
    }
}
