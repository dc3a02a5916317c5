/*
 * Copyright Oplog Relay Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.oplogrelay.connector.mongodb;

import org.bson.BsonTimestamp;

/**
 * Conversions between oplog positions and the 64-bit integers they are persisted as: the seconds in the high 32 bits and
 * the increment in the low 32 bits.
 */
public final class Timestamps {

    public static long toLong(BsonTimestamp position) {
        return position.getValue();
    }

    public static BsonTimestamp fromLong(long value) {
        return new BsonTimestamp(value);
    }

    /**
     * Whether the given position is absent or the zero position that marks "no progress yet".
     *
     * @param position the position; may be null
     * @return {@code true} if there is no meaningful position
     */
    public static boolean isUnset(BsonTimestamp position) {
        return position == null || position.getValue() == 0L;
    }

    private Timestamps() {
    }
}
