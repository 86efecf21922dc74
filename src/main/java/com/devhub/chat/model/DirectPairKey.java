package com.devhub.chat.model;

import lombok.Value;

/**
 * Canonical key of the unordered pair of identities sharing a direct room:
 * {@code of(a, b).equals(of(b, a))}.
 */
@Value
public class DirectPairKey {

    long low;
    long high;

    public static DirectPairKey of(long a, long b) {
        if (a == b) {
            throw new IllegalArgumentException("A direct room needs two distinct identities");
        }
        return new DirectPairKey(Math.min(a, b), Math.max(a, b));
    }

    /** Form stored in the unique {@code chat_rooms.direct_key} column. */
    public String storageKey() {
        return "dm:" + low + ":" + high;
    }
}
