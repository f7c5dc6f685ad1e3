package com.relaygate.model;

/**
 * How credentials are presented to an upstream provider.
 */
public enum AuthMethod {
    /**
     * {@code Authorization: Bearer <key>}
     */
    BEARER,

    /**
     * {@code x-api-key: <key>}
     */
    API_KEY_HEADER,

    /**
     * No credentials (local or self-hosted endpoints).
     */
    NONE;

    public boolean requiresKey() {
        return this != NONE;
    }
}
