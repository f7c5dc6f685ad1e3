package com.relaygate.model;

/**
 * Wire protocol spoken by a provider endpoint.
 */
public enum ApiStyle {
    OPENAI,
    ANTHROPIC
}
