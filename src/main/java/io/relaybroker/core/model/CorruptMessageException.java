package io.relaybroker.core.model;

import java.io.IOException;

/**
 * Raised when a stored record cannot be decoded back into a {@link Message}.
 */
public final class CorruptMessageException extends IOException {

    public CorruptMessageException(final String message) {
        super(message);
    }
}
