package org.sentential.errors;

import com.google.common.base.Preconditions;

/**
 * Raised only by the text parser, never by evaluation.
 */
public final class ParserError extends SententialError {

    private final String message;

    public ParserError(String message) {
        this.message = Preconditions.checkNotNull(message, "message");
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParserError && ((ParserError) o).message.equals(message);
    }

    @Override
    public int hashCode() {
        return message.hashCode();
    }
}
