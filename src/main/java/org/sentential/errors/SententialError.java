package org.sentential.errors;

/**
 * An error produced while evaluating or parsing a formula. Errors are returned as values, never thrown.
 *
 * The family is closed: {@link BindingError} and {@link ParserError} are the only variants.
 */
public abstract class SententialError {

    SententialError() {
    }

    public abstract String getMessage();

    @Override
    public String toString() {
        return String.format("%s(%s)", getClass().getSimpleName(), getMessage());
    }
}
