package org.sentential;

import com.google.common.base.Preconditions;
import org.sentential.errors.SententialError;

/**
 * Outcome of evaluating a formula: either a boolean value or the error that stopped evaluation.
 */
public final class Evaluation {

    private static final Evaluation TRUE = new Evaluation(true, null);
    private static final Evaluation FALSE = new Evaluation(false, null);

    private final boolean value;
    private final SententialError error;

    private Evaluation(boolean value, SententialError error) {
        this.value = value;
        this.error = error;
    }

    public static Evaluation of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Evaluation failure(SententialError error) {
        return new Evaluation(false, Preconditions.checkNotNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this evaluation failed
     */
    public boolean getValue() {
        if (error != null) {
            throw new IllegalStateException("Evaluation failed: " + error.getMessage());
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this evaluation succeeded
     */
    public SententialError getError() {
        Preconditions.checkState(error != null, "Evaluation succeeded with %s", value);
        return error;
    }

    public Evaluation negate() {
        return isSuccess() ? of(!value) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Evaluation)) {
            return false;
        }
        Evaluation other = (Evaluation) o;
        return isSuccess() ? other.isSuccess() && other.value == value : error.equals(other.error);
    }

    @Override
    public int hashCode() {
        return isSuccess() ? Boolean.hashCode(value) : error.hashCode();
    }

    @Override
    public String toString() {
        return isSuccess() ? String.valueOf(value) : error.toString();
    }
}
