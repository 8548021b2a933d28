package org.sentential.errors;

/**
 * A variable was referenced during evaluation but the bindings had no value for it.
 */
public final class BindingError extends SententialError {

    private final char label;

    public BindingError(char label) {
        this.label = label;
    }

    public char getLabel() {
        return label;
    }

    @Override
    public String getMessage() {
        return "Unbound variable: " + label;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BindingError && ((BindingError) o).label == label;
    }

    @Override
    public int hashCode() {
        return Character.hashCode(label);
    }
}
