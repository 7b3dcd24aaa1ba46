package org.assertflat.types;

/**
 * Answer of a type classification query. {@link #UNKNOWN} means the question could not be decided,
 * never that the answer is false.
 */
public enum TriState {

    TRUE,
    FALSE,
    UNKNOWN;

    public static TriState of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isFalse() {
        return this == FALSE;
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }
}
