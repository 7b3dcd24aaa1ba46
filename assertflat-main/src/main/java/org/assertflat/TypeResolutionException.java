package org.assertflat;

/**
 * Raised when the type solver backing a document cannot be built, for example because a classpath
 * jar is unreadable. The classifier turns it into an unknown answer.
 */
public class TypeResolutionException extends AssertFlatException {

    public TypeResolutionException(String message) {
        super(message);
    }

    public TypeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
