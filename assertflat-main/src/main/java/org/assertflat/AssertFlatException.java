package org.assertflat;

public class AssertFlatException extends RuntimeException {

    public AssertFlatException(String message) {
        super(message);
    }

    public AssertFlatException(String message, Throwable cause) {
        super(message, cause);
    }

    public AssertFlatException(Throwable cause) {
        super(cause);
    }
}
