package org.celshape;

public class CelShapeException extends RuntimeException {

    public CelShapeException(String message) {
        super(message);
    }

    public CelShapeException(String message, Throwable cause) {
        super(message, cause);
    }

    public CelShapeException(Throwable cause) {
        super(cause);
    }
}
