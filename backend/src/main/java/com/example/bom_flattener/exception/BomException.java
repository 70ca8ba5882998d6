package com.example.bom_flattener.exception;

public class BomException extends RuntimeException {

    public BomException() {
        super();
    }

    public BomException(String message) {
        super(message);
    }

    public BomException(String message, Throwable cause) {
        super(message, cause);
    }

    public BomException(Throwable cause) {
        super(cause);
    }

    protected BomException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
