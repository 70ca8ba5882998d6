package com.example.bom_flattener.exception;

public class DuplicatePartException extends BomException {

    public DuplicatePartException() {
        super();
    }

    public DuplicatePartException(String partNumber, int row) {
        super("Duplicate part. partNumber=" + partNumber + ", row=" + row);
    }

    public DuplicatePartException(String message) {
        super(message);
    }

    public DuplicatePartException(String message, Throwable cause) {
        super(message, cause);
    }

    public DuplicatePartException(Throwable cause) {
        super(cause);
    }

    protected DuplicatePartException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
