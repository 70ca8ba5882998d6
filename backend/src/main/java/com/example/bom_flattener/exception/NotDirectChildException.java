package com.example.bom_flattener.exception;

public class NotDirectChildException extends BomException {

    public NotDirectChildException() {
        super();
    }

    public NotDirectChildException(String partNumber, String assemblyPartNumber) {
        super("Not a direct child. partNumber=" + partNumber + ", assembly=" + assemblyPartNumber);
    }

    public NotDirectChildException(String message) {
        super(message);
    }

    public NotDirectChildException(String message, Throwable cause) {
        super(message, cause);
    }

    public NotDirectChildException(Throwable cause) {
        super(cause);
    }

    protected NotDirectChildException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
