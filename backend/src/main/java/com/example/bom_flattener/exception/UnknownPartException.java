package com.example.bom_flattener.exception;

public class UnknownPartException extends UnresolvedReferenceException {

    public UnknownPartException() {
        super();
    }

    public UnknownPartException(String partNumber, String referencedBy) {
        super(referencedBy == null
                ? "Part not found. partNumber=" + partNumber
                : "Part not found. partNumber=" + partNumber + ", referencedBy=" + referencedBy);
        setPartNumber(partNumber);
    }

    public UnknownPartException(String message) {
        super(message);
    }

    public UnknownPartException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnknownPartException(Throwable cause) {
        super(cause);
    }

    protected UnknownPartException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
