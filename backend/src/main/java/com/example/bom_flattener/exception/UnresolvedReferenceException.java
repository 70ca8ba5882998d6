package com.example.bom_flattener.exception;

public class UnresolvedReferenceException extends BomException {

    private String partNumber;

    public UnresolvedReferenceException() {
        super();
    }

    public UnresolvedReferenceException(String partNumber, String referencedBy) {
        super("Unresolved reference. partNumber=" + partNumber + ", referencedBy=" + referencedBy);
        this.partNumber = partNumber;
    }

    public UnresolvedReferenceException(String message) {
        super(message);
    }

    public UnresolvedReferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnresolvedReferenceException(Throwable cause) {
        super(cause);
    }

    protected UnresolvedReferenceException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }

    protected void setPartNumber(String partNumber) {
        this.partNumber = partNumber;
    }

    public String getPartNumber() {
        return partNumber;
    }
}
