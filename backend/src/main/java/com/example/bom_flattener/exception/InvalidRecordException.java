package com.example.bom_flattener.exception;

public class InvalidRecordException extends BomException {

    public InvalidRecordException() {
        super();
    }

    public InvalidRecordException(String sheet, int row, String reason) {
        super("Invalid record. sheet=" + sheet + ", row=" + row + ", reason=" + reason);
    }

    public InvalidRecordException(String sheet, int row, String reason, Throwable cause) {
        super("Invalid record. sheet=" + sheet + ", row=" + row + ", reason=" + reason, cause);
    }

    public InvalidRecordException(String message) {
        super(message);
    }

    public InvalidRecordException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidRecordException(Throwable cause) {
        super(cause);
    }

    protected InvalidRecordException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
