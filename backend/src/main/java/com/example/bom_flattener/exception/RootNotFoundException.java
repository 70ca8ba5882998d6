package com.example.bom_flattener.exception;

import java.util.List;

public class RootNotFoundException extends BomException {

    public RootNotFoundException() {
        super("No root BOM found.");
    }

    public RootNotFoundException(List<String> candidates) {
        super(candidates.isEmpty()
                ? "No root BOM found."
                : "Singular root BOM not found. candidates=" + candidates);
    }

    public RootNotFoundException(String message) {
        super(message);
    }

    public RootNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public RootNotFoundException(Throwable cause) {
        super(cause);
    }

    protected RootNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
