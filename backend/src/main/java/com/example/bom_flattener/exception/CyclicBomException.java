package com.example.bom_flattener.exception;

import java.util.List;

public class CyclicBomException extends BomException {

    private List<String> cycle = List.of();

    public CyclicBomException() {
        super();
    }

    public CyclicBomException(List<String> cycle) {
        super("Cyclic BOM. path=" + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public CyclicBomException(String message) {
        super(message);
    }

    public CyclicBomException(String message, Throwable cause) {
        super(message, cause);
    }

    public CyclicBomException(Throwable cause) {
        super(cause);
    }

    protected CyclicBomException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
