package com.astroplatform.common.exception;

public class PipelineException extends RuntimeException {
    private final String component;

    public PipelineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public PipelineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
