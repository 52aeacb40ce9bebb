package com.ideia.contentgen.service.generation;

/**
 * A single call to the generative service failed. {@code status} is the HTTP status when the
 * service answered, null for timeouts and transport errors.
 */
public class GenerationServiceException extends Exception {
    private final Integer status;

    public GenerationServiceException(Integer status, String message) {
        super(message);
        this.status = status;
    }

    public GenerationServiceException(Integer status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public Integer getStatus() {
        return status;
    }
}
