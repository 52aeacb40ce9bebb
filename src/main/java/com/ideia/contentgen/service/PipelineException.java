package com.ideia.contentgen.service;

/** The run finished but at least one task was aborted. */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }
}
