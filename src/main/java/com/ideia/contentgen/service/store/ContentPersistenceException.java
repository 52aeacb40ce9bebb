package com.ideia.contentgen.service.store;

/**
 * A category file, checkpoint or hash snapshot could not be read or written. Fatal to the task
 * that hit it.
 */
public class ContentPersistenceException extends RuntimeException {
    public ContentPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
