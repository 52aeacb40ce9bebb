package com.ideia.contentgen.service.store;

import com.ideia.contentgen.model.LockInfo;

/** Another run already owns the data directory. */
public class LockConflictException extends RuntimeException {
    private final transient LockInfo existing;

    public LockConflictException(String message, LockInfo existing) {
        super(message);
        this.existing = existing;
    }

    public LockInfo getExisting() {
        return existing;
    }
}
