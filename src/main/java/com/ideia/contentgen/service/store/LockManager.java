package com.ideia.contentgen.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.model.LockInfo;
import com.ideia.contentgen.util.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Single-owner marker on the data directory. A second run refuses to start while the lock file
 * exists unless told to take it over. Whether the recorded owner is still alive is not checked; a
 * lock left by a crashed run has to be taken over with {@code force}.
 */
public class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final Path lockPath;
    private final ObjectMapper mapper;
    private LockInfo held;

    public LockManager(Path lockPath, ObjectMapper mapper) {
        this.lockPath = lockPath;
        this.mapper = mapper;
    }

    /**
     * Creates the lock file. Without {@code force} the file is created exclusively, so of two runs
     * starting at the same moment exactly one wins.
     *
     * @param force   overwrite an existing lock instead of failing
     * @param dryRun  check for conflicts but do not write the lock file
     * @throws LockConflictException when a lock exists and {@code force} is false
     */
    public synchronized LockInfo acquire(boolean force, String model, boolean dryRun) {
        LockInfo info = new LockInfo();
        info.setOwnerPid(ProcessHandle.current().pid());
        info.setStartedAt(Instant.now().toString());
        info.setModel(model);
        info.setHostname(hostname());

        if (Files.exists(lockPath)) {
            if (!force) throw conflict();
            log.warn("Overriding existing lock {} held by pid {}", lockPath, ownerOf(readExisting()));
        }
        if (dryRun) {
            log.info("[dry-run] would write lock {}", lockPath);
            return info;
        }
        try {
            if (force) {
                JsonFiles.writeAtomically(mapper, lockPath, info);
            } else {
                Path parent = lockPath.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.write(lockPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(info),
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            }
        } catch (FileAlreadyExistsException e) {
            throw conflict();
        } catch (IOException e) {
            throw new ContentPersistenceException("Cannot write lock " + lockPath, e);
        }
        held = info;
        log.info("Acquired lock {} (pid {})", lockPath, info.getOwnerPid());
        return info;
    }

    private LockConflictException conflict() {
        LockInfo existing = readExisting();
        String owner = existing != null
                ? "pid " + existing.getOwnerPid() + " since " + existing.getStartedAt()
                : "unknown owner";
        return new LockConflictException("Data directory is locked by " + owner + " (" + lockPath
                + "). Stop the other run or pass --app.force-lock=true.", existing);
    }

    private static String ownerOf(LockInfo info) {
        return info != null ? String.valueOf(info.getOwnerPid()) : "?";
    }

    /** Deletes the lock file if this process wrote it. Safe to call more than once. */
    public synchronized void release() {
        if (held == null) return;
        if (!Files.exists(lockPath)) {
            held = null;
            return;
        }
        try {
            LockInfo current = readExisting();
            if (current == null || current.getOwnerPid() == held.getOwnerPid()) {
                Files.deleteIfExists(lockPath);
                log.info("Released lock {}", lockPath);
            } else {
                log.warn("Lock {} now belongs to pid {}; leaving it in place", lockPath, current.getOwnerPid());
            }
        } catch (IOException e) {
            log.error("Failed to release lock {}: {}", lockPath, e.toString());
        } finally {
            held = null;
        }
    }

    public synchronized boolean isHeld() {
        return held != null;
    }

    private LockInfo readExisting() {
        try {
            return mapper.readValue(lockPath.toFile(), LockInfo.class);
        } catch (IOException e) {
            log.warn("Unreadable lock file {}: {}", lockPath, e.toString());
            return null;
        }
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            return "unknown";
        }
    }
}
