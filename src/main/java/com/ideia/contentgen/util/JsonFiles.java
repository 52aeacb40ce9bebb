package com.ideia.contentgen.util;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON file helpers. Writes go to a sibling {@code .tmp} file which is then renamed over the
 * target, so readers only ever see the previous or the new complete document.
 */
public final class JsonFiles {
    private JsonFiles() {}

    public static Path tempPathFor(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    public static void writeAtomically(ObjectMapper mapper, Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = tempPathFor(target);
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
