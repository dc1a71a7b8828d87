package com.szntopology.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved attribute injection for a set of topology files.
 *
 * @param files per-file injections keyed by absolute, normalized path
 */
public record InjectionResult(Map<Path, FileInjection> files) {

    public InjectionResult {
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    /**
     * Returns the injection for one file.
     *
     * @param file topology file, made absolute before lookup
     * @return the file's injection, or empty if no rule matched it
     */
    public Optional<FileInjection> forFile(Path file) {
        return Optional.ofNullable(files.get(file.toAbsolutePath().normalize()));
    }
}
