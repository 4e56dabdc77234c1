package com.github.stormino.audioextract.exception;

import java.nio.file.Path;

/**
 * Exception thrown when no free numbered variant of an output path is left.
 */
public class PathExhaustionException extends ConversionException {

    private final Path desiredPath;
    private final int attempts;

    public PathExhaustionException(Path desiredPath, int attempts) {
        super(String.format("Could not generate unique filename for %s after %d attempts", desiredPath, attempts));
        this.desiredPath = desiredPath;
        this.attempts = attempts;
    }

    public Path getDesiredPath() {
        return desiredPath;
    }

    public int getAttempts() {
        return attempts;
    }
}
