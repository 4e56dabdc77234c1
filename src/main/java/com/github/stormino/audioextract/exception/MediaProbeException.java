package com.github.stormino.audioextract.exception;

/**
 * Exception thrown when media inspection fails.
 */
public class MediaProbeException extends ConversionException {

    private final String inputFile;
    private final Integer exitCode;

    public MediaProbeException(String message, String inputFile) {
        super(message);
        this.inputFile = inputFile;
        this.exitCode = null;
    }

    public MediaProbeException(String message, String inputFile, Integer exitCode) {
        super(message);
        this.inputFile = inputFile;
        this.exitCode = exitCode;
    }

    public MediaProbeException(String message, Throwable cause, String inputFile) {
        super(message, cause);
        this.inputFile = inputFile;
        this.exitCode = null;
    }

    public String getInputFile() {
        return inputFile;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
