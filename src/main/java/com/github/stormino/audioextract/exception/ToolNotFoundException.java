package com.github.stormino.audioextract.exception;

/**
 * Exception thrown when the external transcoder cannot be found or does not run.
 */
public class ToolNotFoundException extends ConversionException {

    private final String toolPath;

    public ToolNotFoundException(String message, String toolPath) {
        super(message);
        this.toolPath = toolPath;
    }

    public ToolNotFoundException(String message, String toolPath, Throwable cause) {
        super(message, cause);
        this.toolPath = toolPath;
    }

    public String getToolPath() {
        return toolPath;
    }
}
