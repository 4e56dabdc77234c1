package com.github.stormino.audioextract.service.parser;

/**
 * Interface for turning a transcoder's diagnostic output into a progress fraction.
 * One instance follows one process run.
 */
public interface ProgressParser {

    /**
     * Parse a single line of output.
     *
     * @param line Output line to parse
     * @return New progress fraction in [0, 1] if the line advanced it, null otherwise
     */
    Double parseLine(String line);

    /**
     * Reset the parser state for a new run.
     */
    void reset();

    /**
     * Get the total duration if known.
     *
     * @return Total duration in seconds, or null if unknown
     */
    Double getTotalDuration();
}
