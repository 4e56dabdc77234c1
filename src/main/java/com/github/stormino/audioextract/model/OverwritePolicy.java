package com.github.stormino.audioextract.model;

import com.github.stormino.audioextract.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * How a pre-existing output file is handled when a job is admitted.
 */
public enum OverwritePolicy {
    /** Existing output wins; the job is registered as skipped. */
    SKIP,
    /** Existing output is overwritten by the transcoder. */
    REPLACE,
    /** A numbered sibling name is chosen instead. */
    UNIQUE;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OverwritePolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Overwrite policy must not be blank", "overwritePolicy");
        }
        for (OverwritePolicy policy : values()) {
            if (policy.getValue().equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        throw ConfigurationException.invalidChoice("overwritePolicy", value,
                Arrays.stream(values()).map(OverwritePolicy::getValue).toList());
    }
}
