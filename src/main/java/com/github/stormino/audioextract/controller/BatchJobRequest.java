package com.github.stormino.audioextract.controller;

import com.github.stormino.audioextract.model.ConversionParameters;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class BatchJobRequest {

    @NotEmpty
    private List<String> inputPaths;

    /**
     * Shared output directory. Falls back to the configured default, then to each
     * source file's own directory.
     */
    private String outputDirectory;

    private ConversionParameters parameters;

    private String overwritePolicy;
}
