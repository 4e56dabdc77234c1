package com.github.stormino.audioextract.controller;

import com.github.stormino.audioextract.model.ConversionParameters;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AddJobRequest {

    @NotBlank
    private String id;

    @NotBlank
    private String inputPath;

    @NotBlank
    private String outputPath;

    private ConversionParameters parameters;  // null = configured defaults

    private String overwritePolicy;  // skip | replace | unique, null = configured default
}
