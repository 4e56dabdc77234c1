package com.github.stormino.audioextract.service;

import com.github.stormino.audioextract.exception.PathExhaustionException;
import com.github.stormino.audioextract.model.OverwritePolicy;
import com.github.stormino.audioextract.util.PathUtils;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decides where a job writes its output under an {@link OverwritePolicy}.
 */
@Slf4j
@Component
public class OutputPathResolver {

    @Value
    public static class Resolution {
        Path path;
        boolean skip;
    }

    /**
     * Sanitize the filename of {@code desiredPath} and apply the policy.
     * <ul>
     *   <li>SKIP: an existing file is returned with {@code skip} set</li>
     *   <li>REPLACE: the path is returned as is</li>
     *   <li>UNIQUE: the first free of {@code name.ext}, {@code name (1).ext}, ...</li>
     * </ul>
     *
     * @throws PathExhaustionException when UNIQUE runs out of numbered variants
     */
    public Resolution resolve(@NonNull Path desiredPath, @NonNull OverwritePolicy policy) {
        Path sanitized = sanitize(desiredPath);

        switch (policy) {
            case SKIP:
                if (Files.exists(sanitized)) {
                    log.debug("Output {} exists, job will be skipped", sanitized);
                    return new Resolution(sanitized, true);
                }
                return new Resolution(sanitized, false);

            case REPLACE:
                return new Resolution(sanitized, false);

            case UNIQUE:
            default:
                if (!Files.exists(sanitized)) {
                    return new Resolution(sanitized, false);
                }
                Path directory = sanitized.toAbsolutePath().getParent();
                String fileName = sanitized.getFileName().toString();
                Path unique = PathUtils.uniqueFilename(directory,
                        PathUtils.getFilenameWithoutExtension(fileName),
                        PathUtils.getExtension(fileName));
                log.debug("Output {} exists, using {}", sanitized, unique.getFileName());
                return new Resolution(unique, false);
        }
    }

    private static Path sanitize(Path desiredPath) {
        Path fileName = desiredPath.getFileName();
        String cleaned = PathUtils.sanitizeFilename(fileName != null ? fileName.toString() : null);
        Path parent = desiredPath.getParent();
        return parent != null ? parent.resolve(cleaned) : Path.of(cleaned);
    }
}
