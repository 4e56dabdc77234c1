package com.github.stormino.audioextract.util;

import com.github.stormino.audioextract.exception.PathExhaustionException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Utility class for file path operations and filename sanitization.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    private static final Pattern INVALID_FILENAME_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1f]");

    /**
     * Sanitize filename: invalid characters become underscores, surrounding dots and
     * whitespace are trimmed, and over-long names are cut while keeping the extension.
     *
     * @param filename Original filename
     * @return Sanitized filename safe for filesystem use
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null) {
            return ConversionConstants.DEFAULT_FILENAME;
        }

        String sanitized = INVALID_FILENAME_CHARS.matcher(filename)
                .replaceAll(ConversionConstants.INVALID_CHAR_PLACEHOLDER);
        sanitized = stripDotsAndWhitespace(sanitized);

        if (sanitized.isEmpty()) {
            return ConversionConstants.DEFAULT_FILENAME;
        }

        if (sanitized.length() > ConversionConstants.MAX_FILENAME_LENGTH) {
            String extension = getExtension(sanitized);
            String name = getFilenameWithoutExtension(sanitized);
            int maxNameLength = ConversionConstants.MAX_FILENAME_LENGTH - extension.length();
            sanitized = name.substring(0, Math.max(0, maxNameLength)) + extension;
        }

        return sanitized;
    }

    private static String stripDotsAndWhitespace(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isStrippable(value.charAt(start))) {
            start++;
        }
        while (end > start && isStrippable(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isStrippable(char c) {
        return c == '.' || Character.isWhitespace(c);
    }

    /**
     * Find the first free name in {@code directory}: {@code base + extension} itself, then
     * {@code "base (1)" + extension}, {@code "base (2)" + extension} and so on.
     *
     * @param directory Target directory
     * @param baseName Filename without extension
     * @param extension Extension with leading dot, may be empty
     * @return Path that did not exist when checked
     * @throws PathExhaustionException when every counter up to the limit is taken
     */
    public static Path uniqueFilename(Path directory, String baseName, String extension) {
        Path candidate = directory.resolve(baseName + extension);
        if (!Files.exists(candidate)) {
            return candidate;
        }

        for (int counter = 1; counter <= ConversionConstants.MAX_UNIQUE_SUFFIX; counter++) {
            candidate = directory.resolve(String.format(
                    ConversionConstants.UNIQUE_FILENAME_FORMAT, baseName, counter, extension));
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }

        throw new PathExhaustionException(directory.resolve(baseName + extension),
                ConversionConstants.MAX_UNIQUE_SUFFIX);
    }

    /**
     * Create directory structure if it doesn't exist.
     *
     * @param path Directory path to create
     * @throws IOException if the directory cannot be created
     */
    public static void createDirectoryStructure(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            Files.createDirectories(path);
            log.debug("Created directory structure: {}", path);
        }
    }

    /**
     * Get file extension from filename.
     *
     * @param filename Filename to extract extension from
     * @return Extension with leading dot, or empty string if no extension
     */
    public static String getExtension(String filename) {
        if (filename == null || filename.isBlank()) {
            return "";
        }

        int lastDot = filename.lastIndexOf('.');
        if (lastDot > 0 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot);
        }

        return "";
    }

    /**
     * Get filename without extension.
     *
     * @param filename Full filename
     * @return Filename without extension
     */
    public static String getFilenameWithoutExtension(String filename) {
        if (filename == null || filename.isBlank()) {
            return "";
        }

        int lastDot = filename.lastIndexOf('.');
        if (lastDot > 0) {
            return filename.substring(0, lastDot);
        }

        return filename;
    }

    /**
     * Output path for a source file: same stem, new extension, in {@code outputDirectory}
     * or beside the source when no directory is given.
     */
    public static Path deriveOutputPath(Path inputPath, Path outputDirectory, String outputFormat) {
        Path directory = outputDirectory != null ? outputDirectory : inputPath.toAbsolutePath().getParent();
        String stem = getFilenameWithoutExtension(inputPath.getFileName().toString());
        return directory.resolve(stem + "." + outputFormat);
    }
}
