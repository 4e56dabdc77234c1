package com.github.stormino.audioextract.service;

import com.github.stormino.audioextract.config.AudioExtractProperties;
import com.github.stormino.audioextract.exception.ToolNotFoundException;
import com.github.stormino.audioextract.service.command.FfmpegCommandBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Locates and verifies the ffmpeg/ffprobe executables.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FfmpegToolService {

    private static final String FFMPEG = "ffmpeg";
    private static final String FFPROBE = "ffprobe";

    private final AudioExtractProperties properties;
    private final FfmpegCommandBuilder commandBuilder;

    private volatile String ffmpegPath;
    private volatile String ffprobePath;

    /**
     * Resolve and verify ffmpeg, remembering it (and the matching ffprobe) for later calls.
     *
     * @param configuredPath Explicit path, or null/blank to search
     * @return Verified ffmpeg path
     * @throws ToolNotFoundException if ffmpeg does not run
     */
    public String initialize(String configuredPath) {
        String candidate = locate(configuredPath);
        verify(candidate);

        this.ffmpegPath = candidate;
        String configuredProbe = properties.getTools().getFfprobePath();
        this.ffprobePath = configuredProbe != null && !configuredProbe.isBlank()
                ? configuredProbe
                : probePathFor(candidate);

        log.info("Using ffmpeg at {} (ffprobe: {})", ffmpegPath, ffprobePath);
        return candidate;
    }

    /**
     * Find ffmpeg: the configured path, then PATH, then the usual per-OS install locations.
     * Falls back to the bare command name.
     */
    public String locate(String configuredPath) {
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }

        for (String name : executableNames()) {
            Path onPath = searchPath(name);
            if (onPath != null) {
                log.debug("Found {} on PATH: {}", name, onPath);
                return onPath.toString();
            }
        }

        for (String location : commonInstallLocations()) {
            if (Files.isRegularFile(Path.of(location))) {
                log.debug("Found ffmpeg at install location: {}", location);
                return location;
            }
        }

        return FFMPEG;
    }

    /**
     * Run {@code -version} and require exit code 0 within the configured timeout.
     *
     * @throws ToolNotFoundException if the executable is missing, hangs or fails
     */
    public void verify(String toolPath) {
        List<String> command = commandBuilder.buildVersionCommand(toolPath);
        int timeout = properties.getTools().getVersionCheckTimeoutSeconds();
        Process process = null;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();

            if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                throw new ToolNotFoundException("Version check timed out after " + timeout + "s", toolPath);
            }
            if (process.exitValue() != 0) {
                throw new ToolNotFoundException(
                        "Version check exited with code " + process.exitValue(), toolPath);
            }
        } catch (IOException e) {
            throw new ToolNotFoundException("Cannot run " + toolPath + ": " + e.getMessage(), toolPath, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolNotFoundException("Interrupted while checking " + toolPath, toolPath, e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    /**
     * Derive the ffprobe path from an ffmpeg path by swapping the executable name.
     */
    public String probePathFor(String ffmpegExecutable) {
        Path path = Path.of(ffmpegExecutable);
        Path fileName = path.getFileName();
        if (fileName == null) {
            return FFPROBE;
        }
        String probeName = fileName.toString().replace(FFMPEG, FFPROBE);
        Path parent = path.getParent();
        return parent != null ? parent.resolve(probeName).toString() : probeName;
    }

    public boolean isInitialized() {
        return ffmpegPath != null;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    /**
     * ffprobe path for media inspection; usable before {@link #initialize(String)} runs.
     */
    public String getFfprobePath() {
        if (ffprobePath != null) {
            return ffprobePath;
        }
        String configuredProbe = properties.getTools().getFfprobePath();
        if (configuredProbe != null && !configuredProbe.isBlank()) {
            return configuredProbe;
        }
        return probePathFor(locate(properties.getTools().getFfmpegPath()));
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    private static boolean isMac() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
    }

    private static List<String> executableNames() {
        return isWindows() ? List.of("ffmpeg.exe", FFMPEG) : List.of(FFMPEG);
    }

    private static Path searchPath(String executable) {
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null || pathEnv.isBlank()) {
            return null;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir).resolve(executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static List<String> commonInstallLocations() {
        String home = System.getProperty("user.home", "");
        List<String> locations = new ArrayList<>();
        if (isWindows()) {
            locations.add("C:\\ffmpeg\\bin\\ffmpeg.exe");
            locations.add("C:\\Program Files\\ffmpeg\\bin\\ffmpeg.exe");
            locations.add("C:\\Program Files (x86)\\ffmpeg\\bin\\ffmpeg.exe");
            locations.add(home + "\\ffmpeg\\bin\\ffmpeg.exe");
            locations.add(home + "\\scoop\\apps\\ffmpeg\\current\\bin\\ffmpeg.exe");
        } else if (isMac()) {
            locations.add("/usr/local/bin/ffmpeg");
            locations.add("/opt/homebrew/bin/ffmpeg");
            locations.add("/usr/bin/ffmpeg");
            locations.add(home + "/bin/ffmpeg");
            locations.add("/Applications/ffmpeg");
        } else {
            locations.add("/usr/bin/ffmpeg");
            locations.add("/usr/local/bin/ffmpeg");
            locations.add("/snap/bin/ffmpeg");
            locations.add("/var/lib/flatpak/exports/bin/org.ffmpeg.FFmpeg");
            locations.add(home + "/.local/bin/ffmpeg");
            locations.add(home + "/bin/ffmpeg");
        }
        return locations;
    }
}
