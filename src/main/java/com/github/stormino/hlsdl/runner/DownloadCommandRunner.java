package com.github.stormino.hlsdl.runner;

import com.github.stormino.hlsdl.exception.ConfigurationException;
import com.github.stormino.hlsdl.model.DownloadRequest;
import com.github.stormino.hlsdl.model.DownloadResult;
import com.github.stormino.hlsdl.model.ProgressSnapshot;
import com.github.stormino.hlsdl.service.DownloadService;
import com.github.stormino.hlsdl.service.progress.ThrottledProgressListener;
import com.github.stormino.hlsdl.util.DownloadConstants;
import com.github.stormino.hlsdl.util.FormatUtils;
import com.github.stormino.hlsdl.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Command line front end: {@code --manifest=<url> --output=<file> [--threads=N] [--quality=best|720p]}.
 * Exit code 0 on success, 1 when the download failed or was cancelled, 2 on usage errors.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DownloadCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final DownloadService downloadService;

    private volatile int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        DownloadRequest request;
        try {
            request = parse(args);
        } catch (ConfigurationException e) {
            log.error(e.getMessage());
            logUsage();
            exitCode = EXIT_USAGE;
            return;
        }

        // Ctrl+C cancels the running session; the cache stays for the next run
        Thread shutdownHook = new Thread(this::cancelOnShutdown, "download-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            DownloadResult result = downloadService.download(request,
                    new ThrottledProgressListener(this::logProgress, DownloadConstants.PROGRESS_LOG_INTERVAL_MS));
            exitCode = result.isSuccess() ? EXIT_OK : EXIT_FAILED;
            logSummary(result);
        } catch (ConfigurationException e) {
            log.error(e.getMessage());
            exitCode = EXIT_USAGE;
        } finally {
            removeShutdownHook(shutdownHook);
        }
    }

    DownloadRequest parse(ApplicationArguments args) {
        String manifest = singleValue(args, "manifest");
        if (manifest == null) {
            throw new ConfigurationException("Missing required option --manifest", "manifest");
        }

        String output = singleValue(args, "output");
        if (output == null) {
            throw new ConfigurationException("Missing required option --output", "output");
        }

        Integer threads = null;
        String threadsValue = singleValue(args, "threads");
        if (threadsValue != null) {
            try {
                threads = Integer.parseInt(threadsValue.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Option --threads must be a number", "threads", threadsValue);
            }
        }

        return DownloadRequest.builder()
                .manifestUrl(manifest)
                .outputFile(outputPath(output))
                .threads(threads)
                .quality(singleValue(args, "quality"))
                .build();
    }

    private Path outputPath(String output) {
        Path path = PathUtils.expandHome(output);
        String fileName = path.getFileName().toString();
        if (fileName.indexOf('.') < 0) {
            return path.resolveSibling(PathUtils.ensureExtension(fileName, DownloadConstants.VIDEO_EXTENSION));
        }
        return path;
    }

    private String singleValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value;
    }

    private void logProgress(ProgressSnapshot snapshot) {
        switch (snapshot.getStatus()) {
            case DOWNLOADING:
                log.info("{} {}/{} segments, {}, {}, ETA {}",
                        FormatUtils.formatPercentage(snapshot.getPercent()),
                        snapshot.getDownloadedSegments(),
                        snapshot.getTotalSegments(),
                        FormatUtils.formatSize(snapshot.getBytesDownloaded()),
                        FormatUtils.formatSpeed(snapshot.getSpeedMBps()),
                        FormatUtils.formatDuration(snapshot.getEtaSeconds()));
                break;
            case MERGING:
                log.info("Merging {} segments", snapshot.getTotalSegments());
                break;
            default:
                log.debug("Status: {}", snapshot.getStatus().getDisplayName());
                break;
        }
    }

    private void logSummary(DownloadResult result) {
        ProgressSnapshot snapshot = result.getSnapshot();

        switch (result.getStatus()) {
            case COMPLETED:
                log.info("Saved {} ({})", result.getOutputFile(),
                        FormatUtils.formatSize(snapshot.getFileSize() != null ? snapshot.getFileSize() : 0L));
                break;
            case CANCELLED:
                log.warn("Download cancelled after {}/{} segments. Cache preserved - run again to resume",
                        snapshot.getDownloadedSegments(), snapshot.getTotalSegments());
                break;
            default:
                log.error("Download failed: {}", result.getErrorMessage());
                List<String> errors = snapshot.getErrors();
                errors.stream()
                        .limit(DownloadConstants.MAX_REPORTED_ERRORS)
                        .forEach(error -> log.error("  {}", error));
                if (errors.size() > DownloadConstants.MAX_REPORTED_ERRORS) {
                    log.error("  ... and {} more", errors.size() - DownloadConstants.MAX_REPORTED_ERRORS);
                }
                if (snapshot.getTotalSegments() > 0) {
                    log.error("Cache preserved - run again to resume");
                }
                break;
        }
    }

    private void cancelOnShutdown() {
        log.info("Shutdown requested, cancelling downloads");
        downloadService.cancelAll();
        try {
            if (!downloadService.awaitIdle(SHUTDOWN_GRACE)) {
                log.warn("Downloads still running after {}s", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void removeShutdownHook(Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM is already shutting down, keeping shutdown hook");
        }
    }

    private void logUsage() {
        log.info("Usage: --manifest=<url> --output=<file> [--threads={}-{}] [--quality=best|720p]",
                DownloadConstants.MIN_THREADS, DownloadConstants.MAX_THREADS);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
