package com.github.stormino.hlsdl.service.merge;

import com.github.stormino.hlsdl.config.HlsDownloaderProperties;
import com.github.stormino.hlsdl.exception.MergeException;
import com.github.stormino.hlsdl.service.command.FfmpegCommandBuilder;
import com.github.stormino.hlsdl.util.DownloadConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs ffmpeg's concat demuxer over the cached segments.
 * The list file is written next to the segments, so purging the cache removes it too.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FfmpegMuxer implements Muxer {

    private final HlsDownloaderProperties properties;
    private final FfmpegCommandBuilder commandBuilder;

    @Override
    public void merge(List<Path> orderedSegments, Path destination) {
        List<String> inputs = orderedSegments.stream().map(Path::toString).collect(Collectors.toList());
        if (orderedSegments.isEmpty()) {
            throw new MergeException("No segments to merge", inputs, destination.toString());
        }

        Path listFile = orderedSegments.get(0).toAbsolutePath().getParent().resolve(DownloadConstants.CONCAT_LIST_FILE);
        try {
            ConcatList.write(orderedSegments, listFile);
        } catch (IOException e) {
            throw new MergeException("Cannot write concat list " + listFile + ": " + e.getMessage(), e, inputs, destination.toString());
        }

        List<String> command = commandBuilder.buildConcatCommand(properties.getMerge().getFfmpegPath(), listFile, destination);
        log.info("Merging {} segments into {}", orderedSegments.size(), destination);

        Process process = null;
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);

            process = processBuilder.start();

            Deque<String> tail = new ArrayDeque<>();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("FFmpeg merge output: {}", line);
                    if (tail.size() == DownloadConstants.FFMPEG_OUTPUT_TAIL_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                }
            }

            boolean completed = process.waitFor(properties.getMerge().getTimeoutMinutes(), TimeUnit.MINUTES);
            if (!completed) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                throw new MergeException("Merge timeout exceeded", inputs, destination.toString());
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.error("Merge process exited with code: {}", exitCode);
                log.error("Command was: {}", String.join(" ", command));
                log.error("Last ffmpeg output:\n{}", String.join("\n", tail));
                throw new MergeException("Merge failed with exit code " + exitCode, inputs, destination.toString(), exitCode);
            }

        } catch (IOException e) {
            throw new MergeException("Cannot run ffmpeg: " + e.getMessage(), e, inputs, destination.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new MergeException("Merge interrupted", e, inputs, destination.toString());
        }
    }
}
