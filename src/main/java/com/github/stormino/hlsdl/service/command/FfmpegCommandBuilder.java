package com.github.stormino.hlsdl.service.command;

import com.github.stormino.hlsdl.util.DownloadConstants;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for constructing ffmpeg command-line arguments.
 */
@Component
@Slf4j
public class FfmpegCommandBuilder {

    /**
     * Build ffmpeg command that stream-copies the segments named in a concat list into one container.
     *
     * @param ffmpegPath ffmpeg executable
     * @param listFile Concat demuxer list, one {@code file '...'} line per segment
     * @param outputFile Output container
     * @return ffmpeg command arguments
     */
    public List<String> buildConcatCommand(@NonNull String ffmpegPath, @NonNull Path listFile, @NonNull Path outputFile) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add(DownloadConstants.FFMPEG_LOG_LEVEL);
        command.add("-stats");
        command.add("-f");
        command.add("concat");
        command.add("-safe");
        command.add("0");  // List holds absolute paths
        command.add("-i");
        command.add(listFile.toString());
        command.add("-c");
        command.add("copy");
        command.add("-bsf:a");
        command.add(DownloadConstants.FFMPEG_AAC_BSF);
        command.add("-y");
        command.add(outputFile.toString());

        log.debug("Built concat command: {}", String.join(" ", command));
        return command;
    }
}
