package com.github.stormino.hlsdl.service.merge;

import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Input list format of the ffmpeg concat demuxer.
 */
@UtilityClass
public class ConcatList {

    /**
     * Render one {@code file '<absolute path>'} line per segment, in list order.
     */
    public static String render(List<Path> segments) {
        StringBuilder content = new StringBuilder();
        for (Path segment : segments) {
            content.append("file '")
                    .append(quote(segment.toAbsolutePath().toString()))
                    .append("'\n");
        }
        return content.toString();
    }

    public static Path write(List<Path> segments, Path listFile) throws IOException {
        return Files.writeString(listFile, render(segments), StandardCharsets.UTF_8);
    }

    // Single quotes close the quoted string, emit an escaped quote and reopen it
    static String quote(String path) {
        return path.replace("'", "'\\''");
    }
}
