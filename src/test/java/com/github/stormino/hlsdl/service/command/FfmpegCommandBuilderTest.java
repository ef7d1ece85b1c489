package com.github.stormino.hlsdl.service.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FfmpegCommandBuilder")
class FfmpegCommandBuilderTest {

    private FfmpegCommandBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new FfmpegCommandBuilder();
    }

    @Test
    @DisplayName("should build stream-copy concat command")
    void shouldBuildConcatCommand() {
        Path list = Path.of("/cache/2931fa44542f601d/concat.txt");
        Path output = Path.of("/videos/movie.mp4");

        List<String> command = builder.buildConcatCommand("/usr/bin/ffmpeg", list, output);

        assertEquals(List.of(
                "/usr/bin/ffmpeg", "-hide_banner", "-loglevel", "warning", "-stats",
                "-f", "concat", "-safe", "0", "-i", list.toString(),
                "-c", "copy", "-bsf:a", "aac_adtstoasc", "-y", output.toString()), command);
    }

    @Test
    @DisplayName("should end with the output file")
    void shouldEndWithOutputFile() {
        List<String> command = builder.buildConcatCommand("ffmpeg", Path.of("list.txt"), Path.of("out.mp4"));

        assertEquals("ffmpeg", command.get(0));
        assertEquals("out.mp4", command.get(command.size() - 1));
        assertEquals("-y", command.get(command.size() - 2));
    }
}
