package com.github.stormino.hlsdl.runner;

import com.github.stormino.hlsdl.exception.ConfigurationException;
import com.github.stormino.hlsdl.model.DownloadRequest;
import com.github.stormino.hlsdl.model.DownloadResult;
import com.github.stormino.hlsdl.model.DownloadStatus;
import com.github.stormino.hlsdl.model.ProgressSnapshot;
import com.github.stormino.hlsdl.service.DownloadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DownloadCommandRunner")
class DownloadCommandRunnerTest {

    private static final String MANIFEST = "--manifest=https://cdn.example.com/video/index.m3u8";

    @Mock
    private DownloadService downloadService;

    private DownloadCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new DownloadCommandRunner(downloadService);
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    @Test
    @DisplayName("should exit 0 and pass options on success")
    void shouldExitZeroOnSuccess() {
        ProgressSnapshot snapshot = ProgressSnapshot.builder()
                .status(DownloadStatus.COMPLETED).downloadedSegments(3).totalSegments(3).fileSize(1024L).build();
        ArgumentCaptor<DownloadRequest> captor = ArgumentCaptor.forClass(DownloadRequest.class);
        when(downloadService.download(captor.capture(), any()))
                .thenReturn(DownloadResult.completed(snapshot, Path.of("/videos/movie.mp4")));

        runner.run(args(MANIFEST, "--output=/videos/movie", "--threads=8", "--quality=720p"));

        assertEquals(DownloadCommandRunner.EXIT_OK, runner.getExitCode());
        DownloadRequest request = captor.getValue();
        assertEquals("https://cdn.example.com/video/index.m3u8", request.getManifestUrl());
        assertEquals(Path.of("/videos/movie.mp4"), request.getOutputFile());
        assertEquals(8, request.getThreads());
        assertEquals("720p", request.getQuality());
    }

    @Test
    @DisplayName("should keep an explicit output extension")
    void shouldKeepExplicitExtension() {
        ArgumentCaptor<DownloadRequest> captor = ArgumentCaptor.forClass(DownloadRequest.class);
        when(downloadService.download(captor.capture(), any()))
                .thenReturn(DownloadResult.completed(ProgressSnapshot.builder().status(DownloadStatus.COMPLETED).build(),
                        Path.of("/videos/movie.mkv")));

        runner.run(args(MANIFEST, "--output=/videos/movie.mkv"));

        assertEquals(Path.of("/videos/movie.mkv"), captor.getValue().getOutputFile());
        assertNull(captor.getValue().getThreads());
    }

    @Test
    @DisplayName("should exit 1 when segments failed")
    void shouldExitOneOnFailure() {
        ProgressSnapshot snapshot = ProgressSnapshot.builder()
                .status(DownloadStatus.FAILED).downloadedSegments(9).totalSegments(10).failedSegments(1)
                .errors(List.of("Segment 5: HTTP 500")).build();
        when(downloadService.download(any(), any())).thenReturn(DownloadResult.failed(snapshot, "1 segments failed to download"));

        runner.run(args(MANIFEST, "--output=/videos/movie.mp4"));

        assertEquals(DownloadCommandRunner.EXIT_FAILED, runner.getExitCode());
    }

    @Test
    @DisplayName("should exit 1 when cancelled")
    void shouldExitOneOnCancel() {
        when(downloadService.download(any(), any()))
                .thenReturn(DownloadResult.cancelled(ProgressSnapshot.withoutCounters(DownloadStatus.CANCELLED, List.of())));

        runner.run(args(MANIFEST, "--output=/videos/movie.mp4"));

        assertEquals(DownloadCommandRunner.EXIT_FAILED, runner.getExitCode());
    }

    @Test
    @DisplayName("should exit 2 without manifest")
    void shouldExitTwoWithoutManifest() {
        runner.run(args("--output=/videos/movie.mp4"));

        assertEquals(DownloadCommandRunner.EXIT_USAGE, runner.getExitCode());
        verify(downloadService, never()).download(any(), any());
    }

    @Test
    @DisplayName("should exit 2 on a non-numeric thread count")
    void shouldExitTwoOnBadThreads() {
        runner.run(args(MANIFEST, "--output=/videos/movie.mp4", "--threads=many"));

        assertEquals(DownloadCommandRunner.EXIT_USAGE, runner.getExitCode());
    }

    @Test
    @DisplayName("should exit 2 when the service rejects the request")
    void shouldExitTwoWhenServiceRejects() {
        when(downloadService.download(any(), any()))
                .thenThrow(new ConfigurationException("Thread count must be between 1 and 32", "threads", "64"));

        runner.run(args(MANIFEST, "--output=/videos/movie.mp4", "--threads=64"));

        assertEquals(DownloadCommandRunner.EXIT_USAGE, runner.getExitCode());
    }
}
