package com.github.stormino.hlsdl.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception Hierarchy")
class ExceptionHierarchyTest {

    @Nested
    @DisplayName("DownloadException")
    class DownloadExceptionTests {

        @Test
        @DisplayName("should extend RuntimeException")
        void shouldExtendRuntimeException() {
            assertInstanceOf(RuntimeException.class, new DownloadException("Test error"));
        }

        @Test
        @DisplayName("should create with message and cause")
        void shouldCreateWithMessageAndCause() {
            Exception cause = new RuntimeException("Root cause");
            DownloadException ex = new DownloadException("Download failed", cause);

            assertEquals("Download failed", ex.getMessage());
            assertEquals(cause, ex.getCause());
        }
    }

    @Nested
    @DisplayName("ManifestException")
    class ManifestExceptionTests {

        @Test
        @DisplayName("should capture manifest URL")
        void shouldCaptureManifestUrl() {
            ManifestException ex = new ManifestException("No segments found in playlist",
                    "https://cdn.example.com/video/index.m3u8");

            assertInstanceOf(DownloadException.class, ex);
            assertEquals("No segments found in playlist", ex.getMessage());
            assertEquals("https://cdn.example.com/video/index.m3u8", ex.getManifestUrl());
        }

        @Test
        @DisplayName("should keep transport cause")
        void shouldKeepTransportCause() {
            Exception cause = new java.io.IOException("Connection reset");
            ManifestException ex = new ManifestException("Failed to fetch manifest", cause, "https://a/b.m3u8");

            assertEquals(cause, ex.getCause());
        }
    }

    @Nested
    @DisplayName("SegmentFetchException")
    class SegmentFetchExceptionTests {

        @Test
        @DisplayName("should capture segment index, URL and status")
        void shouldCaptureSegmentContext() {
            SegmentFetchException ex = new SegmentFetchException("HTTP 500", 5, "https://cdn/seg5.ts", 500);

            assertInstanceOf(DownloadException.class, ex);
            assertEquals(5, ex.getSegmentIndex());
            assertEquals("https://cdn/seg5.ts", ex.getSegmentUrl());
            assertEquals(500, ex.getStatusCode());
        }

        @Test
        @DisplayName("should have no status for transport errors")
        void shouldHaveNoStatusForTransportErrors() {
            SegmentFetchException ex = new SegmentFetchException("timeout",
                    new java.net.SocketTimeoutException("timeout"), 2, "https://cdn/seg2.ts");

            assertNull(ex.getStatusCode());
            assertInstanceOf(java.net.SocketTimeoutException.class, ex.getCause());
        }
    }

    @Nested
    @DisplayName("CacheIOException")
    class CacheIOExceptionTests {

        @Test
        @DisplayName("should capture path")
        void shouldCapturePath() {
            Path path = Path.of("/tmp/cache/abc");
            CacheIOException ex = new CacheIOException("Cannot create cache directory", path);

            assertInstanceOf(DownloadException.class, ex);
            assertEquals(path, ex.getPath());
        }
    }

    @Nested
    @DisplayName("MergeException")
    class MergeExceptionTests {

        @Test
        @DisplayName("should capture inputs, output and exit code")
        void shouldCaptureMergeContext() {
            List<String> inputs = List.of("segment_00000.ts", "segment_00001.ts");
            MergeException ex = new MergeException("Merge failed with exit code 1", inputs, "out.mp4", 1);

            assertInstanceOf(DownloadException.class, ex);
            assertEquals(inputs, ex.getInputFiles());
            assertEquals("out.mp4", ex.getOutputFile());
            assertEquals(1, ex.getExitCode());
        }

        @Test
        @DisplayName("should have null exit code when the process never ran")
        void shouldHaveNullExitCodeWithoutProcess() {
            MergeException ex = new MergeException("Cannot run ffmpeg", new java.io.IOException("not found"),
                    List.of(), "out.mp4");

            assertNull(ex.getExitCode());
        }
    }

    @Nested
    @DisplayName("ConfigurationException")
    class ConfigurationExceptionTests {

        @Test
        @DisplayName("should capture key and value")
        void shouldCaptureKeyAndValue() {
            ConfigurationException ex = new ConfigurationException("Thread count must be between 1 and 32", "threads", "64");

            assertInstanceOf(DownloadException.class, ex);
            assertEquals("threads", ex.getConfigKey());
            assertEquals("64", ex.getConfigValue());
        }

        @Test
        @DisplayName("should allow message only")
        void shouldAllowMessageOnly() {
            ConfigurationException ex = new ConfigurationException("Invalid");

            assertNull(ex.getConfigKey());
            assertNull(ex.getConfigValue());
        }
    }
}
