package com.github.stormino.hlsdl.config;

import com.github.stormino.hlsdl.util.DownloadConstants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "hls")
public class HlsDownloaderProperties {

    @Valid
    private Download download = new Download();
    @Valid
    private Fetch fetch = new Fetch();
    @Valid
    private Merge merge = new Merge();

    @Data
    public static class Download {
        /**
         * Root under which every stream gets its own cache directory.
         */
        @NotBlank
        private String cacheRoot = "~/.cache/hls-downloader";

        @Min(DownloadConstants.MIN_THREADS)
        @Max(DownloadConstants.MAX_THREADS)
        private int threads = 16;

        /**
         * "best" or a height such as "720p"; only used for master playlists.
         */
        @NotBlank
        private String defaultQuality = "best";
    }

    @Data
    public static class Fetch {
        @Min(1)
        private int timeoutSeconds = 30;

        @Min(1)
        private int maxAttempts = DownloadConstants.DEFAULT_MAX_ATTEMPTS;

        @Min(1)
        private long backoffMs = DownloadConstants.DEFAULT_BACKOFF_MS;

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

        private String referer;

        public boolean hasReferer() {
            return referer != null && !referer.isBlank();
        }
    }

    @Data
    public static class Merge {
        @NotBlank
        private String ffmpegPath = "ffmpeg";

        @Min(1)
        private long timeoutMinutes = 120;
    }
}
