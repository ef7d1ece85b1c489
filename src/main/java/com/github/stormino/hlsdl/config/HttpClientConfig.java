package com.github.stormino.hlsdl.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final HlsDownloaderProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        Duration timeout = Duration.ofSeconds(properties.getFetch().getTimeoutSeconds());
        log.debug("Building HTTP client with {}s per-call timeout", timeout.toSeconds());

        // Retries are counted by the segment workers, so OkHttp must not retry silently
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .retryOnConnectionFailure(false)
                .addInterceptor(new StreamHeadersInterceptor())
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    /**
     * Adds the browser-like headers media CDNs expect on manifest and segment requests.
     */
    private class StreamHeadersInterceptor implements Interceptor {

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            HlsDownloaderProperties.Fetch fetch = properties.getFetch();

            Request.Builder builder = chain.request().newBuilder()
                    .header("User-Agent", fetch.getUserAgent())
                    .header("Accept", "*/*")
                    .header("Connection", "keep-alive");

            if (fetch.hasReferer()) {
                builder.header("Referer", fetch.getReferer());
            }

            return chain.proceed(builder.build());
        }
    }
}
