package com.github.stormino.hlsdl.service.fetch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Slf4j
@Component
@RequiredArgsConstructor
public class OkHttpFetcher implements HttpFetcher {

    private static final byte[] EMPTY = new byte[0];

    private final OkHttpClient httpClient;

    @Override
    public FetchResponse get(String url) throws IOException {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new IOException("Invalid URL: " + url);
        }

        Request request = new Request.Builder()
                .url(httpUrl)
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.debug("HTTP {} for {}", response.code(), url);
                return new FetchResponse(response.code(), EMPTY);
            }
            return new FetchResponse(response.code(), body.bytes());
        }
    }
}
