package com.github.stormino.hlsdl.service.fetch;

import com.github.stormino.hlsdl.util.DownloadConstants;
import lombok.Value;

import java.nio.charset.StandardCharsets;

@Value
public class FetchResponse {

    int statusCode;
    byte[] body;

    public boolean isOk() {
        return statusCode == DownloadConstants.HTTP_OK;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
