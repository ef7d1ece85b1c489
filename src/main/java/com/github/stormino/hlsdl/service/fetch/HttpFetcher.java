package com.github.stormino.hlsdl.service.fetch;

import java.io.IOException;

/**
 * Issues a single GET and returns the status and body.
 * Implementations must be thread-safe: every segment worker shares one instance.
 */
public interface HttpFetcher {

    /**
     * Fetch a URL once, without retrying.
     *
     * @param url Absolute URL
     * @return Status code and body; the body is empty for non-200 responses
     * @throws IOException on transport failures and timeouts
     */
    FetchResponse get(String url) throws IOException;
}
