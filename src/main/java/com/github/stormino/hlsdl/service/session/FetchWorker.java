package com.github.stormino.hlsdl.service.session;

import com.github.stormino.hlsdl.exception.CacheIOException;
import com.github.stormino.hlsdl.exception.DownloadException;
import com.github.stormino.hlsdl.exception.SegmentFetchException;
import com.github.stormino.hlsdl.model.SegmentDescriptor;
import com.github.stormino.hlsdl.service.cache.SegmentCache;
import com.github.stormino.hlsdl.service.fetch.FetchResponse;
import com.github.stormino.hlsdl.service.fetch.HttpFetcher;
import com.github.stormino.hlsdl.service.progress.ProgressAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;

/**
 * Drains the work queue of a session: fetch with retry, write to the cache, count.
 */
@Slf4j
@RequiredArgsConstructor
class FetchWorker implements Runnable {

    private final DownloadSession session;
    private final WorkQueue queue;
    private final HttpFetcher fetcher;
    private final SegmentCache cache;
    private final ProgressAggregator aggregator;
    private final RetryTemplate retryTemplate;

    @Override
    public void run() {
        try {
            while (!session.shouldStop()) {
                SegmentDescriptor segment = queue.poll();
                if (segment == null) {
                    return;
                }
                process(segment);
            }
        } catch (BackOffInterruptedException e) {
            log.debug("Worker interrupted during backoff");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Unexpected worker failure: {}", e.getMessage(), e);
            session.abort(new DownloadException("Unexpected worker failure: " + e.getMessage(), e));
        }
    }

    private void process(SegmentDescriptor segment) {
        int index = segment.getIndex();

        if (cache.isComplete(index)) {
            // Written by a concurrent run on the same cache
            log.debug("Segment {} already cached, skipping", index);
            return;
        }

        byte[] data;
        try {
            data = retryTemplate.execute(context -> attempt(segment, context.getRetryCount() + 1));
        } catch (SegmentFetchException e) {
            if (!session.shouldStop()) {
                String message = String.format("Segment %d: %s", index, e.getMessage());
                log.warn("Giving up on segment {} ({}): {}", index, segment.getResolvedUrl(), e.getMessage());
                aggregator.recordFailure(index, message);
            }
            return;
        }

        if (session.shouldStop()) {
            log.debug("Discarding segment {} fetched after stop", index);
            return;
        }

        try {
            cache.write(index, data);
        } catch (CacheIOException e) {
            log.error("Cache write failed for segment {}: {}", index, e.getMessage());
            session.abort(e);
            return;
        }
        aggregator.recordSuccess(index, data.length);
    }

    private byte[] attempt(SegmentDescriptor segment, int attemptNumber) {
        int index = segment.getIndex();
        String url = segment.getResolvedUrl();
        log.trace("Fetching segment {} (attempt {}): {}", index, attemptNumber, url);

        FetchResponse response;
        try {
            response = fetcher.get(url);
        } catch (IOException e) {
            throw new SegmentFetchException(e.getMessage(), e, index, url);
        }

        if (!response.isOk()) {
            throw new SegmentFetchException("HTTP " + response.getStatusCode(), index, url, response.getStatusCode());
        }
        if (response.getBody() == null || response.getBody().length == 0) {
            throw new SegmentFetchException("Empty response body", index, url, response.getStatusCode());
        }
        return response.getBody();
    }
}
