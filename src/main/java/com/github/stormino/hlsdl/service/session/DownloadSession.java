package com.github.stormino.hlsdl.service.session;

import com.github.stormino.hlsdl.exception.CacheIOException;
import com.github.stormino.hlsdl.exception.DownloadException;
import com.github.stormino.hlsdl.exception.ManifestException;
import com.github.stormino.hlsdl.exception.MergeException;
import com.github.stormino.hlsdl.exception.SegmentFetchException;
import com.github.stormino.hlsdl.model.DownloadResult;
import com.github.stormino.hlsdl.model.DownloadStatus;
import com.github.stormino.hlsdl.model.ProgressSnapshot;
import com.github.stormino.hlsdl.model.SegmentDescriptor;
import com.github.stormino.hlsdl.model.StreamDescriptor;
import com.github.stormino.hlsdl.service.cache.CacheScan;
import com.github.stormino.hlsdl.service.cache.SegmentCache;
import com.github.stormino.hlsdl.service.fetch.HttpFetcher;
import com.github.stormino.hlsdl.service.merge.SegmentMerger;
import com.github.stormino.hlsdl.service.playlist.SegmentPlanner;
import com.github.stormino.hlsdl.service.progress.ProgressAggregator;
import com.github.stormino.hlsdl.service.state.DownloadStateMachine;
import com.github.stormino.hlsdl.util.DownloadConstants;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One run over one media playlist: plan, check the cache, fetch what is missing, merge, clean up.
 * <p>
 * A session is single-use. {@link #run()} blocks the calling thread until the run ends and never
 * throws for download failures; the outcome is in the returned {@link DownloadResult}.
 * {@link #cancel()} may be called from any thread, including the progress listener.
 * <p>
 * The progress listener is called on worker threads while the counters lock is held.
 */
@Slf4j
public class DownloadSession {

    private final StreamDescriptor stream;
    private final Path outputFile;
    private final SegmentPlanner planner;
    private final SegmentCache cache;
    private final HttpFetcher fetcher;
    private final SegmentMerger merger;
    private final DownloadStateMachine stateMachine;
    private final int threads;
    private final int maxAttempts;
    private final long backoffMillis;
    private final Consumer<ProgressSnapshot> progressListener;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<DownloadException> fatalError = new AtomicReference<>();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile DownloadStatus state = DownloadStatus.PLANNING;
    private volatile Set<Integer> cachedAtStart = Collections.emptySet();

    @Builder
    private DownloadSession(StreamDescriptor stream,
                            Path outputFile,
                            SegmentPlanner planner,
                            SegmentCache cache,
                            HttpFetcher fetcher,
                            SegmentMerger merger,
                            DownloadStateMachine stateMachine,
                            Integer threads,
                            Integer maxAttempts,
                            Long backoffMillis,
                            Consumer<ProgressSnapshot> progressListener) {
        this.stream = stream;
        this.outputFile = outputFile;
        this.planner = planner;
        this.cache = cache;
        this.fetcher = fetcher;
        this.merger = merger;
        this.stateMachine = stateMachine != null ? stateMachine : new DownloadStateMachine();
        this.threads = threads != null ? threads : DownloadConstants.MIN_THREADS;
        this.maxAttempts = maxAttempts != null ? maxAttempts : DownloadConstants.DEFAULT_MAX_ATTEMPTS;
        this.backoffMillis = backoffMillis != null ? backoffMillis : DownloadConstants.DEFAULT_BACKOFF_MS;
        this.progressListener = progressListener;
    }

    /**
     * Execute the run on the calling thread.
     *
     * @return Outcome with the final snapshot
     * @throws IllegalStateException if the session was already run
     */
    public DownloadResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Download session for " + stream.getManifestUrl() + " was already run");
        }

        try {
            DownloadResult result = execute();
            log.info("Download of {} finished: {}", stream.getManifestUrl(), result.getStatus().getDisplayName());
            return result;
        } finally {
            finished.countDown();
        }
    }

    private DownloadResult execute() {
        // Planning
        List<SegmentDescriptor> segments;
        try {
            segments = planner.plan(stream);
        } catch (ManifestException e) {
            log.error("Cannot plan {}: {}", stream.getManifestUrl(), e.getMessage());
            return failWithoutCounters(e);
        }
        log.info("Planned {} segments for {}", segments.size(), stream.getManifestUrl());

        if (cancelled.get()) {
            return cancelWithoutCounters();
        }

        // Resuming
        transition(DownloadStatus.RESUMING);
        CacheScan scan;
        try {
            cache.ensureDirectory();
            scan = cache.scan(segments);
        } catch (CacheIOException e) {
            log.error("Cache unavailable: {}", e.getMessage());
            return failWithoutCounters(e);
        }
        cachedAtStart = scan.getCompletedIndices();
        if (scan.getCompletedCount() > 0) {
            log.info("Resuming: {}/{} segments already cached in {}",
                    scan.getCompletedCount(), segments.size(), cache.getDirectory());
        }

        ProgressAggregator aggregator = new ProgressAggregator(
                segments.size(), scan.getCompletedCount(), scan.getTotalBytes(), progressListener);

        List<SegmentDescriptor> pending = pendingSegments(segments, scan.getCompletedIndices());

        if (cancelled.get()) {
            return cancel(aggregator);
        }

        // Downloading
        if (!pending.isEmpty()) {
            transition(DownloadStatus.DOWNLOADING);
            aggregator.emit(DownloadStatus.DOWNLOADING);
            fetchAll(pending, aggregator);

            DownloadResult failure = decide(aggregator);
            if (failure != null) {
                return failure;
            }
        } else {
            log.info("All {} segments already cached, skipping download", segments.size());
        }

        // Merging
        return merge(segments, aggregator);
    }

    private void fetchAll(List<SegmentDescriptor> pending, ProgressAggregator aggregator) {
        int poolSize = Math.min(threads, pending.size());
        WorkQueue queue = new WorkQueue(pending);
        RetryTemplate retryTemplate = buildRetryTemplate();

        log.info("Downloading {} segments with {} workers", pending.size(), poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("segment-worker-"));
        for (int i = 0; i < poolSize; i++) {
            executor.execute(new FetchWorker(this, queue, fetcher, cache, aggregator, retryTemplate));
        }
        executor.shutdown();

        boolean interrupted = false;
        try {
            while (true) {
                try {
                    if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    log.info("Download of {} interrupted, cancelling", stream.getManifestUrl());
                    interrupted = true;
                    cancel();
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private DownloadResult decide(ProgressAggregator aggregator) {
        if (cancelled.get()) {
            return cancel(aggregator);
        }

        DownloadException fatal = fatalError.get();
        if (fatal != null) {
            return fail(aggregator, fatal);
        }

        int failed = aggregator.getFailedSegments();
        if (failed > 0) {
            transition(DownloadStatus.FAILED);
            log.warn("{} of {} segments failed; cache preserved at {}, re-run to resume",
                    failed, aggregator.getTotalSegments(), cache.getDirectory());
            ProgressSnapshot snapshot = aggregator.emit(DownloadStatus.FAILED);
            return DownloadResult.failed(snapshot,
                    String.format("%d segments failed to download", failed));
        }

        int downloaded = aggregator.getDownloadedSegments();
        if (downloaded != aggregator.getTotalSegments()) {
            transition(DownloadStatus.FAILED);
            log.warn("Only {}/{} segments present after download; cache preserved at {}",
                    downloaded, aggregator.getTotalSegments(), cache.getDirectory());
            ProgressSnapshot snapshot = aggregator.emit(DownloadStatus.FAILED);
            return DownloadResult.failed(snapshot,
                    String.format("Only %d of %d segments downloaded", downloaded, aggregator.getTotalSegments()));
        }
        return null;
    }

    private DownloadResult merge(List<SegmentDescriptor> segments, ProgressAggregator aggregator) {
        transition(DownloadStatus.MERGING);
        aggregator.emit(DownloadStatus.MERGING);

        long fileSize;
        try {
            fileSize = merger.merge(cache.orderedSegmentPaths(segments), outputFile);
        } catch (MergeException e) {
            log.error("Merge failed, cache preserved at {}: {}", cache.getDirectory(), e.getMessage());
            return fail(aggregator, e);
        }

        if (!cache.purge()) {
            log.warn("Could not fully remove cache directory {}", cache.getDirectory());
        }

        transition(DownloadStatus.COMPLETED);
        ProgressSnapshot snapshot = aggregator.emit(DownloadStatus.COMPLETED, fileSize);
        return DownloadResult.completed(snapshot, outputFile);
    }

    private RetryTemplate buildRetryTemplate() {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxAttempts,
                Map.<Class<? extends Throwable>, Boolean>of(SegmentFetchException.class, true));

        FixedBackOffPolicy backOffPolicy = new FixedBackOffPolicy();
        backOffPolicy.setBackOffPeriod(backoffMillis);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);
        retryTemplate.registerListener(new StopAwareRetryListener());
        return retryTemplate;
    }

    /**
     * Ends the retry loop before the backoff sleep once the session is stopping.
     */
    private class StopAwareRetryListener implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            if (throwable instanceof SegmentFetchException) {
                SegmentFetchException e = (SegmentFetchException) throwable;
                log.debug("Attempt {} for segment {} failed: {}",
                        context.getRetryCount(), e.getSegmentIndex(), e.getMessage());
            }
            if (shouldStop()) {
                context.setExhaustedOnly();
            }
        }
    }

    private static List<SegmentDescriptor> pendingSegments(List<SegmentDescriptor> segments, SortedSet<Integer> completed) {
        List<SegmentDescriptor> pending = new ArrayList<>(segments.size() - completed.size());
        for (SegmentDescriptor segment : segments) {
            if (!completed.contains(segment.getIndex())) {
                pending.add(segment);
            }
        }
        return pending;
    }

    private DownloadResult cancel(ProgressAggregator aggregator) {
        transition(DownloadStatus.CANCELLED);
        log.info("Download cancelled; cache preserved at {}", cache.getDirectory());
        return DownloadResult.cancelled(aggregator.emit(DownloadStatus.CANCELLED));
    }

    private DownloadResult fail(ProgressAggregator aggregator, DownloadException cause) {
        transition(DownloadStatus.FAILED);
        ProgressSnapshot snapshot = aggregator.emitFatal(cause.getMessage());
        return DownloadResult.failed(snapshot, cause.getMessage(), cause);
    }

    private DownloadResult failWithoutCounters(DownloadException cause) {
        transition(DownloadStatus.FAILED);
        ProgressSnapshot snapshot = ProgressSnapshot.withoutCounters(DownloadStatus.FAILED, List.of(cause.getMessage()));
        notifyListener(snapshot);
        return DownloadResult.failed(snapshot, cause.getMessage(), cause);
    }

    private DownloadResult cancelWithoutCounters() {
        transition(DownloadStatus.CANCELLED);
        ProgressSnapshot snapshot = ProgressSnapshot.withoutCounters(DownloadStatus.CANCELLED, List.of());
        notifyListener(snapshot);
        return DownloadResult.cancelled(snapshot);
    }

    private void notifyListener(ProgressSnapshot snapshot) {
        if (progressListener == null) {
            return;
        }
        try {
            progressListener.accept(snapshot);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {} snapshot", snapshot.getStatus().getValue(), e);
        }
    }

    private void transition(DownloadStatus next) {
        state = stateMachine.transitionOrThrow(cache.getCacheKey(), state, next);
    }

    /**
     * Request cooperative cancellation. Workers finish their in-flight call, discard its result
     * and take no new segments. Has no effect once merging started.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.debug("Cancellation requested for {}", stream.getManifestUrl());
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Stop the run because of a fatal error. Only the first error is kept.
     */
    void abort(DownloadException cause) {
        if (fatalError.compareAndSet(null, cause)) {
            log.error("Aborting download of {}: {}", stream.getManifestUrl(), cause.getMessage());
        }
    }

    /**
     * @return true once workers should take no further segments
     */
    boolean shouldStop() {
        return cancelled.get() || fatalError.get() != null;
    }

    /**
     * Wait for {@link #run()} to return.
     *
     * @return true if the run ended within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public DownloadStatus getState() {
        return state;
    }

    public StreamDescriptor getStream() {
        return stream;
    }

    /**
     * Indices that were complete in the cache when the run started; empty before the cache check.
     */
    public Set<Integer> getCachedAtStart() {
        return cachedAtStart;
    }
}
