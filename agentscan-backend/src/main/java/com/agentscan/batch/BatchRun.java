package com.agentscan.batch;

import com.agentscan.model.BatchStatus;
import com.agentscan.model.ScanBatch;
import com.agentscan.model.ScanResult;
import com.agentscan.model.ScanStatus;
import com.agentscan.model.ScanTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One batch scan: a fixed set of targets worked off by at most {@code concurrency} worker threads.
 *
 * <p>Each domain is isolated: whatever happens while scanning it ends up as that domain's
 * {@link ScanResult} and never aborts the rest of the batch. Results that arrive after the batch was
 * cancelled are discarded.
 */
public class BatchRun {
    private static final Logger log = LoggerFactory.getLogger(BatchRun.class);

    static final String MDC_BATCH_ID = "batch_id";
    static final String MDC_DOMAIN = "domain";

    private final String batchId;
    private final String name;
    private final int concurrency;
    private final List<ScanTarget> targets;
    private final ScanPipeline pipeline;
    private final CompletionListener completionListener;
    private final OffsetDateTime createdAt = OffsetDateTime.now();

    private volatile BatchStatus status = BatchStatus.PENDING;
    private volatile OffsetDateTime startedAt;
    private volatile OffsetDateTime completedAt;
    private ExecutorService workers;

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger remaining;
    private final Map<String, ScanResult> results = new ConcurrentHashMap<>();
    private final CountDownLatch done = new CountDownLatch(1);

    /**
     * Listener for batches reaching a final status.
     */
    public interface CompletionListener {
        void onFinished(ScanBatch batch);
    }

    /**
     * Creates a batch run.
     *
     * @param batchId batch id
     * @param name display name, may be {@code null}
     * @param targets normalized, de-duplicated targets
     * @param concurrency maximum domains scanned at once
     * @param pipeline single-domain pipeline
     * @param completionListener notified once the batch is final, may be {@code null}
     */
    public BatchRun(
            String batchId,
            String name,
            List<ScanTarget> targets,
            int concurrency,
            ScanPipeline pipeline,
            CompletionListener completionListener
    ) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.batchId = Objects.requireNonNull(batchId, "batchId");
        this.name = name;
        this.targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        this.concurrency = concurrency;
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.completionListener = completionListener;
        this.remaining = new AtomicInteger(this.targets.size());
    }

    /**
     * Starts scanning. A batch starts at most once.
     */
    public synchronized void start() {
        if (status != BatchStatus.PENDING) {
            log.warn("Batch already started: batch_id={}, status={}", batchId, status);
            return;
        }
        status = BatchStatus.RUNNING;
        startedAt = OffsetDateTime.now();
        log.info("Started batch: batch_id={}, name={}, total_targets={}, concurrency={}",
                batchId, name, targets.size(), concurrency);

        if (targets.isEmpty()) {
            finish();
            return;
        }

        AtomicInteger threadSeq = new AtomicInteger();
        workers = Executors.newFixedThreadPool(Math.min(concurrency, targets.size()), r -> {
            Thread t = new Thread(r, "batch-" + shortId() + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (ScanTarget target : targets) {
            workers.submit(() -> scanOne(target));
        }
        workers.shutdown();
    }

    /**
     * Cancels the batch. Queued domains are never scanned; in-flight ones are interrupted and their
     * results dropped.
     *
     * @return true if the batch moved to {@link BatchStatus#CANCELLED}
     */
    public boolean cancel() {
        ExecutorService toStop;
        synchronized (this) {
            if (status.isFinal()) {
                return false;
            }
            status = BatchStatus.CANCELLED;
            completedAt = OffsetDateTime.now();
            toStop = workers;
        }
        if (toStop != null) {
            toStop.shutdownNow();
        }
        log.info("Cancelled batch: batch_id={}, completed_targets={}, failed_targets={}, pending_targets={}",
                batchId, completed.get(), failed.get(), remaining.get());
        done.countDown();
        notifyFinished();
        return true;
    }

    /**
     * Waits for the batch to reach a final status.
     *
     * @param timeout maximum wait
     * @return true if the batch is final
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String getBatchId() {
        return batchId;
    }

    public BatchStatus getStatus() {
        return status;
    }

    public ScanBatch snapshot() {
        return ScanBatch.builder()
                .batchId(batchId)
                .name(name)
                .status(status)
                .concurrency(concurrency)
                .totalTargets(targets.size())
                .completedTargets(completed.get())
                .failedTargets(failed.get())
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }

    /**
     * Returns the stored results in target order.
     *
     * @return results recorded so far
     */
    public List<ScanResult> getResults() {
        List<ScanResult> out = new ArrayList<>();
        for (ScanTarget t : targets) {
            ScanResult r = results.get(t.getDomain());
            if (r != null) {
                out.add(r);
            }
        }
        return out;
    }

    public ScanResult getResult(String domain) {
        return domain == null ? null : results.get(domain);
    }

    private void scanOne(ScanTarget target) {
        if (status != BatchStatus.RUNNING) {
            return;
        }
        MDC.put(MDC_BATCH_ID, batchId);
        MDC.put(MDC_DOMAIN, target.getDomain());
        long startNanos = System.nanoTime();
        ScanResult result;
        try {
            result = pipeline.scan(target);
            if (result == null) {
                result = ScanResult.failed(target, "scan produced no result", elapsedMs(startNanos));
            }
        } catch (Throwable e) {
            // errors too: the worker future is never read, so anything uncaught would leave the batch running
            log.error("Domain scan crashed: batch_id={}, domain={}", batchId, target.getDomain(), e);
            result = ScanResult.failed(target, e.toString(), elapsedMs(startNanos));
        } finally {
            MDC.remove(MDC_DOMAIN);
            MDC.remove(MDC_BATCH_ID);
        }
        record(target, result);
    }

    private void record(ScanTarget target, ScanResult result) {
        boolean last;
        synchronized (this) {
            if (status != BatchStatus.RUNNING) {
                log.debug("Discarding result of finished batch: batch_id={}, domain={}, status={}",
                        batchId, target.getDomain(), status);
                return;
            }
            results.put(target.getDomain(), result);
            if (result.getScanStatus() == ScanStatus.FAILED) {
                failed.incrementAndGet();
            } else {
                completed.incrementAndGet();
            }
            last = remaining.decrementAndGet() == 0;
            if (last) {
                finish();
            }
        }
        if (last) {
            notifyFinished();
        }
    }

    // caller holds the monitor
    private void finish() {
        status = completed.get() == 0 && failed.get() > 0 ? BatchStatus.FAILED : BatchStatus.COMPLETED;
        completedAt = OffsetDateTime.now();
        log.info("Finished batch: batch_id={}, status={}, completed_targets={}, failed_targets={}",
                batchId, status, completed.get(), failed.get());
        done.countDown();
        if (targets.isEmpty()) {
            notifyFinished();
        }
    }

    private void notifyFinished() {
        if (completionListener == null) {
            return;
        }
        try {
            completionListener.onFinished(snapshot());
        } catch (RuntimeException e) {
            log.warn("Batch completion listener failed: batch_id={}", batchId, e);
        }
    }

    private String shortId() {
        return batchId.length() > 8 ? batchId.substring(0, 8) : batchId;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
