package com.agentscan.batch;

import com.agentscan.config.ScannerProperties;
import com.agentscan.model.ScanBatch;
import com.agentscan.model.ScanResult;
import com.agentscan.model.ScanTarget;
import com.agentscan.util.DomainNormalizer;
import com.agentscan.util.ScanTargetParser;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Creates, tracks and cancels batch scans.
 */
@Component
public class BatchScanManager {
    private static final Logger log = LoggerFactory.getLogger(BatchScanManager.class);

    private final ScanPipeline pipeline;
    private final ScannerProperties properties;

    private final Map<String, BatchRun> batches = new ConcurrentHashMap<>();
    private final List<BatchRun> creationOrder = new CopyOnWriteArrayList<>();

    public BatchScanManager(ScanPipeline pipeline, ScannerProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    /**
     * Starts a batch over the given targets.
     *
     * @param name display name, may be {@code null}
     * @param targets raw targets; domains are normalized and duplicates dropped
     * @param concurrency requested concurrency, {@code null} or non-positive means the configured default
     * @return initial batch snapshot
     */
    public ScanBatch startBatch(String name, Collection<ScanTarget> targets, Integer concurrency) {
        List<ScanTarget> normalized = DomainNormalizer.normalizeTargets(targets);
        int effective = resolveConcurrency(concurrency);
        String batchId = UUID.randomUUID().toString();

        BatchRun run = new BatchRun(batchId, name, normalized, effective, pipeline, this::onFinished);
        batches.put(batchId, run);
        creationOrder.add(run);
        run.start();
        return run.snapshot();
    }

    /**
     * Starts a batch from CSV text.
     *
     * @see ScanTargetParser#parseCsv(String)
     */
    public ScanBatch startBatchFromCsv(String name, String csv, Integer concurrency) {
        return startBatch(name, ScanTargetParser.parseCsv(csv), concurrency);
    }

    public ScanBatch getBatch(String batchId) {
        return getRunOrThrow(batchId).snapshot();
    }

    public List<ScanBatch> listBatches() {
        return creationOrder.stream()
                .map(BatchRun::snapshot)
                .collect(Collectors.toList());
    }

    public List<ScanResult> getResults(String batchId) {
        return getRunOrThrow(batchId).getResults();
    }

    public Optional<ScanResult> getResult(String batchId, String domain) {
        return Optional.ofNullable(getRunOrThrow(batchId).getResult(DomainNormalizer.normalize(domain)));
    }

    /**
     * Cancels a batch.
     *
     * @param batchId batch id
     * @return true if the batch was still running or pending
     */
    public boolean cancelBatch(String batchId) {
        return getRunOrThrow(batchId).cancel();
    }

    /**
     * Waits for a batch to reach a final status.
     *
     * @param batchId batch id
     * @param timeout maximum wait
     * @return batch snapshot after waiting; it may still be running if the wait timed out
     * @throws InterruptedException if interrupted while waiting
     */
    public ScanBatch awaitCompletion(String batchId, Duration timeout) throws InterruptedException {
        BatchRun run = getRunOrThrow(batchId);
        if (!run.awaitCompletion(timeout)) {
            log.warn("Batch still running after wait: batch_id={}, timeout_ms={}", batchId, timeout.toMillis());
        }
        return run.snapshot();
    }

    /**
     * Scans a single domain outside of any batch.
     *
     * @param domain raw domain or URL
     * @return scan result
     */
    public ScanResult scanDomain(String domain) {
        return pipeline.scan(ScanTargetParser.parseSingle(domain));
    }

    public ScanResult scanDomain(ScanTarget target) {
        ScanTarget normalized = target.toBuilder().domain(DomainNormalizer.normalize(target.getDomain())).build();
        if (normalized.getDomain().isEmpty()) {
            throw new IllegalArgumentException("domain is required");
        }
        return pipeline.scan(normalized);
    }

    @PreDestroy
    public void shutdown() {
        for (BatchRun run : batches.values()) {
            if (run.cancel()) {
                log.info("Cancelled batch on shutdown: batch_id={}", run.getBatchId());
            }
        }
    }

    int resolveConcurrency(Integer requested) {
        int def = properties.getBatch().getConcurrency();
        int max = properties.getBatch().getMaxConcurrency();
        if (requested == null || requested <= 0) {
            return Math.min(def, max);
        }
        return Math.min(requested, max);
    }

    private void onFinished(ScanBatch batch) {
        log.debug("Batch final: batch_id={}, status={}, total_targets={}, completed_targets={}, failed_targets={}",
                batch.getBatchId(), batch.getStatus(), batch.getTotalTargets(),
                batch.getCompletedTargets(), batch.getFailedTargets());
    }

    private BatchRun getRunOrThrow(String batchId) {
        BatchRun run = batchId == null ? null : batches.get(batchId);
        if (run == null) {
            throw new BatchNotFoundException("Batch not found: " + batchId);
        }
        return run;
    }
}
