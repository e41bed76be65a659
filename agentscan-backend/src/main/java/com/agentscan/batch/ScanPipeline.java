package com.agentscan.batch;

import com.agentscan.model.BusinessModel;
import com.agentscan.model.PageSignals;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.ReadinessScore;
import com.agentscan.model.ScanResult;
import com.agentscan.model.ScanStatus;
import com.agentscan.model.ScanTarget;
import com.agentscan.model.SignalBundle;
import com.agentscan.probe.ProbeRunner;
import com.agentscan.probe.SignalExtractor;
import com.agentscan.scoring.BusinessModelClassifier;
import com.agentscan.scoring.BusinessModelFilter;
import com.agentscan.scoring.EligibilityEnricher;
import com.agentscan.scoring.ReadinessScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Single-domain pipeline: probe, extract signals, enrich, classify, filter, score.
 *
 * <p>The stage order is fixed. Enrichment must see raw probe output and must run before the business
 * model filter, otherwise an eligible protocol could be masked as not applicable.
 */
public class ScanPipeline {
    private static final Logger log = LoggerFactory.getLogger(ScanPipeline.class);

    private final ProbeRunner probeRunner;
    private final SignalExtractor signalExtractor;
    private final EligibilityEnricher enricher;
    private final BusinessModelClassifier classifier;
    private final BusinessModelFilter filter;
    private final ReadinessScorer scorer;

    public ScanPipeline(
            ProbeRunner probeRunner,
            SignalExtractor signalExtractor,
            EligibilityEnricher enricher,
            BusinessModelClassifier classifier,
            BusinessModelFilter filter,
            ReadinessScorer scorer
    ) {
        this.probeRunner = Objects.requireNonNull(probeRunner, "probeRunner");
        this.signalExtractor = signalExtractor != null ? signalExtractor : SignalExtractor.absent();
        this.enricher = Objects.requireNonNull(enricher, "enricher");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    /**
     * Scans one domain. Never throws; an unexpected failure yields a {@link ScanStatus#FAILED} result.
     *
     * @param target target with a normalized domain
     * @return scan result
     */
    public ScanResult scan(ScanTarget target) {
        long startNanos = System.nanoTime();
        try {
            List<ProbeResult> raw = probeRunner.runAll(target);
            PageSignals page = extractSignals(target);
            ScanResult result = assess(target, raw, page);
            result.setScanDurationMs(elapsedMs(startNanos));
            log.info("Scanned domain: domain={}, model={}, readiness_score={}, grade={}, duration_ms={}",
                    target.getDomain(),
                    result.getBusinessModel(),
                    result.getScore().getReadinessScore(),
                    result.getScore().getGrade(),
                    result.getScanDurationMs());
            return result;
        } catch (RuntimeException e) {
            log.error("Scan failed: domain={}", target.getDomain(), e);
            String message = e.getMessage() == null || e.getMessage().isBlank()
                    ? e.getClass().getSimpleName()
                    : e.getMessage();
            return ScanResult.failed(target, message, elapsedMs(startNanos));
        }
    }

    /**
     * Runs the deterministic part of the pipeline over already collected inputs.
     *
     * @param target scanned target
     * @param probeResults raw probe results, one per protocol
     * @param page extracted page signals
     * @return completed scan result without timing
     */
    public ScanResult assess(ScanTarget target, List<ProbeResult> probeResults, PageSignals page) {
        PageSignals signals = page != null ? page : PageSignals.absent();
        SignalBundle bundle = withTargetCategory(signals.getSignals(), target);

        List<ProbeResult> enriched = enricher.enrich(probeResults, bundle);
        BusinessModel model = classifier.classify(bundle);
        List<ProbeResult> filtered = filter.apply(enriched, model);
        ReadinessScore score = scorer.score(filtered, signals.getStructuredData(), signals.getAccessibility());

        return ScanResult.builder()
                .target(target)
                .scanStatus(ScanStatus.COMPLETED)
                .protocolResults(filtered)
                .businessModel(model)
                .score(score)
                .accessibility(signals.getAccessibility())
                .structuredData(signals.getStructuredData())
                .scannedAt(OffsetDateTime.now())
                .build();
    }

    private PageSignals extractSignals(ScanTarget target) {
        try {
            PageSignals page = signalExtractor.extract(target);
            return page != null ? page : PageSignals.absent();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Signal extraction interrupted: domain={}", target.getDomain());
            return PageSignals.absent();
        } catch (Exception e) {
            log.warn("Signal extraction failed, scoring without page signals: domain={}, error={}",
                    target.getDomain(), e.toString());
            return PageSignals.absent();
        }
    }

    // target category wins over the extracted one
    private static SignalBundle withTargetCategory(SignalBundle bundle, ScanTarget target) {
        String category = target != null ? target.getMerchantCategory() : null;
        if (category == null || category.isBlank()) {
            return bundle;
        }
        return bundle.toBuilder().merchantCategory(category.trim()).build();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
