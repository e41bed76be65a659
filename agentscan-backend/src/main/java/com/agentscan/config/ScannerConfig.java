package com.agentscan.config;

import com.agentscan.batch.ScanPipeline;
import com.agentscan.probe.ProbeRunner;
import com.agentscan.probe.ProtocolProbe;
import com.agentscan.probe.SignalExtractor;
import com.agentscan.scoring.BusinessModelClassifier;
import com.agentscan.scoring.BusinessModelFilter;
import com.agentscan.scoring.EligibilityEnricher;
import com.agentscan.scoring.ReadinessScorer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Wires the probe executor and the scan pipeline.
 *
 * <p>Protocol probes and the signal extractor are optional beans; without them every protocol reads as
 * not detected and page signals are absent.
 */
@Configuration
@EnableConfigurationProperties(ScannerProperties.class)
public class ScannerConfig {

    @Bean(name = "probeExecutor", destroyMethod = "shutdownNow")
    public ExecutorService probeExecutor(ScannerProperties properties) {
        return newProbeExecutor(properties.getProbe().getPoolSize());
    }

    /**
     * Creates the probe executor. Tasks are handed straight to a thread, never queued, so a domain's
     * probe deadline only ever covers its own probe work.
     *
     * @param coreThreads threads kept alive between scans
     * @return executor that starts extra threads on demand
     */
    public static ExecutorService newProbeExecutor(int coreThreads) {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(
                coreThreads,
                Integer.MAX_VALUE,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "probe-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    @Bean
    public ProbeRunner probeRunner(
            ObjectProvider<ProtocolProbe> probes,
            ExecutorService probeExecutor,
            ScannerProperties properties
    ) {
        return new ProbeRunner(
                probes.orderedStream().collect(Collectors.toList()),
                probeExecutor,
                properties.getProbe().getTimeoutMs());
    }

    @Bean
    public ScanPipeline scanPipeline(
            ProbeRunner probeRunner,
            ObjectProvider<SignalExtractor> signalExtractor,
            EligibilityEnricher enricher,
            BusinessModelClassifier classifier,
            BusinessModelFilter filter,
            ReadinessScorer scorer
    ) {
        return new ScanPipeline(
                probeRunner,
                signalExtractor.getIfAvailable(SignalExtractor::absent),
                enricher,
                classifier,
                filter,
                scorer);
    }
}
