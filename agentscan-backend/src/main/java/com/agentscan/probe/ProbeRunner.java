package com.agentscan.probe;

import com.agentscan.model.ProbeResult;
import com.agentscan.model.Protocol;
import com.agentscan.model.ScanTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every registered probe for a domain under one deadline and always returns one result per
 * protocol, in {@link Protocol} declaration order.
 *
 * <p>A protocol without a probe, a probe that throws or returns {@code null}, and a probe still running
 * at the deadline all yield {@link ProbeResult#notDetected(Protocol)}.
 */
public class ProbeRunner {
    private static final Logger log = LoggerFactory.getLogger(ProbeRunner.class);

    private final Map<Protocol, ProtocolProbe> probes = new EnumMap<>(Protocol.class);
    private final ExecutorService executor;
    private final long timeoutMs;

    /**
     * Create a probe runner.
     *
     * @param probes available probes; when two share a protocol the first one is used
     * @param executor executor running probe calls
     * @param timeoutMs deadline of the probe phase of one domain
     */
    public ProbeRunner(Collection<ProtocolProbe> probes, ExecutorService executor, long timeoutMs) {
        if (probes != null) {
            for (ProtocolProbe p : probes) {
                if (p == null || p.protocol() == null) {
                    continue;
                }
                if (this.probes.putIfAbsent(p.protocol(), p) != null) {
                    log.warn("Ignoring duplicate probe: protocol={}, class={}", p.protocol(), p.getClass().getName());
                }
            }
        }
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        log.info("Probe runner ready: probes={}, timeout_ms={}", this.probes.keySet(), timeoutMs);
    }

    public List<ProbeResult> runAll(ScanTarget target) {
        Map<Protocol, Future<ProbeResult>> futures = new EnumMap<>(Protocol.class);
        for (Map.Entry<Protocol, ProtocolProbe> e : probes.entrySet()) {
            futures.put(e.getKey(), executor.submit(withMdc(() -> e.getValue().probe(target))));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<ProbeResult> out = new ArrayList<>(Protocol.values().length);
        for (Protocol protocol : Protocol.values()) {
            Future<ProbeResult> future = futures.get(protocol);
            out.add(future == null
                    ? ProbeResult.notDetected(protocol)
                    : await(protocol, future, deadline, target));
        }
        return out;
    }

    private ProbeResult await(Protocol protocol, Future<ProbeResult> future, long deadline, ScanTarget target) {
        if (Thread.currentThread().isInterrupted()) {
            future.cancel(true);
            return ProbeResult.notDetected(protocol);
        }
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            ProbeResult r = future.get(remaining, TimeUnit.NANOSECONDS);
            return conform(protocol, r);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Probe timed out: domain={}, protocol={}, timeout_ms={}", target.getDomain(), protocol, timeoutMs);
            return ProbeResult.notDetected(protocol);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Probe failed: domain={}, protocol={}, error={}", target.getDomain(), protocol, cause.toString());
            return ProbeResult.notDetected(protocol);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeResult.notDetected(protocol);
        }
    }

    private static ProbeResult conform(Protocol protocol, ProbeResult r) {
        if (r == null) {
            return ProbeResult.notDetected(protocol);
        }
        ProbeResult out = r.copy();
        out.setProtocol(protocol);
        out.setStatus(r.getStatus());
        out.setConfidence(r.getConfidence());
        return out;
    }

    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }
}
