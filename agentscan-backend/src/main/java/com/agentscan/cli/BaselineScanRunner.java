package com.agentscan.cli;

import com.agentscan.batch.BatchScanManager;
import com.agentscan.config.ScannerProperties;
import com.agentscan.model.BatchStatus;
import com.agentscan.model.ScanBatch;
import com.agentscan.model.ScanResult;
import com.agentscan.report.ProtocolAdoptionReport;
import com.agentscan.report.ScanReportFormatter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs one baseline batch over a CSV file at startup and logs the adoption summary.
 *
 * <p>Active only when {@code scanner.cli.input} is set.
 */
@Component
@ConditionalOnProperty(prefix = "scanner.cli", name = "input")
public class BaselineScanRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(BaselineScanRunner.class);

    private final BatchScanManager batchScanManager;
    private final ScannerProperties properties;
    private final ObjectMapper objectMapper;

    public BaselineScanRunner(BatchScanManager batchScanManager, ScannerProperties properties, ObjectMapper objectMapper) {
        this.batchScanManager = batchScanManager;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) throws Exception {
        ScannerProperties.Cli cli = properties.getCli();
        Path input = Path.of(cli.getInput());
        if (!Files.isReadable(input)) {
            throw new IllegalStateException("Baseline input not readable: " + input.toAbsolutePath());
        }

        String csv = Files.readString(input, StandardCharsets.UTF_8);
        String name = cli.getName() != null && !cli.getName().isBlank()
                ? cli.getName()
                : "Baseline " + input.getFileName();
        ScanBatch started = batchScanManager.startBatchFromCsv(name, csv, cli.getConcurrency());
        log.info("Baseline scan started: batch_id={}, input={}, total_targets={}",
                started.getBatchId(), input, started.getTotalTargets());

        ScanBatch batch = batchScanManager.awaitCompletion(started.getBatchId(), Duration.ofMillis(cli.getAwaitTimeoutMs()));
        if (!batch.getStatus().isFinal()) {
            batchScanManager.cancelBatch(batch.getBatchId());
            batch = batchScanManager.getBatch(batch.getBatchId());
        }

        List<ScanResult> results = batchScanManager.getResults(batch.getBatchId());
        ProtocolAdoptionReport report = ProtocolAdoptionReport.from(results);
        log.info("Baseline scan finished: batch_id={}, status={}, completed_targets={}, failed_targets={}\n{}",
                batch.getBatchId(), batch.getStatus(), batch.getCompletedTargets(), batch.getFailedTargets(),
                ScanReportFormatter.adoptionSummary(report));

        if (cli.getOutput() != null && !cli.getOutput().isBlank()) {
            writeResults(Path.of(cli.getOutput()), results);
        }
        if (batch.getStatus() != BatchStatus.COMPLETED) {
            log.warn("Baseline scan did not complete: batch_id={}, status={}", batch.getBatchId(), batch.getStatus());
        }
    }

    private void writeResults(Path output, List<ScanResult> results) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), results);
        log.info("Wrote scan results: path={}, count={}", output, results.size());
    }
}
