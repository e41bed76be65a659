package com.agentscan.cli;

import com.agentscan.batch.BatchScanManager;
import com.agentscan.config.ScannerProperties;
import com.agentscan.model.BatchStatus;
import com.agentscan.model.ReadinessScore;
import com.agentscan.model.ScanBatch;
import com.agentscan.model.ScanResult;
import com.agentscan.model.ScanStatus;
import com.agentscan.model.ScanTarget;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BaselineScanRunnerTest {

    @Mock
    private BatchScanManager batchScanManager;

    @TempDir
    Path tmp;

    private ScannerProperties properties;
    private BaselineScanRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ScannerProperties();
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        runner = new BaselineScanRunner(batchScanManager, properties, objectMapper);
    }

    private static ScanBatch batch(BatchStatus status) {
        return ScanBatch.builder().batchId("b-1").name("baseline").status(status).totalTargets(1).build();
    }

    @Test
    void runsBatchAndWritesResults() throws Exception {
        Path input = tmp.resolve("merchants.csv");
        Files.writeString(input, "domain,merchant_name\nexample.com,Example\n");
        Path output = tmp.resolve("out/results.json");
        properties.getCli().setInput(input.toString());
        properties.getCli().setOutput(output.toString());

        ScanResult result = ScanResult.builder()
                .target(ScanTarget.of("example.com"))
                .scanStatus(ScanStatus.COMPLETED)
                .score(ReadinessScore.zero())
                .build();
        when(batchScanManager.startBatchFromCsv(eq("Baseline merchants.csv"), anyString(), isNull()))
                .thenReturn(batch(BatchStatus.RUNNING));
        when(batchScanManager.awaitCompletion(eq("b-1"), any(Duration.class)))
                .thenReturn(batch(BatchStatus.COMPLETED));
        when(batchScanManager.getResults("b-1")).thenReturn(List.of(result));

        runner.run();

        JsonNode written = new ObjectMapper().readTree(output.toFile());
        assertThat(written.isArray()).isTrue();
        assertThat(written.get(0).get("domain").asText()).isEqualTo("example.com");
        assertThat(written.get(0).get("scan_status").asText()).isEqualTo("completed");
        verify(batchScanManager, never()).cancelBatch(anyString());
    }

    @Test
    void cancelsBatchStillRunningAfterWait() throws Exception {
        Path input = tmp.resolve("merchants.csv");
        Files.writeString(input, "example.com\n");
        properties.getCli().setInput(input.toString());
        properties.getCli().setName("nightly");
        properties.getCli().setConcurrency(4);

        when(batchScanManager.startBatchFromCsv(eq("nightly"), anyString(), eq(4)))
                .thenReturn(batch(BatchStatus.RUNNING));
        when(batchScanManager.awaitCompletion(eq("b-1"), any(Duration.class)))
                .thenReturn(batch(BatchStatus.RUNNING));
        when(batchScanManager.getBatch("b-1")).thenReturn(batch(BatchStatus.CANCELLED));
        when(batchScanManager.getResults("b-1")).thenReturn(List.of());

        runner.run();

        verify(batchScanManager).cancelBatch("b-1");
    }

    @Test
    void missingInputFails() {
        properties.getCli().setInput(tmp.resolve("missing.csv").toString());

        assertThatThrownBy(() -> runner.run())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not readable");
    }
}
