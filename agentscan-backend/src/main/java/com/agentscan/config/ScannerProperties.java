package com.agentscan.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Scanner settings bound from the {@code scanner.*} keys.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {

    @Valid
    private Batch batch = new Batch();

    @Valid
    private Probe probe = new Probe();

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Cli cli = new Cli();

    @Data
    public static class Batch {
        /** Domains scanned in parallel when a batch does not ask for its own limit. */
        @Min(1)
        @Max(20)
        private int concurrency = 10;

        /** Upper bound for a per-batch concurrency override. */
        @Min(1)
        @Max(64)
        private int maxConcurrency = 20;
    }

    @Data
    public static class Probe {
        /** Deadline for the whole probe phase of one domain. */
        @Min(100)
        private long timeoutMs = 10_000;

        /** Probe threads kept alive between scans; more start on demand so probe calls never queue. */
        @Min(0)
        private int poolSize = 16;
    }

    @Data
    public static class Rules {
        @NotBlank
        private String eligibilityResource = "/rules/eligibility.json";
    }

    @Data
    public static class Cli {
        /** CSV file of targets; the baseline runner is active only when set. */
        private String input;

        private String name;

        /** Requested batch concurrency, the batch default when unset. */
        private Integer concurrency;

        /** Optional JSON file receiving every scan result. */
        private String output;

        @Min(1000)
        private long awaitTimeoutMs = 3_600_000;
    }
}
