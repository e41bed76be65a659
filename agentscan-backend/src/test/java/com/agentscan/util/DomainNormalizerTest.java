package com.agentscan.util;

import com.agentscan.model.ScanTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DomainNormalizerTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "'https://www.Example.COM///', example.com",
            "'http://shop.example.com/', shop.example.com",
            "'  WWW.example.org  ', example.org",
            "'example.net', example.net",
            "'wwwexample.com', wwwexample.com"
    })
    void normalizes(String raw, String expected) {
        assertThat(DomainNormalizer.normalize(raw)).isEqualTo(expected);
    }

    @Test
    void blankInputsBecomeEmpty() {
        assertThat(DomainNormalizer.normalize(null)).isEmpty();
        assertThat(DomainNormalizer.normalize("   ")).isEmpty();
        assertThat(DomainNormalizer.normalize("https:///")).isEmpty();
    }

    @Test
    @DisplayName("spellings of one domain collapse to one entry")
    void deduplicates() {
        List<String> out = DomainNormalizer.normalizeAll(
                Arrays.asList("example.com", "www.example.com", "https://example.com", "other.io", "", null));

        assertThat(out).containsExactly("example.com", "other.io");
    }

    @Test
    @DisplayName("first target row for a domain wins")
    void targetsKeepFirstRow() {
        List<ScanTarget> out = DomainNormalizer.normalizeTargets(List.of(
                ScanTarget.builder().domain("https://www.Example.com").merchantName("First").build(),
                ScanTarget.builder().domain("example.com").merchantName("Second").build(),
                ScanTarget.builder().domain(" ").merchantName("Blank").build()));

        assertThat(out).hasSize(1);
        assertThat(out.get(0).getDomain()).isEqualTo("example.com");
        assertThat(out.get(0).getMerchantName()).isEqualTo("First");
    }
}
