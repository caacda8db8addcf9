package com.contractbridge.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SyncResult} and {@link DriftReport}.
 */
class SyncResultTest {

    @Test
    void synced_isCleanSuccess() {
        SyncResult result = SyncResult.synced("user-service", List.of("Added: GET /api/users"), 1, "cache.yaml");

        assertThat(result.success()).isTrue();
        assertThat(result.isStale()).isFalse();
        assertThat(result.errors()).isEmpty();
        assertThat(result.timestamp()).matches("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z");
    }

    @Test
    void offline_isSuccessWithWarning() {
        SyncResult result = SyncResult.offline("user-service", "Using cached contract (sync failed: boom)",
            "boom", 3, "cache.yaml");

        assertThat(result.success()).isTrue();
        assertThat(result.isStale()).isTrue();
        assertThat(result.changes()).containsExactly("Using cached contract (sync failed: boom)");
        assertThat(result.errors()).containsExactly("boom");
        assertThat(result.endpointCount()).isEqualTo(3);
    }

    @Test
    void failed_withoutErrors_isRejected() {
        assertThatThrownBy(() -> new SyncResult("user-service", false, List.of(), List.of(), 0, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void driftReport_withoutIssues_isSuccessful() {
        DriftReport report = DriftReport.of("user-service", List.of());

        assertThat(report.success()).isTrue();
        assertThat(report.totalIssues()).isZero();
        assertThat(report.message()).isEqualTo("All API calls align with user-service contract");
    }

    @Test
    void driftReport_withIssues_countsBySeverity() {
        DriftIssue error = DriftIssue.precondition(DriftIssueType.MISSING_CONTRACT, "Contract file not found: x", "sync");
        DriftIssue warning = new DriftIssue(DriftIssueType.MISSING_ENDPOINT, Severity.WARNING,
            "/api/x", "GET", "A.java:3", "msg", null);

        DriftReport report = DriftReport.of("user-service", List.of(error, warning));

        assertThat(report.success()).isFalse();
        assertThat(report.errors()).isEqualTo(1);
        assertThat(report.warnings()).isEqualTo(1);
        assertThat(report.message()).isEqualTo("Found 2 drift issue(s) with user-service contract");
        assertThat(warning.suggestion()).isEmpty();
    }
}
