package com.coursegen.orchestrator.packaging;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of {@link PackageValidator}: one entry per check.
 */
public record ValidationReport(
        List<Check> checks,
        @JsonProperty("validated_at") String validatedAt
) {

    public record Check(String name, boolean passed) {}

    public ValidationReport {
        checks = List.copyOf(checks);
    }

    @JsonProperty("passed_checks")
    public long passedChecks() {
        return checks.stream().filter(Check::passed).count();
    }

    @JsonProperty("total_checks")
    public int totalChecks() {
        return checks.size();
    }

    @JsonProperty("is_valid")
    public boolean isValid() {
        return passedChecks() == totalChecks();
    }

    @JsonProperty("failed_checks")
    public List<String> failedChecks() {
        return checks.stream().filter(c -> !c.passed()).map(Check::name).toList();
    }
}
