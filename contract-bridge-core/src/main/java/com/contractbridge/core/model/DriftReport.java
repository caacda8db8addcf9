package com.contractbridge.core.model;

import java.util.List;

/**
 * Drift summary for one dependency.
 *
 * @param dependencyName dependency name
 * @param totalIssues number of issues
 * @param errors number of error issues
 * @param warnings number of warning issues
 * @param issues the issues
 * @param success true when no issue was found
 * @param message one-line summary
 */
public record DriftReport(
    String dependencyName,
    int totalIssues,
    int errors,
    int warnings,
    List<DriftIssue> issues,
    boolean success,
    String message
) {
    public DriftReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Summarizes the issues found for a dependency.
     *
     * @param dependencyName dependency name
     * @param issues issues reported by the drift detector
     * @return report
     */
    public static DriftReport of(String dependencyName, List<DriftIssue> issues) {
        if (issues.isEmpty()) {
            return new DriftReport(dependencyName, 0, 0, 0, List.of(), true,
                "All API calls align with " + dependencyName + " contract");
        }
        int errors = (int) issues.stream().filter(issue -> issue.severity() == Severity.ERROR).count();
        int warnings = (int) issues.stream().filter(issue -> issue.severity() == Severity.WARNING).count();
        return new DriftReport(dependencyName, issues.size(), errors, warnings, issues, false,
            "Found " + issues.size() + " drift issue(s) with " + dependencyName + " contract");
    }
}
