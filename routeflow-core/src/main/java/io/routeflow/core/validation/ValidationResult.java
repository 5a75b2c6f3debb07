package io.routeflow.core.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Outcome of validating a graph.
///
/// Errors and warnings are kept in rule order. A graph is valid iff there are no errors;
/// warnings never affect validity.
///
/// @param errors issues of severity {@link Severity#ERROR}
/// @param warnings issues of severity {@link Severity#WARNING}
/// @param summary graph counts, never null
public record ValidationResult(
        List<ValidationIssue> errors, List<ValidationIssue> warnings, ValidationSummary summary) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        Objects.requireNonNull(summary, "summary required");
    }

    /// Splits issues by severity.
    public static ValidationResult of(List<ValidationIssue> issues, ValidationSummary summary) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.severity() == Severity.ERROR) {
                errors.add(issue);
            } else {
                warnings.add(issue);
            }
        }
        return new ValidationResult(errors, warnings, summary);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /// Returns whether any error or warning has the given kind.
    public boolean hasIssue(IssueKind kind) {
        return !issuesOfKind(kind).isEmpty();
    }

    /// Returns all errors and warnings of one kind.
    public List<ValidationIssue> issuesOfKind(IssueKind kind) {
        List<ValidationIssue> matches = new ArrayList<>();
        for (ValidationIssue issue : errors) {
            if (issue.kind() == kind) {
                matches.add(issue);
            }
        }
        for (ValidationIssue issue : warnings) {
            if (issue.kind() == kind) {
                matches.add(issue);
            }
        }
        return matches;
    }
}
