package io.codegraph.enhance;

import io.codegraph.model.Confidence;
import io.codegraph.model.GraphIssue;

import java.util.List;

/**
 * A structural issue after checking it against the language server.
 *
 * @param issue       The issue as reported by structural analysis
 * @param validated   True when the issue stands, false when refuted or not checkable
 * @param confidence  How far the verdict can be trusted
 * @param lspEvidence Observations from the language server backing the verdict
 */
public record ValidatedIssue(
        GraphIssue issue,
        boolean validated,
        Confidence confidence,
        List<String> lspEvidence
) {
    public ValidatedIssue {
        if (issue == null) {
            throw new IllegalArgumentException("issue cannot be null");
        }
        if (confidence == null) {
            confidence = Confidence.LOW;
        }
        lspEvidence = lspEvidence == null ? List.of() : List.copyOf(lspEvidence);
    }

    static ValidatedIssue confirmed(GraphIssue issue, Confidence confidence, List<String> evidence) {
        return new ValidatedIssue(issue, true, confidence, evidence);
    }

    static ValidatedIssue refuted(GraphIssue issue, Confidence confidence, List<String> evidence) {
        return new ValidatedIssue(issue, false, confidence, evidence);
    }

    static ValidatedIssue unchecked(GraphIssue issue, String reason) {
        return new ValidatedIssue(issue, false, Confidence.LOW, List.of(reason));
    }
}
