package com.yellowstone.kql;

import com.yellowstone.kql.error.AssistedTranslationException;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.visitor.QueryComplexityAnalyzer.QuerySummary;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one translation.
 *
 * <ul>
 *   <li>Succeeded: {@link #getKql()} holds the query and
 *       {@link #getConfidence()} reflects the approximations made.</li>
 *   <li>Rejected: {@link #getError()} holds the structured error.</li>
 *   <li>Escalated: {@link #getEscalation()} holds the payload for the
 *       assisted translator.</li>
 * </ul>
 */
public final class TranslationResult {

    private final String cypher;
    private final String kql;
    private final TranslationStrategy strategy;
    private final TranslationStage stage;
    private final double confidence;
    private final List<Diagnostic> diagnostics;
    private final TranslationException error;
    private final EscalationRequest escalation;
    private final QuerySummary summary;

    private TranslationResult(final String cypher, final String kql,
            final TranslationStrategy strategy, final TranslationStage stage,
            final double confidence, final List<Diagnostic> diagnostics,
            final TranslationException error,
            final EscalationRequest escalation, final QuerySummary summary) {
        this.cypher = cypher;
        this.kql = kql;
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.stage = Objects.requireNonNull(stage, "stage");
        this.confidence = confidence;
        this.diagnostics = List.copyOf(diagnostics);
        this.error = error;
        this.escalation = escalation;
        this.summary = summary;
    }

    static TranslationResult succeeded(final String cypher, final String kql,
            final double confidence, final List<Diagnostic> diagnostics,
            final QuerySummary summary) {
        return new TranslationResult(cypher, kql, TranslationStrategy.DIRECT,
            TranslationStage.SUCCEEDED, confidence, diagnostics, null, null,
            summary);
    }

    static TranslationResult rejected(final String cypher,
            final TranslationException error,
            final List<Diagnostic> diagnostics, final QuerySummary summary) {
        List<Diagnostic> all = new ArrayList<>(diagnostics);
        all.add(Diagnostic.error(error.getReasonCode(), error.getMessage()));
        return new TranslationResult(cypher, null,
            TranslationStrategy.REJECTED, TranslationStage.REJECTED, 0.0, all,
            error, null, summary);
    }

    static TranslationResult escalated(final String cypher,
            final EscalationRequest escalation, final double confidence,
            final List<Diagnostic> diagnostics, final QuerySummary summary) {
        List<Diagnostic> all = new ArrayList<>(diagnostics);
        all.add(Diagnostic.warning(escalation.reasonCode(),
            escalation.message()));
        return new TranslationResult(cypher, null,
            TranslationStrategy.ESCALATE, TranslationStage.ESCALATED,
            confidence, all, null, escalation, summary);
    }

    /**
     * Merge the assisted translator's answer into an escalated result.
     * A successful answer yields a succeeded result whose confidence is the
     * product of both confidences; a failed one yields a rejected result.
     * The strategy stays {@link TranslationStrategy#ESCALATE} on success.
     *
     * @param assisted the answer
     * @return the merged result
     * @throws IllegalStateException if this result was not escalated
     */
    public TranslationResult mergeAssisted(final AssistedTranslation assisted) {
        Objects.requireNonNull(assisted, "assisted");
        if (stage != TranslationStage.ESCALATED) {
            throw new IllegalStateException(
                "Only escalated results accept an assisted translation, this"
                    + " one is " + stage);
        }
        if (!assisted.isSuccess()) {
            return rejected(cypher,
                new AssistedTranslationException(assisted.message()),
                diagnostics, summary);
        }
        List<Diagnostic> all = new ArrayList<>(diagnostics);
        all.add(Diagnostic.info("assisted-translation",
            assisted.message() != null ? assisted.message()
                : "Translated by the assisted translator"));
        return new TranslationResult(cypher, assisted.kql(),
            TranslationStrategy.ESCALATE, TranslationStage.SUCCEEDED,
            confidence * assisted.confidence(), all, null, escalation,
            summary);
    }

    /**
     * Whether a query was produced.
     *
     * @return true when the stage is SUCCEEDED
     */
    public boolean isSuccess() {
        return stage == TranslationStage.SUCCEEDED;
    }

    /**
     * The input query text.
     *
     * @return the text, empty when translated from an AST
     */
    public Optional<String> getCypher() {
        return Optional.ofNullable(cypher);
    }

    /**
     * The translated query.
     *
     * @return the query, empty unless succeeded
     */
    public Optional<String> getKql() {
        return Optional.ofNullable(kql);
    }

    public TranslationStrategy getStrategy() {
        return strategy;
    }

    public TranslationStage getStage() {
        return stage;
    }

    /**
     * Confidence in [0, 1]; 0 for rejected results.
     *
     * @return the confidence
     */
    public double getConfidence() {
        return confidence;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * The error of a rejected result.
     *
     * @return the error, empty unless rejected
     */
    public Optional<TranslationException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * The payload of an escalated result.
     *
     * @return the payload, empty unless escalated
     */
    public Optional<EscalationRequest> getEscalation() {
        return Optional.ofNullable(escalation);
    }

    /**
     * Shape of the parsed query.
     *
     * @return the summary, empty when parsing failed
     */
    public Optional<QuerySummary> getSummary() {
        return Optional.ofNullable(summary);
    }

    @Override
    public String toString() {
        return "TranslationResult{strategy=" + strategy.wireName()
            + ", stage=" + stage + ", confidence=" + confidence
            + (kql != null ? ", kql=" + kql : "")
            + (error != null ? ", error=" + error.getMessage() : "")
            + (escalation != null ? ", reason=" + escalation.reasonCode() : "")
            + "}";
    }
}
