package com.yellowstone.kql;

/**
 * Collaborator that translates queries the rule-based translator escalates.
 *
 * <p>The translator never calls a handler. Callers pass the
 * {@link EscalationRequest} of an escalated {@link TranslationResult} to
 * their handler, wherever it runs, and merge the answer with
 * {@link TranslationResult#mergeAssisted(AssistedTranslation)}.</p>
 */
@FunctionalInterface
public interface AssistedTranslationHandler {

    /**
     * Translate an escalated query.
     *
     * @param request the escalation payload
     * @return the answer, a failure when no translation is possible
     */
    AssistedTranslation handle(EscalationRequest request);
}
