package com.yellowstone.kql.paths;

import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.CypherText;
import com.yellowstone.kql.ast.PathLength;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.error.EscalationRequiredException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders repetition bounds of relationships.
 *
 * <p>Inside a plain MATCH a repetition must be bounded and stay within the
 * configured depth ceiling:</p>
 * <ul>
 *   <li>{@code [*1..3]} renders natively as {@code *1..3}.</li>
 *   <li>{@code [*]} and {@code [*2..]} are escalated, or rejected under
 *       {@link UnboundedPathPolicy#REJECT}.</li>
 *   <li>A maximum above the ceiling is rejected. Bounds are never
 *       clamped.</li>
 *   <li>A repetition over more than one relationship type is escalated.</li>
 * </ul>
 *
 * <p>A single shortest-path search stops at the first match, so an open
 * upper bound is native there and renders as {@code *1..}. Enumerating all
 * shortest paths follows the plain MATCH rules.</p>
 */
public final class VariableLengthPathTranslator {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        VariableLengthPathTranslator.class);

    private VariableLengthPathTranslator() {
        throw new AssertionError("No instances");
    }

    /**
     * Repetition suffix of a relationship inside graph-match.
     *
     * @param rel the relationship
     * @param config the configuration
     * @return the suffix, empty for a single hop
     * @throws UnsupportedPatternException if the bounds exceed the ceiling or
     *         an unbounded path is rejected by configuration
     * @throws EscalationRequiredException if the repetition needs assisted
     *         translation
     */
    public static String render(final RelationshipPattern rel,
            final TranslatorConfig config)
            throws UnsupportedPatternException, EscalationRequiredException {
        if (!rel.isVariableLength()) {
            return "";
        }
        requireBounded(rel, config);
        checkCeiling(rel, config);
        if (rel.types().size() > 1) {
            throw new EscalationRequiredException("Repetition over "
                + rel.types().size() + " relationship types has no native"
                + " rendering",
                EscalationRequiredException.MULTI_TYPE_VARIABLE_PATH,
                CypherText.of(rel));
        }
        return bounds(rel.length().effectiveMin(), rel.length().max());
    }

    /**
     * Repetition suffix of the relationship inside an all-shortest-paths
     * search. Enumerating every shortest path needs the same bounded
     * repetition a plain MATCH does. A single hop renders as
     * {@code *1..1}.
     *
     * @param rel the relationship
     * @param config the configuration
     * @return the suffix
     * @throws UnsupportedPatternException if the bounds exceed the ceiling or
     *         an unbounded path is rejected by configuration
     * @throws EscalationRequiredException if the repetition is unbounded
     */
    public static String renderAllShortest(final RelationshipPattern rel,
            final TranslatorConfig config)
            throws UnsupportedPatternException, EscalationRequiredException {
        if (!rel.isVariableLength()) {
            return bounds(1, 1);
        }
        requireBounded(rel, config);
        checkCeiling(rel, config);
        return bounds(rel.length().effectiveMin(), rel.length().max());
    }

    /**
     * Repetition suffix of the relationship inside a shortest-path
     * primitive. A single hop renders as {@code *1..1}.
     *
     * @param rel the relationship
     * @param config the configuration
     * @return the suffix
     * @throws UnsupportedPatternException if a bounded maximum exceeds the
     *         ceiling
     */
    public static String renderShortest(final RelationshipPattern rel,
            final TranslatorConfig config) throws UnsupportedPatternException {
        if (!rel.isVariableLength()) {
            return bounds(1, 1);
        }
        PathLength length = rel.length();
        if (length.isUnbounded()) {
            return "*" + length.effectiveMin() + "..";
        }
        checkCeiling(rel, config);
        return bounds(length.effectiveMin(), length.max());
    }

    /**
     * Format explicit bounds.
     *
     * @param min lower bound
     * @param max upper bound
     * @return e.g. {@code *1..3}
     */
    public static String bounds(final int min, final int max) {
        return "*" + min + ".." + max;
    }

    private static void requireBounded(final RelationshipPattern rel,
            final TranslatorConfig config)
            throws UnsupportedPatternException, EscalationRequiredException {
        PathLength length = rel.length();
        if (!length.isUnbounded()) {
            return;
        }
        String message = "Unbounded repetition " + length.toCypher()
            + " has no native rendering";
        if (config.getUnboundedPathPolicy() == UnboundedPathPolicy.REJECT) {
            throw new UnsupportedPatternException(message,
                UnsupportedPatternException.UNBOUNDED_PATH,
                CypherText.of(rel), rel.position());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Escalating {}", CypherText.of(rel));
        }
        throw new EscalationRequiredException(message,
            EscalationRequiredException.UNBOUNDED_PATH, CypherText.of(rel));
    }

    private static void checkCeiling(final RelationshipPattern rel,
            final TranslatorConfig config) throws UnsupportedPatternException {
        int ceiling = config.getMaxPathDepth();
        if (rel.length().max() > ceiling) {
            throw new UnsupportedPatternException("Repetition "
                + rel.length().toCypher() + " exceeds the maximum path depth "
                + ceiling, UnsupportedPatternException.DEPTH_CEILING_EXCEEDED,
                CypherText.of(rel), rel.position());
        }
    }
}
