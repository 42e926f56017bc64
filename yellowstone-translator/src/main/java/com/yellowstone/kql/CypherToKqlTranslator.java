package com.yellowstone.kql;

import com.yellowstone.kql.ast.Or;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.error.CypherSyntaxException;
import com.yellowstone.kql.error.EscalationRequiredException;
import com.yellowstone.kql.error.InvalidQueryException;
import com.yellowstone.kql.error.LexicalException;
import com.yellowstone.kql.error.TranslationAssemblyException;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.error.UnboundIdentifierException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.parser.CypherParser;
import com.yellowstone.kql.schema.SchemaMapper;
import com.yellowstone.kql.tracing.TracingUtil;
import com.yellowstone.kql.translate.ConditionTranslator;
import com.yellowstone.kql.translate.MatchTranslator;
import com.yellowstone.kql.translate.ProjectionTranslator;
import com.yellowstone.kql.translate.SchemaResolver;
import com.yellowstone.kql.translate.TranslationContext;
import com.yellowstone.kql.visitor.IdentifierCollector;
import com.yellowstone.kql.visitor.QueryComplexityAnalyzer;
import com.yellowstone.kql.visitor.QueryComplexityAnalyzer.QuerySummary;
import com.yellowstone.kql.visitor.StructuralValidator;
import com.yellowstone.kql.visitor.StructuralValidator.Violation;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates Cypher queries into KQL graph queries over the tables of a
 * schema.
 *
 * <p>A translation runs through these stages:</p>
 * <ol>
 *   <li>PARSED: the text is tokenized and parsed, and the bindings are
 *       checked.</li>
 *   <li>SCHEMA_RESOLVED: labels, relationship types and properties are
 *       mapped to tables and fields.</li>
 *   <li>CLAUSES_TRANSLATED: MATCH, WHERE and RETURN are rendered.</li>
 *   <li>ASSEMBLED: the stages are joined and checked.</li>
 * </ol>
 * <p>and ends SUCCEEDED, REJECTED or ESCALATED. Translation errors never
 * escape {@link #translate(String)}; they are reported in the
 * {@link TranslationResult}.</p>
 *
 * <pre>{@code
 * SchemaMapper mapper = SchemaLoader.loadDefault();
 * CypherToKqlTranslator translator =
 *     new CypherToKqlTranslator(mapper, TranslatorConfig.defaults());
 * TranslationResult result = translator.translate(
 *     "MATCH (u:User) WHERE u.age > 30 RETURN u.name LIMIT 10");
 *
 * graph-match (u:IdentityInfo)
 * | where u.Age > 30
 * | project u_name = u.AccountName
 * | take 10
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class CypherToKqlTranslator {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        CypherToKqlTranslator.class);

    /** Separator between stages of the output. */
    public static final String STAGE_SEPARATOR = "\n| ";

    /** Confidence factor per multi-entity approximation. */
    public static final double APPROXIMATION_FACTOR = 0.9;

    /** Confidence factor when any reference matched ignoring case. */
    public static final double CASE_INSENSITIVE_FACTOR = 0.95;

    /** Attribute key for the input query. */
    private static final AttributeKey<String> ATTR_CYPHER =
        AttributeKey.stringKey("yellowstone.cypher.query");

    /** Attribute key for the output query. */
    private static final AttributeKey<String> ATTR_KQL =
        AttributeKey.stringKey("yellowstone.kql.query");

    /** Attribute key for the strategy. */
    private static final AttributeKey<String> ATTR_STRATEGY =
        AttributeKey.stringKey("yellowstone.translation.strategy");

    /** Attribute key for the confidence. */
    private static final AttributeKey<Double> ATTR_CONFIDENCE =
        AttributeKey.doubleKey("yellowstone.translation.confidence");

    /** Attribute key for the last stage completed. */
    private static final AttributeKey<String> ATTR_STAGE =
        AttributeKey.stringKey("yellowstone.translation.last_stage");

    /** Attribute key for the rejection or escalation reason. */
    private static final AttributeKey<String> ATTR_REASON =
        AttributeKey.stringKey("yellowstone.translation.reason");

    /** Attribute key for the query complexity. */
    private static final AttributeKey<String> ATTR_COMPLEXITY =
        AttributeKey.stringKey("yellowstone.query.complexity");

    private final SchemaMapper mapper;
    private final TranslatorConfig config;
    private final Tracer tracer;

    /**
     * Create a translator traced through the default tracer.
     *
     * @param mapper the schema
     * @param config the configuration
     */
    public CypherToKqlTranslator(final SchemaMapper mapper,
            final TranslatorConfig config) {
        this(mapper, config,
            TracingUtil.getTracer(TracingUtil.SCOPE_TRANSLATOR));
    }

    /**
     * Create a translator with an explicit tracer.
     *
     * @param mapper the schema
     * @param config the configuration
     * @param tracer the tracer
     */
    public CypherToKqlTranslator(final SchemaMapper mapper,
            final TranslatorConfig config, final Tracer tracer) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    /**
     * Parse query text without translating it.
     *
     * @param cypher the query text
     * @return the AST
     * @throws LexicalException if the text cannot be tokenized
     * @throws CypherSyntaxException if the text is not a valid query
     */
    public Query parse(final String cypher)
            throws LexicalException, CypherSyntaxException {
        return CypherParser.parse(cypher);
    }

    /**
     * Describe the shape of a query.
     *
     * @param query the query
     * @return the summary
     */
    public QuerySummary summarize(final Query query) {
        return QueryComplexityAnalyzer.analyze(query);
    }

    /**
     * Translate query text.
     *
     * @param cypher the query text
     * @return the result
     */
    public TranslationResult translate(final String cypher) {
        Objects.requireNonNull(cypher, "cypher");
        return traced(cypher, null);
    }

    /**
     * Translate an already parsed query.
     *
     * @param query the query
     * @return the result
     */
    public TranslationResult translate(final Query query) {
        Objects.requireNonNull(query, "query");
        return traced(null, query);
    }

    private TranslationResult traced(final String cypher, final Query parsed) {
        Span span = tracer.spanBuilder("CypherToKqlTranslator.translate")
            .setSpanKind(SpanKind.INTERNAL)
            .startSpan();
        if (cypher != null) {
            span.setAttribute(ATTR_CYPHER, cypher);
        }
        try (Scope scope = span.makeCurrent()) {
            Attempt attempt = new Attempt(cypher);
            TranslationResult result = attempt.run(parsed);
            span.setAttribute(ATTR_STRATEGY, result.getStrategy().wireName());
            span.setAttribute(ATTR_CONFIDENCE, result.getConfidence());
            span.setAttribute(ATTR_STAGE, attempt.completed == null ? "NONE"
                : attempt.completed.name());
            result.getSummary().ifPresent(summary -> span.setAttribute(
                ATTR_COMPLEXITY, summary.complexity().name()));
            result.getKql().ifPresent(kql -> span.setAttribute(ATTR_KQL, kql));
            result.getEscalation().ifPresent(request -> span.setAttribute(
                ATTR_REASON, request.reasonCode()));
            if (result.getError().isPresent()) {
                TranslationException error = result.getError().get();
                span.setAttribute(ATTR_REASON, error.getReasonCode());
                span.setStatus(StatusCode.ERROR, error.getMessage());
                span.recordException(error);
            } else {
                span.setStatus(StatusCode.OK);
            }
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** State of one translation. */
    private final class Attempt {

        private final String cypher;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private TranslationStage completed;
        private QuerySummary summary;

        Attempt(final String cypher) {
            this.cypher = cypher;
        }

        TranslationResult run(final Query parsed) {
            Query query = parsed;
            TranslationContext context = null;
            try {
                if (query == null) {
                    query = CypherParser.parse(cypher);
                }
                summary = summarize(query);
                checkStructure(query);
                advance(TranslationStage.PARSED);

                context = SchemaResolver.resolve(query, mapper, config);
                for (String note : context.getApproximations()) {
                    diagnostics.add(Diagnostic.warning(
                        "multi-entity-approximation", note));
                }
                for (String note : context.getSecondAttempts()) {
                    diagnostics.add(Diagnostic.info("case-insensitive-match",
                        note));
                }
                advance(TranslationStage.SCHEMA_RESOLVED);

                List<String> stages = clauses(query, context);
                advance(TranslationStage.CLAUSES_TRANSLATED);

                String kql = assemble(stages);
                advance(TranslationStage.ASSEMBLED);

                double confidence = confidence(context);
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Translated with confidence {}:\n{}",
                        confidence, kql);
                }
                return TranslationResult.succeeded(cypher, kql, confidence,
                    diagnostics, summary);
            } catch (TranslationException e) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Rejected after {}: [{}] {}",
                        completed == null ? "no stage" : completed,
                        e.getReasonCode(), e.getMessage());
                }
                return TranslationResult.rejected(cypher, e, diagnostics,
                    summary);
            } catch (EscalationRequiredException e) {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info("Escalating query: [{}] {}",
                        e.getReasonCode(), e.getMessage());
                }
                EscalationRequest request = new EscalationRequest(query,
                    cypher, e.getReasonCode(), e.getSubPattern(),
                    e.getMessage(), schemaContext(query));
                return TranslationResult.escalated(cypher, request,
                    context == null ? 1.0 : confidence(context), diagnostics,
                    summary);
            }
        }

        private void advance(final TranslationStage stage) {
            completed = stage;
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Stage {}", stage);
            }
        }

        /*
         * The first violation is raised; the rest are kept as diagnostics.
         */
        private void checkStructure(final Query query)
                throws TranslationException {
            List<Violation> violations = StructuralValidator.validate(query);
            if (violations.isEmpty()) {
                return;
            }
            for (Violation violation : violations.subList(1,
                    violations.size())) {
                diagnostics.add(Diagnostic.error(
                    violation.kind().name().toLowerCase(Locale.ROOT)
                        .replace('_', '-'), violation.message()));
            }
            Violation first = violations.get(0);
            throw switch (first.kind()) {
                case UNBOUND_IDENTIFIER -> new UnboundIdentifierException(
                    first.subject(), first.clause(), first.position());
                case AGGREGATE_IN_WHERE -> new UnsupportedPatternException(
                    first.message(),
                    UnsupportedPatternException.MISPLACED_AGGREGATE,
                    first.subject(), first.position());
                case VARIABLE_KIND_CONFLICT -> new InvalidQueryException(
                    first.message(),
                    InvalidQueryException.VARIABLE_KIND_CONFLICT,
                    first.subject(), first.position());
                case RELATIONSHIP_REBOUND -> new InvalidQueryException(
                    first.message(), InvalidQueryException.RELATIONSHIP_REBOUND,
                    first.subject(), first.position());
                case PATH_FUNCTION_MISUSE -> new InvalidQueryException(
                    first.message(), InvalidQueryException.PATH_FUNCTION_MISUSE,
                    first.subject(), first.position());
            };
        }

        private List<String> clauses(final Query query,
                final TranslationContext context)
                throws TranslationException, EscalationRequiredException {
            MatchTranslator.MatchTranslation match = MatchTranslator.translate(
                query.matchClauses(), context);
            List<String> stages = new ArrayList<>(match.stages());

            List<String> conditions = new ArrayList<>(match.filters());
            if (query.whereClause() != null) {
                String where = ConditionTranslator.translate(
                    query.whereClause().condition(), context);
                boolean wrap = !conditions.isEmpty()
                    && query.whereClause().condition() instanceof Or;
                conditions.add(wrap ? "(" + where + ")" : where);
            }
            if (!conditions.isEmpty()) {
                stages.add("where " + String.join(" and ", conditions));
            }

            stages.addAll(ProjectionTranslator.translate(query.returnClause(),
                context).stages());
            if (match.enumeratesPaths()) {
                int cap = config.getMaxEnumeratedPaths();
                Long limit = query.returnClause().limit();
                if (limit == null || limit > cap) {
                    stages.add("take " + cap);
                }
            }
            return stages;
        }

        private EscalationRequest.SchemaContext schemaContext(
                final Query query) {
            IdentifierCollector ids = IdentifierCollector.collect(query);
            return new EscalationRequest.SchemaContext(mapper.getVersion(),
                new ArrayList<>(ids.getLabels()),
                new ArrayList<>(ids.getRelationshipTypes()),
                mapper.getLabels(), mapper.getRelationshipTypes());
        }
    }

    private static double confidence(final TranslationContext context) {
        double confidence = Math.pow(APPROXIMATION_FACTOR,
            context.getApproximations().size());
        if (!context.getSecondAttempts().isEmpty()) {
            confidence *= CASE_INSENSITIVE_FACTOR;
        }
        return confidence;
    }

    /**
     * Join stages and check the result is well formed: no empty stage,
     * balanced brackets and closed string literals.
     *
     * @param stages the stages
     * @return the query text
     * @throws TranslationAssemblyException if the output is malformed
     */
    static String assemble(final List<String> stages)
            throws TranslationAssemblyException {
        if (stages.isEmpty()) {
            throw new TranslationAssemblyException("No stages to assemble");
        }
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i) == null || stages.get(i).isBlank()) {
                throw new TranslationAssemblyException("Stage " + i
                    + " is empty");
            }
        }
        String kql = String.join(STAGE_SEPARATOR, stages);
        checkBalanced(kql);
        return kql;
    }

    private static void checkBalanced(final String kql)
            throws TranslationAssemblyException {
        Deque<Character> open = new ArrayDeque<>();
        boolean quoted = false;
        for (int i = 0; i < kql.length(); i++) {
            char c = kql.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '\'') {
                    quoted = false;
                }
                continue;
            }
            switch (c) {
                case '\'' -> quoted = true;
                case '(', '[', '{' -> open.push(c);
                case ')', ']', '}' -> {
                    char expected = c == ')' ? '(' : c == ']' ? '[' : '{';
                    if (open.isEmpty() || open.pop() != expected) {
                        throw new TranslationAssemblyException(
                            "Unbalanced '" + c + "' at offset " + i);
                    }
                }
                default -> {
                }
            }
        }
        if (quoted) {
            throw new TranslationAssemblyException(
                "Unterminated string literal");
        }
        if (!open.isEmpty()) {
            throw new TranslationAssemblyException("Unclosed '" + open.peek()
                + "'");
        }
    }
}
