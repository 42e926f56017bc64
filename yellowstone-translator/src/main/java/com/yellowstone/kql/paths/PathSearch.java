package com.yellowstone.kql.paths;

import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.Expression;
import com.yellowstone.kql.ast.MatchClause;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PathFunction;
import com.yellowstone.kql.ast.PathLength;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.ast.ReturnClause;
import com.yellowstone.kql.ast.ReturnItem;
import com.yellowstone.kql.ast.VariableRef;
import com.yellowstone.kql.ast.WhereClause;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.schema.SchemaMapper;
import com.yellowstone.kql.translate.MatchTranslator;
import com.yellowstone.kql.translate.SchemaResolver;
import com.yellowstone.kql.translate.TranslationContext;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One resolved source/target search. Endpoints and traversal settings are
 * turned into a single-path query so labels, types and properties resolve
 * exactly as they do for MATCH.
 */
final class PathSearch {

    /** Span attribute for the operation name. */
    static final AttributeKey<String> ATTR_OPERATION =
        AttributeKey.stringKey("yellowstone.path.operation");

    /** Span attribute for the rendered query. */
    static final AttributeKey<String> ATTR_OUTPUT =
        AttributeKey.stringKey("yellowstone.path.kql");

    private final PathExpression path;
    private final TranslationContext context;

    private PathSearch(final PathExpression path,
            final TranslationContext context) {
        this.path = path;
        this.context = context;
    }

    /**
     * Resolve one search.
     *
     * @param source the source endpoint
     * @param target the target endpoint
     * @param request traversal settings
     * @param function the path function, NONE for enumeration
     * @param length bounds to use instead of the request's, may be null
     * @param predicate extra condition to resolve, may be null
     * @param mapper the schema
     * @param config the configuration
     * @return the resolved search
     * @throws TranslationException if a reference does not resolve
     */
    static PathSearch resolve(final PathEndpoint source,
            final PathEndpoint target, final PathRequest request,
            final PathFunction function, final PathLength length,
            final Expression predicate, final SchemaMapper mapper,
            final TranslatorConfig config) throws TranslationException {
        if (source.variable().equals(target.variable())) {
            throw new IllegalArgumentException(
                "Source and target share the variable " + source.variable());
        }
        RelationshipPattern rel = new RelationshipPattern(
            request.relationshipVariable(), request.relationshipTypes(),
            request.direction(), Map.of(),
            length != null ? length : request.length(), 0);
        NodePattern from = source.toNodePattern();
        NodePattern to = target.toNodePattern();
        PathExpression path = new PathExpression(request.pathVariable(),
            function, List.of(from, to), List.of(rel));
        Query query = new Query(List.of(new MatchClause(List.of(path), false)),
            predicate == null ? null : new WhereClause(predicate),
            ReturnClause.of(ReturnItem.of(
                new VariableRef(request.pathVariable(), 0), null)));
        return new PathSearch(path, SchemaResolver.resolve(query, mapper,
            config));
    }

    PathExpression path() {
        return path;
    }

    RelationshipPattern relationship() {
        return path.relationships().get(0);
    }

    TranslationContext context() {
        return context;
    }

    /**
     * Endpoint equality filters.
     *
     * @return predicates in source order
     * @throws TranslationException never for searches built here
     */
    List<String> endpointFilters() throws TranslationException {
        return MatchTranslator.propertyFilters(path, context);
    }

    /**
     * Join a stage and its predicates into a pipeline.
     *
     * @param stage the operator stage
     * @param conditions predicates to conjoin, may be empty
     * @param separator stage separator
     * @return the pipeline text
     */
    static String pipeline(final String stage, final List<String> conditions,
            final String separator) {
        List<String> stages = new ArrayList<>();
        stages.add(stage);
        if (!conditions.isEmpty()) {
            stages.add("where " + String.join(" and ", conditions));
        }
        return String.join(separator, stages);
    }

    /** A path operation that may fail with a translation error. */
    @FunctionalInterface
    interface Operation {
        String run() throws TranslationException;
    }

    /**
     * Run an operation inside a span.
     *
     * @param tracer the tracer
     * @param spanName the span name
     * @param operationName value of the operation attribute
     * @param operation the work
     * @return the rendered query
     * @throws TranslationException if the operation fails
     */
    static String traced(final Tracer tracer, final String spanName,
            final String operationName, final Operation operation)
            throws TranslationException {
        Span span = tracer.spanBuilder(spanName)
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_OPERATION, operationName)
            .startSpan();
        try (Scope scope = span.makeCurrent()) {
            String kql = operation.run();
            span.setAttribute(ATTR_OUTPUT, kql);
            span.setStatus(StatusCode.OK);
            return kql;
        } catch (TranslationException | RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
