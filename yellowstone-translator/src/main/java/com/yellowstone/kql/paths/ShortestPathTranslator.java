package com.yellowstone.kql.paths;

import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PathFunction;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.error.EscalationRequiredException;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.schema.EntityKind;
import com.yellowstone.kql.schema.SchemaMapper;
import com.yellowstone.kql.tracing.TracingUtil;
import com.yellowstone.kql.translate.PatternRenderer;
import com.yellowstone.kql.translate.TranslationContext;
import io.opentelemetry.api.trace.Tracer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates shortest path searches into the native
 * {@code graph-shortest-paths} operator.
 *
 * <p>Besides the {@code shortestPath(...)} patterns embedded in MATCH
 * (see {@link #fromMatch(PathExpression, TranslationContext)}), the
 * translator offers direct entry points for the usual search shapes:</p>
 *
 * <pre>{@code
 * ShortestPathTranslator paths = new ShortestPathTranslator(mapper, config);
 * String kql = paths.singlePair(
 *     PathEndpoint.of("src", "User", "name", "alice"),
 *     PathEndpoint.of("dst", "Device", "name", "dc01"),
 *     PathRequest.of("LOGGED_IN"));
 *
 * graph-shortest-paths output=any p=(src:IdentityInfo)-[e:SigninLogs*1..]->(dst:DeviceInfo)
 * | where src.AccountName == 'alice' and dst.DeviceName == 'dc01'
 * }</pre>
 *
 * <p>Searches from several sources or towards several targets become a
 * {@code union} of one sub-query per pair.</p>
 */
public final class ShortestPathTranslator {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        ShortestPathTranslator.class);

    /** Operator name. */
    public static final String OPERATOR = "graph-shortest-paths";

    /** Hint enabling search from both ends. */
    public static final String HINT_BIDIRECTIONAL = "bidirectional";

    private static final String BRANCH_SEPARATOR = " | ";
    private static final String STAGE_SEPARATOR = "\n| ";

    private final SchemaMapper mapper;
    private final TranslatorConfig config;
    private final Tracer tracer;

    /**
     * Create a translator traced through the default tracer.
     *
     * @param mapper the schema
     * @param config the configuration
     */
    public ShortestPathTranslator(final SchemaMapper mapper,
            final TranslatorConfig config) {
        this(mapper, config, TracingUtil.getTracer(TracingUtil.SCOPE_PATHS));
    }

    /**
     * Create a translator with an explicit tracer.
     *
     * @param mapper the schema
     * @param config the configuration
     * @param tracer the tracer
     */
    public ShortestPathTranslator(final SchemaMapper mapper,
            final TranslatorConfig config, final Tracer tracer) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    /**
     * Render a {@code shortestPath} or {@code allShortestPaths} pattern of a
     * MATCH clause. An allShortestPaths repetition must be bounded, as a
     * plain MATCH repetition must.
     *
     * @param path the path, its function set
     * @param context the resolved query context
     * @return the operator stage
     * @throws UnsupportedPatternException if bounded repetition exceeds the
     *         ceiling, or an unbounded enumeration is rejected by
     *         configuration
     * @throws EscalationRequiredException if an unbounded enumeration needs
     *         assisted translation
     */
    public static String fromMatch(final PathExpression path,
            final TranslationContext context)
            throws UnsupportedPatternException, EscalationRequiredException {
        RelationshipPattern rel = path.relationships().get(0);
        if (path.function() == PathFunction.ALL_SHORTEST_PATHS) {
            return stage(path, context, "all",
                VariableLengthPathTranslator.renderAllShortest(rel,
                    context.getConfig()), List.of());
        }
        return stage(path, context, "any",
            VariableLengthPathTranslator.renderShortest(rel,
                context.getConfig()), List.of());
    }

    static String stage(final PathExpression path,
            final TranslationContext context, final String output,
            final String length, final List<String> hints) {
        RelationshipPattern rel = path.relationships().get(0);
        StringBuilder sb = new StringBuilder(OPERATOR);
        if (!hints.isEmpty()) {
            sb.append('(').append(String.join(", ", hints)).append(')');
        }
        sb.append(" output=").append(output).append(' ');
        if (path.pathVariable() != null) {
            sb.append(path.pathVariable()).append('=');
        }
        sb.append(PatternRenderer.node(path.nodes().get(0), context))
            .append(PatternRenderer.relationship(rel, length, context))
            .append(PatternRenderer.node(path.nodes().get(1), context));
        return sb.toString();
    }

    /**
     * Shortest path between two endpoints.
     *
     * @param source the source
     * @param target the target
     * @param request traversal settings
     * @return the query
     * @throws TranslationException if a reference does not resolve or the
     *         bounds exceed the ceiling
     */
    public String singlePair(final PathEndpoint source,
            final PathEndpoint target, final PathRequest request)
            throws TranslationException {
        return PathSearch.traced(tracer, "ShortestPathTranslator.singlePair",
            "singlePair", () -> render(List.of(source), List.of(target),
                request, null, false));
    }

    /**
     * Shortest paths from each of several sources to one target.
     *
     * @param sources the sources, not empty
     * @param target the target
     * @param request traversal settings
     * @return the query, a union when there is more than one source
     * @throws TranslationException if a reference does not resolve or the
     *         bounds exceed the ceiling
     */
    public String multipleSources(final List<PathEndpoint> sources,
            final PathEndpoint target, final PathRequest request)
            throws TranslationException {
        requireEndpoints(sources, "sources");
        return PathSearch.traced(tracer,
            "ShortestPathTranslator.multipleSources", "multipleSources",
            () -> render(sources, List.of(target), request, null, false));
    }

    /**
     * Shortest paths from one source to each of several targets.
     *
     * @param source the source
     * @param targets the targets, not empty
     * @param request traversal settings
     * @return the query, a union when there is more than one target
     * @throws TranslationException if a reference does not resolve or the
     *         bounds exceed the ceiling
     */
    public String multipleTargets(final PathEndpoint source,
            final List<PathEndpoint> targets, final PathRequest request)
            throws TranslationException {
        requireEndpoints(targets, "targets");
        return PathSearch.traced(tracer,
            "ShortestPathTranslator.multipleTargets", "multipleTargets",
            () -> render(List.of(source), targets, request, null, false));
    }

    /**
     * Cheapest path by the sum of an edge property.
     *
     * @param source the source
     * @param target the target
     * @param request traversal settings
     * @param weightProperty logical edge property holding the cost
     * @return the query
     * @throws TranslationException if the weight or another reference does
     *         not resolve
     */
    public String weighted(final PathEndpoint source,
            final PathEndpoint target, final PathRequest request,
            final String weightProperty) throws TranslationException {
        if (weightProperty == null || weightProperty.isBlank()) {
            throw new IllegalArgumentException("Weight property is required");
        }
        return PathSearch.traced(tracer, "ShortestPathTranslator.weighted",
            "weighted", () -> render(List.of(source), List.of(target),
                request, weightProperty, false));
    }

    /**
     * Shortest path searched from both ends at once.
     *
     * @param source the source
     * @param target the target
     * @param request traversal settings
     * @return the query
     * @throws TranslationException if a reference does not resolve or the
     *         bounds exceed the ceiling
     */
    public String bidirectional(final PathEndpoint source,
            final PathEndpoint target, final PathRequest request)
            throws TranslationException {
        return PathSearch.traced(tracer,
            "ShortestPathTranslator.bidirectional", "bidirectional",
            () -> render(List.of(source), List.of(target), request, null,
                true));
    }

    private String render(final List<PathEndpoint> sources,
            final List<PathEndpoint> targets, final PathRequest request,
            final String weightProperty, final boolean bidirectional)
            throws TranslationException {
        String separator = sources.size() * targets.size() == 1
            ? STAGE_SEPARATOR : BRANCH_SEPARATOR;
        List<String> branches = new ArrayList<>();
        for (PathEndpoint source : sources) {
            for (PathEndpoint target : targets) {
                PathSearch search = PathSearch.resolve(source, target,
                    request, PathFunction.SHORTEST_PATH, null, null, mapper,
                    config);
                List<String> hints = new ArrayList<>();
                if (weightProperty != null) {
                    hints.add("weight=" + weightField(search, weightProperty));
                }
                if (bidirectional) {
                    hints.add(HINT_BIDIRECTIONAL);
                }
                String stage = stage(search.path(), search.context(), "any",
                    VariableLengthPathTranslator.renderShortest(
                        search.relationship(), config), hints);
                branches.add(PathSearch.pipeline(stage,
                    search.endpointFilters(), separator));
            }
        }
        String kql = branches.size() == 1 ? branches.get(0)
            : "union (" + String.join("), (", branches) + ")";
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Shortest path search over {} pair(s): {}",
                branches.size(), kql);
        }
        return kql;
    }

    private String weightField(final PathSearch search,
            final String weightProperty) throws TranslationException {
        boolean caseInsensitive = config.isCaseInsensitiveLookup();
        if (search.context().entitiesOf(search.relationship()).isEmpty()) {
            return mapper.resolveUnlabeledProperty(EntityKind.RELATIONSHIP,
                weightProperty, caseInsensitive).value().physicalName();
        }
        return mapper.lookupProperty(
            search.context().entitiesOf(search.relationship()),
            weightProperty, caseInsensitive).value().physicalName();
    }

    private static void requireEndpoints(final List<PathEndpoint> endpoints,
            final String what) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint is"
                + " required in " + what);
        }
    }
}
