package com.yellowstone.kql.paths;

import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.PathFunction;
import com.yellowstone.kql.ast.PathLength;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.schema.BackingEntityRef;
import com.yellowstone.kql.schema.SchemaMapper;
import com.yellowstone.kql.tracing.TracingUtil;
import com.yellowstone.kql.translate.ConditionTranslator;
import com.yellowstone.kql.translate.KqlLiterals;
import com.yellowstone.kql.translate.PatternRenderer;
import io.opentelemetry.api.trace.Tracer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates path enumeration: every shortest path between two endpoints,
 * or every path within a depth range.
 *
 * <pre>{@code
 * graph-match cycles=none p=(src:IdentityInfo)-[e:UserRelationships*1..4]->(dst:IdentityInfo)
 * | where src.AccountName == 'alice'
 *     and all(inner_nodes(e), not(labels() has_any ('DeviceInfo')))
 * | take 50
 * }</pre>
 *
 * <p>Every result is capped with {@code take} and every search with a
 * maximum depth. Limits above the configuration are rejected, never
 * clamped.</p>
 */
public final class PathAlgorithmTranslator {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        PathAlgorithmTranslator.class);

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
    public PathAlgorithmTranslator(final SchemaMapper mapper,
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
    public PathAlgorithmTranslator(final SchemaMapper mapper,
            final TranslatorConfig config, final Tracer tracer) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    /**
     * Every path of minimal length between two endpoints, searched no
     * deeper than the depth range of the options. Cycle options do not
     * apply.
     *
     * @param source the source
     * @param target the target
     * @param request traversal settings; its bounds are replaced by the
     *        depth range of the options
     * @param options cap, depth range, exclusions and predicate
     * @return the query
     * @throws TranslationException if a reference does not resolve or a
     *         limit is invalid
     */
    public String allShortestPaths(final PathEndpoint source,
            final PathEndpoint target, final PathRequest request,
            final PathEnumerationOptions options) throws TranslationException {
        return PathSearch.traced(tracer,
            "PathAlgorithmTranslator.allShortestPaths", "allShortestPaths",
            () -> {
                int maxPaths = maxPaths(options);
                PathLength depth = depth(options);
                PathSearch search = PathSearch.resolve(source, target,
                    request, PathFunction.ALL_SHORTEST_PATHS, depth,
                    options.getPredicate(), mapper, config);
                String stage = ShortestPathTranslator.stage(search.path(),
                    search.context(), "all",
                    VariableLengthPathTranslator.renderShortest(
                        search.relationship(), config), List.of());
                return finish(stage, search, request, options, maxPaths);
            });
    }

    /**
     * Every path between two endpoints within the depth range of the
     * options.
     *
     * @param source the source
     * @param target the target
     * @param request traversal settings; its bounds are replaced by the
     *        depth range of the options
     * @param options limits, exclusions, predicate and cycle policy
     * @return the query
     * @throws TranslationException if a reference does not resolve or a
     *         limit is invalid
     */
    public String allPaths(final PathEndpoint source,
            final PathEndpoint target, final PathRequest request,
            final PathEnumerationOptions options) throws TranslationException {
        return PathSearch.traced(tracer, "PathAlgorithmTranslator.allPaths",
            "allPaths", () -> {
                int maxPaths = maxPaths(options);
                PathLength depth = depth(options);
                CyclePolicy cycles = options.getCyclePolicy() != null
                    ? options.getCyclePolicy() : config.getDefaultCyclePolicy();
                PathSearch search = PathSearch.resolve(source, target,
                    request, PathFunction.NONE, depth, options.getPredicate(),
                    mapper, config);
                String stage = "graph-match cycles=" + cycles.kqlValue() + " "
                    + request.pathVariable() + "="
                    + PatternRenderer.node(search.path().nodes().get(0),
                        search.context())
                    + PatternRenderer.relationship(search.relationship(),
                        VariableLengthPathTranslator.bounds(depth.min(),
                            depth.max()), search.context())
                    + PatternRenderer.node(search.path().nodes().get(1),
                        search.context());
                return finish(stage, search, request, options, maxPaths);
            });
    }

    private String finish(final String stage, final PathSearch search,
            final PathRequest request, final PathEnumerationOptions options,
            final int maxPaths) throws TranslationException {
        List<String> conditions = new ArrayList<>(search.endpointFilters());
        String edges = request.relationshipVariable();
        if (!options.getExcludedNodeLabels().isEmpty()) {
            conditions.add("all(inner_nodes(" + edges + "), not(labels()"
                + " has_any (" + tables(options.getExcludedNodeLabels(), true)
                + ")))");
        }
        if (!options.getExcludedRelationshipTypes().isEmpty()) {
            conditions.add("all(" + edges + ", not(labels() has_any ("
                + tables(options.getExcludedRelationshipTypes(), false)
                + ")))");
        }
        if (options.getPredicate() != null) {
            conditions.add("(" + ConditionTranslator.translate(
                options.getPredicate(), search.context()) + ")");
        }
        if (options.getRawPredicate() != null) {
            conditions.add("(" + options.getRawPredicate() + ")");
        }
        String kql = PathSearch.pipeline(stage, conditions, STAGE_SEPARATOR)
            + STAGE_SEPARATOR + "take " + maxPaths;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Path enumeration capped at {}: {}", maxPaths, kql);
        }
        return kql;
    }

    private String tables(final List<String> names, final boolean labels)
            throws TranslationException {
        boolean caseInsensitive = config.isCaseInsensitiveLookup();
        Set<String> tables = new LinkedHashSet<>();
        for (String name : names) {
            List<BackingEntityRef> refs = labels
                ? mapper.lookupLabel(name, caseInsensitive).value()
                : mapper.lookupRelationshipType(name, caseInsensitive).value();
            for (BackingEntityRef ref : refs) {
                tables.add(KqlLiterals.quote(ref.entityId()));
            }
        }
        return String.join(", ", tables);
    }

    private int maxPaths(final PathEnumerationOptions options)
            throws UnsupportedPatternException {
        int cap = config.getMaxEnumeratedPaths();
        if (options.getMaxPaths() == null) {
            return cap;
        }
        int requested = options.getMaxPaths();
        if (requested <= 0) {
            throw new UnsupportedPatternException("maxPaths must be positive,"
                + " got " + requested,
                UnsupportedPatternException.INVALID_PATH_OPTIONS);
        }
        if (requested > cap) {
            throw new UnsupportedPatternException("maxPaths " + requested
                + " exceeds the configured cap " + cap,
                UnsupportedPatternException.INVALID_PATH_OPTIONS);
        }
        return requested;
    }

    private PathLength depth(final PathEnumerationOptions options)
            throws UnsupportedPatternException {
        int ceiling = config.getMaxPathDepth();
        int max = options.getMaxDepth() != null ? options.getMaxDepth()
            : ceiling;
        int min = options.getMinDepth();
        if (max <= 0) {
            throw new UnsupportedPatternException("maxDepth must be positive,"
                + " got " + max, UnsupportedPatternException.INVALID_PATH_OPTIONS);
        }
        if (max > ceiling) {
            throw new UnsupportedPatternException("maxDepth " + max
                + " exceeds the maximum path depth " + ceiling,
                UnsupportedPatternException.DEPTH_CEILING_EXCEEDED);
        }
        if (min < 0 || min > max) {
            throw new UnsupportedPatternException("minDepth " + min
                + " must be between 0 and maxDepth " + max,
                UnsupportedPatternException.INVALID_PATH_OPTIONS);
        }
        return PathLength.between(min, max);
    }
}
