package com.yellowstone.kql;

import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.paths.PathAlgorithmTranslator;
import com.yellowstone.kql.paths.PathEndpoint;
import com.yellowstone.kql.paths.PathEnumerationOptions;
import com.yellowstone.kql.paths.PathRequest;
import com.yellowstone.kql.paths.ShortestPathTranslator;
import com.yellowstone.kql.schema.SchemaLoadException;
import com.yellowstone.kql.schema.SchemaLoader;
import com.yellowstone.kql.schema.SchemaMapper;
import com.yellowstone.kql.tracing.TracingUtil;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demo application that translates a few security investigation queries
 * against the bundled schema and logs the results.
 * <p>
 * Queries may be passed as arguments; without arguments a built-in sample
 * set is used. Translator and tracing settings are read from the
 * environment, see {@link TranslatorConfig#fromEnvironment()}.
 */
public final class Main {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    /** Queries translated when no arguments are given. */
    static final List<String> SAMPLE_QUERIES = List.of(
        "MATCH (u:User) WHERE u.department = 'Finance' RETURN u.name LIMIT 10",
        "MATCH (u:User)-[:LOGGED_IN]->(d:Device) "
            + "RETURN d.device_name AS device, count(*) AS logins "
            + "ORDER BY logins DESC LIMIT 5",
        "MATCH (d:Device)-[:TRIGGERED]->(a:Alert) WHERE a.severity = 'High' "
            + "RETURN d.device_name, a.title",
        "MATCH p = shortestPath((u:User)-[:LOGGED_IN*]-(d:Device)) "
            + "WHERE u.name = 'alice' RETURN p",
        "MATCH (a:User)-[:LOGGED_IN*]->(d) RETURN d");

    /** Prevent instantiation of this utility/demo class. */
    private Main() {
        throw new AssertionError("No instances");
    }

    /**
     * Demo entry point.
     *
     * @param args queries to translate, optional
     */
    public static void main(final String[] args) {
        List<String> queries = args.length > 0 ? List.of(args)
            : SAMPLE_QUERIES;
        TranslatorConfig config = TranslatorConfig.fromEnvironment();
        TracingUtil.install(config);
        runDemo(queries, config);
        TracingUtil.shutdown();
    }

    /**
     * Run the demo. Package-private to allow testing.
     *
     * @param queries queries to translate
     * @param config translator settings
     * @return number of queries translated without escalation or rejection
     */
    static int runDemo(final List<String> queries,
            final TranslatorConfig config) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Yellowstone Cypher to KQL Demo");
            LOGGER.info("===============================================");
            LOGGER.info("Configuration: {}", config);
        }
        SchemaMapper mapper;
        try {
            mapper = SchemaLoader.loadDefault();
        } catch (SchemaLoadException e) {
            LOGGER.error("Failed to load the bundled schema", e);
            return 0;
        }

        CypherToKqlTranslator translator = new CypherToKqlTranslator(mapper,
            config);
        int translated = 0;
        for (String query : queries) {
            TranslationResult result = translator.translate(query);
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("\n=== {} ===", query);
                LOGGER.info("Strategy: {}, confidence: {}",
                    result.getStrategy().wireName(), result.getConfidence());
            }
            if (result.isSuccess()) {
                translated++;
                result.getKql().ifPresent(kql -> LOGGER.info("{}", kql));
            }
            result.getEscalation().ifPresent(request -> LOGGER.info(
                "Escalation payload: {}", request.toJson()));
            for (Diagnostic diagnostic : result.getDiagnostics()) {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info("  {} [{}] {}", diagnostic.severity(),
                        diagnostic.code(), diagnostic.message());
                }
            }
        }
        demoPathSearches(mapper, config);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("\n{} of {} queries translated directly", translated,
                queries.size());
        }
        return translated;
    }

    private static void demoPathSearches(final SchemaMapper mapper,
            final TranslatorConfig config) {
        ShortestPathTranslator shortest = new ShortestPathTranslator(mapper,
            config);
        PathAlgorithmTranslator algorithms = new PathAlgorithmTranslator(
            mapper, config);
        PathEndpoint alice = PathEndpoint.of("src", "User", "name", "alice");
        PathEndpoint host = PathEndpoint.of("dst", "Device");
        try {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("\n=== Shortest path ===\n{}", shortest.singlePair(
                    alice, host, PathRequest.of("LOGGED_IN")));
                LOGGER.info("\n=== All paths ===\n{}", algorithms.allPaths(
                    alice, host, PathRequest.of("LOGGED_IN"),
                    PathEnumerationOptions.builder().maxPaths(25).maxDepth(3)
                        .build()));
            }
        } catch (TranslationException e) {
            LOGGER.error("Path search failed: [{}] {}", e.getReasonCode(),
                e.getMessage());
        }
    }
}
