package com.yellowstone.kql.paths;

import com.yellowstone.kql.TestSchemas;
import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.Comparison;
import com.yellowstone.kql.ast.ComparisonOperator;
import com.yellowstone.kql.ast.Literal;
import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.PropertyAccess;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.schema.SchemaMapper;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PathAlgorithmTranslator.
 */
public class PathAlgorithmTranslatorTest {

    private static final PathEndpoint ALICE =
        PathEndpoint.of("a", "User", "name", "Alice");
    private static final PathEndpoint ANY_USER = PathEndpoint.of("b", "User");

    private static PathAlgorithmTranslator translator;

    @BeforeAll
    public static void setUpClass() {
        SchemaMapper mapper = TestSchemas.testSchema();
        translator = new PathAlgorithmTranslator(mapper,
            TranslatorConfig.defaults(),
            OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Test all shortest paths are capped by the configuration")
    public void testAllShortestPaths() throws Exception {
        assertEquals("graph-shortest-paths output=all "
                + "p=(a:IdentityInfo)-[e:UserRelationships*1..10]->"
                + "(b:IdentityInfo)\n"
                + "| where a.AccountName == 'Alice'\n"
                + "| take 1000",
            translator.allShortestPaths(ALICE, ANY_USER,
                PathRequest.of("KNOWS"), PathEnumerationOptions.defaults()));
    }

    @Test
    @DisplayName("Test all shortest paths honour the requested depth")
    public void testAllShortestPathsDepth() throws Exception {
        PathEnumerationOptions options = PathEnumerationOptions.builder()
            .maxDepth(3)
            .maxPaths(20)
            .build();
        assertEquals("graph-shortest-paths output=all "
                + "p=(a:IdentityInfo)-[e:UserRelationships*1..3]->"
                + "(b:IdentityInfo)\n"
                + "| where a.AccountName == 'Alice'\n"
                + "| take 20",
            translator.allShortestPaths(ALICE, ANY_USER,
                PathRequest.of("KNOWS"), options));

        UnsupportedPatternException tooDeep = assertThrows(
            UnsupportedPatternException.class,
            () -> translator.allShortestPaths(ALICE, ANY_USER,
                PathRequest.of("KNOWS"),
                PathEnumerationOptions.builder().maxDepth(500).build()));
        assertEquals(UnsupportedPatternException.DEPTH_CEILING_EXCEEDED,
            tooDeep.getReasonCode());

        UnsupportedPatternException tooMany = assertThrows(
            UnsupportedPatternException.class,
            () -> translator.allShortestPaths(ALICE, ANY_USER,
                PathRequest.of("KNOWS"),
                PathEnumerationOptions.builder().maxPaths(5000).build()));
        assertEquals(UnsupportedPatternException.INVALID_PATH_OPTIONS,
            tooMany.getReasonCode());
    }

    @Test
    @DisplayName("Test all paths with depth, cap and excluded labels")
    public void testAllPaths() throws Exception {
        PathEnumerationOptions options = PathEnumerationOptions.builder()
            .maxPaths(50)
            .maxDepth(4)
            .excludeNodeLabels("Device")
            .build();
        assertEquals("graph-match cycles=none "
                + "p=(a:IdentityInfo)-[e:UserRelationships*1..4]->"
                + "(b:IdentityInfo)\n"
                + "| where a.AccountName == 'Alice'"
                + " and all(inner_nodes(e), not(labels() has_any "
                + "('DeviceInfo')))\n"
                + "| take 50",
            translator.allPaths(ALICE, ANY_USER, PathRequest.of("KNOWS"),
                options));
    }

    @Test
    @DisplayName("Test cycle policy and relationship exclusions")
    public void testCyclesAndExcludedTypes() throws Exception {
        PathEnumerationOptions options = PathEnumerationOptions.builder()
            .maxDepth(2)
            .cyclePolicy(CyclePolicy.BOUNDED_ALLOWED)
            .excludeRelationshipTypes("LOGGED_IN")
            .build();
        String kql = translator.allPaths(PathEndpoint.of("a", "User"),
            ANY_USER, PathRequest.of(), options);
        assertTrue(kql.startsWith("graph-match cycles=all p=(a:IdentityInfo)"
            + "-[e*1..2]->(b:IdentityInfo)"));
        assertTrue(kql.contains("all(e, not(labels() has_any "
            + "('SigninLogs')))"));
    }

    @Test
    @DisplayName("Test predicates over path variables")
    public void testPredicates() throws Exception {
        PathEnumerationOptions structured = PathEnumerationOptions.builder()
            .maxPaths(10)
            .predicate(new Comparison(ComparisonOperator.GREATER_THAN,
                new PropertyAccess("b", "age", 0),
                new Literal(new LiteralValue.IntegerValue(30))))
            .build();
        assertTrue(translator.allShortestPaths(ALICE, ANY_USER,
                PathRequest.of("KNOWS"), structured)
            .contains("| where a.AccountName == 'Alice' and (b.Age > 30)\n"));

        PathEnumerationOptions raw = PathEnumerationOptions.builder()
            .rawPredicate("b.Department == 'IT'")
            .build();
        assertTrue(translator.allPaths(ALICE, ANY_USER,
                PathRequest.of("KNOWS"), raw)
            .contains("and (b.Department == 'IT')"));
    }

    @Test
    @DisplayName("Test invalid limits are rejected")
    public void testInvalidOptions() {
        UnsupportedPatternException tooMany = assertThrows(
            UnsupportedPatternException.class,
            () -> translator.allPaths(ALICE, ANY_USER, PathRequest.of("KNOWS"),
                PathEnumerationOptions.builder().maxPaths(5000).build()));
        assertEquals(UnsupportedPatternException.INVALID_PATH_OPTIONS,
            tooMany.getReasonCode());

        assertThrows(UnsupportedPatternException.class,
            () -> translator.allPaths(ALICE, ANY_USER, PathRequest.of("KNOWS"),
                PathEnumerationOptions.builder().maxPaths(0).build()));

        UnsupportedPatternException tooDeep = assertThrows(
            UnsupportedPatternException.class,
            () -> translator.allPaths(ALICE, ANY_USER, PathRequest.of("KNOWS"),
                PathEnumerationOptions.builder().maxDepth(11).build()));
        assertEquals(UnsupportedPatternException.DEPTH_CEILING_EXCEEDED,
            tooDeep.getReasonCode());

        assertThrows(UnsupportedPatternException.class,
            () -> translator.allPaths(ALICE, ANY_USER, PathRequest.of("KNOWS"),
                PathEnumerationOptions.builder().minDepth(4).maxDepth(3)
                    .build()));
    }

    @Test
    @DisplayName("Test predicate forms are exclusive")
    public void testBothPredicates() {
        PathEnumerationOptions.Builder builder = PathEnumerationOptions
            .builder()
            .rawPredicate("true")
            .predicate(new Literal(new LiteralValue.BooleanValue(true)));
        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
