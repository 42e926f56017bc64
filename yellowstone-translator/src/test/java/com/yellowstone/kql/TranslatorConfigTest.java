package com.yellowstone.kql;

import com.yellowstone.kql.paths.CyclePolicy;
import com.yellowstone.kql.paths.UnboundedPathPolicy;
import com.yellowstone.kql.schema.MultiEntityPolicy;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TranslatorConfig.
 */
public class TranslatorConfigTest {

    @Test
    @DisplayName("Test default settings")
    public void testDefaults() {
        TranslatorConfig config = TranslatorConfig.defaults();
        assertEquals(TranslatorConfig.DEFAULT_MAX_PATH_DEPTH,
            config.getMaxPathDepth());
        assertEquals(UnboundedPathPolicy.ESCALATE,
            config.getUnboundedPathPolicy());
        assertEquals(MultiEntityPolicy.UNION, config.getMultiEntityPolicy());
        assertTrue(config.isCaseInsensitiveLookup());
        assertEquals(TranslatorConfig.DEFAULT_MAX_ENUMERATED_PATHS,
            config.getMaxEnumeratedPaths());
        assertEquals(CyclePolicy.FORBIDDEN, config.getDefaultCyclePolicy());
    }

    @Test
    @DisplayName("Test builder overrides")
    public void testBuilder() {
        TranslatorConfig config = TranslatorConfig.builder()
            .maxPathDepth(3)
            .unboundedPathPolicy(UnboundedPathPolicy.REJECT)
            .multiEntityPolicy(MultiEntityPolicy.PRIMARY)
            .caseInsensitiveLookup(false)
            .maxEnumeratedPaths(20)
            .defaultCyclePolicy(CyclePolicy.BOUNDED_ALLOWED)
            .build();
        assertEquals(3, config.getMaxPathDepth());
        assertEquals(UnboundedPathPolicy.REJECT,
            config.getUnboundedPathPolicy());
        assertEquals(MultiEntityPolicy.PRIMARY, config.getMultiEntityPolicy());
        assertFalse(config.isCaseInsensitiveLookup());
        assertEquals(20, config.getMaxEnumeratedPaths());
        assertEquals(CyclePolicy.BOUNDED_ALLOWED,
            config.getDefaultCyclePolicy());
    }

    @Test
    @DisplayName("Test numeric settings below 1 are rejected")
    public void testValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> TranslatorConfig.builder().maxPathDepth(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> TranslatorConfig.builder().maxEnumeratedPaths(0).build());
        assertThrows(NullPointerException.class,
            () -> TranslatorConfig.builder().multiEntityPolicy(null));
    }

    @Test
    @DisplayName("Test reading settings from environment variables")
    public void testFromEnvironment() {
        TranslatorConfig config = TranslatorConfig.fromEnvironment(Map.of(
            TranslatorConfig.ENV_MAX_PATH_DEPTH, " 7 ",
            TranslatorConfig.ENV_UNBOUNDED_PATH_POLICY, "reject",
            TranslatorConfig.ENV_MULTI_ENTITY_POLICY, "primary",
            TranslatorConfig.ENV_CASE_INSENSITIVE_LOOKUP, "false",
            TranslatorConfig.ENV_MAX_ENUMERATED_PATHS, ""));
        assertEquals(7, config.getMaxPathDepth());
        assertEquals(UnboundedPathPolicy.REJECT,
            config.getUnboundedPathPolicy());
        assertEquals(MultiEntityPolicy.PRIMARY, config.getMultiEntityPolicy());
        assertFalse(config.isCaseInsensitiveLookup());
        assertEquals(TranslatorConfig.DEFAULT_MAX_ENUMERATED_PATHS,
            config.getMaxEnumeratedPaths());
    }

    @Test
    @DisplayName("Test tracing settings from environment variables")
    public void testTracingEnvironment() {
        TranslatorConfig defaults = TranslatorConfig.fromEnvironment(Map.of());
        assertTrue(defaults.isTracingEnabled());
        assertEquals(TranslatorConfig.DEFAULT_OTLP_ENDPOINT,
            defaults.getOtlpEndpoint());
        assertEquals(TranslatorConfig.DEFAULT_SERVICE_NAME,
            defaults.getServiceName());

        TranslatorConfig config = TranslatorConfig.fromEnvironment(Map.of(
            TranslatorConfig.ENV_TRACING_ENABLED, "false",
            TranslatorConfig.ENV_OTLP_ENDPOINT, "http://jaeger:4317",
            TranslatorConfig.ENV_SERVICE_NAME, "soc-translator"));
        assertFalse(config.isTracingEnabled());
        assertEquals("http://jaeger:4317", config.getOtlpEndpoint());
        assertEquals("soc-translator", config.getServiceName());

        assertThrows(IllegalArgumentException.class,
            () -> TranslatorConfig.builder().serviceName(" ").build());
    }

    @Test
    @DisplayName("Test invalid environment values are reported by name")
    public void testInvalidEnvironment() {
        IllegalArgumentException depth = assertThrows(
            IllegalArgumentException.class,
            () -> TranslatorConfig.fromEnvironment(Map.of(
                TranslatorConfig.ENV_MAX_PATH_DEPTH, "deep")));
        assertTrue(depth.getMessage().contains(
            TranslatorConfig.ENV_MAX_PATH_DEPTH));

        IllegalArgumentException policy = assertThrows(
            IllegalArgumentException.class,
            () -> TranslatorConfig.fromEnvironment(Map.of(
                TranslatorConfig.ENV_MULTI_ENTITY_POLICY, "sometimes")));
        assertTrue(policy.getMessage().contains("sometimes"));
    }
}
