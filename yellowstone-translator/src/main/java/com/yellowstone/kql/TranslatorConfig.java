package com.yellowstone.kql;

import com.yellowstone.kql.paths.CyclePolicy;
import com.yellowstone.kql.paths.UnboundedPathPolicy;
import com.yellowstone.kql.schema.MultiEntityPolicy;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable translator settings.
 *
 * <pre>{@code
 * TranslatorConfig config = TranslatorConfig.builder()
 *     .maxPathDepth(5)
 *     .unboundedPathPolicy(UnboundedPathPolicy.REJECT)
 *     .build();
 * }</pre>
 *
 * <p>{@link #fromEnvironment()} reads the same settings from
 * {@code YELLOWSTONE_*} environment variables. Span export is configured
 * through the standard {@code OTEL_*} names.</p>
 */
public final class TranslatorConfig {

    /** Default ceiling on repetition bounds. */
    public static final int DEFAULT_MAX_PATH_DEPTH = 10;

    /** Default cap on enumerated paths. */
    public static final int DEFAULT_MAX_ENUMERATED_PATHS = 1000;

    /** Environment variable for the path depth ceiling. */
    public static final String ENV_MAX_PATH_DEPTH = "YELLOWSTONE_MAX_PATH_DEPTH";

    /** Environment variable for the unbounded path policy. */
    public static final String ENV_UNBOUNDED_PATH_POLICY =
        "YELLOWSTONE_UNBOUNDED_PATH_POLICY";

    /** Environment variable for the multi-entity policy. */
    public static final String ENV_MULTI_ENTITY_POLICY =
        "YELLOWSTONE_MULTI_ENTITY_POLICY";

    /** Environment variable toggling case-insensitive schema lookup. */
    public static final String ENV_CASE_INSENSITIVE_LOOKUP =
        "YELLOWSTONE_CASE_INSENSITIVE_LOOKUP";

    /** Environment variable for the enumerated path cap. */
    public static final String ENV_MAX_ENUMERATED_PATHS =
        "YELLOWSTONE_MAX_ENUMERATED_PATHS";

    /** Environment variable turning span export off with {@code false}. */
    public static final String ENV_TRACING_ENABLED = "OTEL_TRACING_ENABLED";

    /** Environment variable for the OTLP collector endpoint. */
    public static final String ENV_OTLP_ENDPOINT =
        "OTEL_EXPORTER_OTLP_ENDPOINT";

    /** Environment variable for the service name on exported spans. */
    public static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";

    /** Default OTLP/gRPC collector endpoint. */
    public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    /** Default service name on exported spans. */
    public static final String DEFAULT_SERVICE_NAME = "yellowstone-translator";

    private final int maxPathDepth;
    private final UnboundedPathPolicy unboundedPathPolicy;
    private final MultiEntityPolicy multiEntityPolicy;
    private final boolean caseInsensitiveLookup;
    private final int maxEnumeratedPaths;
    private final CyclePolicy defaultCyclePolicy;
    private final boolean tracingEnabled;
    private final String otlpEndpoint;
    private final String serviceName;

    private TranslatorConfig(final Builder builder) {
        this.maxPathDepth = builder.maxPathDepth;
        this.unboundedPathPolicy = builder.unboundedPathPolicy;
        this.multiEntityPolicy = builder.multiEntityPolicy;
        this.caseInsensitiveLookup = builder.caseInsensitiveLookup;
        this.maxEnumeratedPaths = builder.maxEnumeratedPaths;
        this.defaultCyclePolicy = builder.defaultCyclePolicy;
        this.tracingEnabled = builder.tracingEnabled;
        this.otlpEndpoint = builder.otlpEndpoint;
        this.serviceName = builder.serviceName;
    }

    /**
     * Configuration with every default.
     *
     * @return the default configuration
     */
    public static TranslatorConfig defaults() {
        return builder().build();
    }

    /**
     * Obtain a {@link Builder} initialized with defaults.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read the configuration from the process environment.
     *
     * @return the configuration
     * @throws IllegalArgumentException if a variable holds an invalid value
     */
    public static TranslatorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Read the configuration from a map of environment variables. Unset or
     * empty variables keep their defaults.
     *
     * @param env the variables
     * @return the configuration
     * @throws IllegalArgumentException if a variable holds an invalid value
     */
    public static TranslatorConfig fromEnvironment(
            final Map<String, String> env) {
        Builder builder = builder();
        String value = env.get(ENV_MAX_PATH_DEPTH);
        if (isSet(value)) {
            builder.maxPathDepth(parseInt(ENV_MAX_PATH_DEPTH, value));
        }
        value = env.get(ENV_UNBOUNDED_PATH_POLICY);
        if (isSet(value)) {
            builder.unboundedPathPolicy(parseEnum(UnboundedPathPolicy.class,
                ENV_UNBOUNDED_PATH_POLICY, value));
        }
        value = env.get(ENV_MULTI_ENTITY_POLICY);
        if (isSet(value)) {
            builder.multiEntityPolicy(parseEnum(MultiEntityPolicy.class,
                ENV_MULTI_ENTITY_POLICY, value));
        }
        value = env.get(ENV_CASE_INSENSITIVE_LOOKUP);
        if (isSet(value)) {
            builder.caseInsensitiveLookup(Boolean.parseBoolean(value.trim()));
        }
        value = env.get(ENV_MAX_ENUMERATED_PATHS);
        if (isSet(value)) {
            builder.maxEnumeratedPaths(parseInt(ENV_MAX_ENUMERATED_PATHS,
                value));
        }
        value = env.get(ENV_TRACING_ENABLED);
        if (isSet(value)) {
            builder.tracingEnabled(Boolean.parseBoolean(value.trim()));
        }
        value = env.get(ENV_OTLP_ENDPOINT);
        if (isSet(value)) {
            builder.otlpEndpoint(value.trim());
        }
        value = env.get(ENV_SERVICE_NAME);
        if (isSet(value)) {
            builder.serviceName(value.trim());
        }
        return builder.build();
    }

    private static boolean isSet(final String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInt(final String name, final String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name
                + " must be an integer, got '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(final Class<E> type,
            final String name, final String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT)
                .replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(name + " has unknown value '"
                + value + "'", e);
        }
    }

    /**
     * Ceiling on the maximum of a bounded repetition.
     *
     * @return the ceiling
     */
    public int getMaxPathDepth() {
        return maxPathDepth;
    }

    /**
     * Handling of unbounded MATCH relationships.
     *
     * @return the policy
     */
    public UnboundedPathPolicy getUnboundedPathPolicy() {
        return unboundedPathPolicy;
    }

    /**
     * Handling of labels and types backed by several tables.
     *
     * @return the policy
     */
    public MultiEntityPolicy getMultiEntityPolicy() {
        return multiEntityPolicy;
    }

    /**
     * Whether schema lookups fall back to case-insensitive matching.
     *
     * @return true when enabled
     */
    public boolean isCaseInsensitiveLookup() {
        return caseInsensitiveLookup;
    }

    /**
     * Default cap on paths returned by path enumeration.
     *
     * @return the cap
     */
    public int getMaxEnumeratedPaths() {
        return maxEnumeratedPaths;
    }

    /**
     * Cycle policy used when enumeration options name none.
     *
     * @return the policy
     */
    public CyclePolicy getDefaultCyclePolicy() {
        return defaultCyclePolicy;
    }

    /**
     * Whether spans are exported.
     *
     * @return false for a no-op tracer
     */
    public boolean isTracingEnabled() {
        return tracingEnabled;
    }

    /**
     * OTLP/gRPC collector receiving exported spans.
     *
     * @return the endpoint URL
     */
    public String getOtlpEndpoint() {
        return otlpEndpoint;
    }

    /**
     * Service name attached to exported spans.
     *
     * @return the name
     */
    public String getServiceName() {
        return serviceName;
    }

    @Override
    public String toString() {
        return "TranslatorConfig{maxPathDepth=" + maxPathDepth
            + ", unboundedPathPolicy=" + unboundedPathPolicy
            + ", multiEntityPolicy=" + multiEntityPolicy
            + ", caseInsensitiveLookup=" + caseInsensitiveLookup
            + ", maxEnumeratedPaths=" + maxEnumeratedPaths
            + ", defaultCyclePolicy=" + defaultCyclePolicy
            + ", tracingEnabled=" + tracingEnabled
            + ", otlpEndpoint=" + otlpEndpoint
            + ", serviceName=" + serviceName + "}";
    }

    /**
     * Builder for {@link TranslatorConfig}.
     */
    public static final class Builder {
        /** Ceiling on bounded repetition. */
        private int maxPathDepth = DEFAULT_MAX_PATH_DEPTH;
        /** Handling of unbounded repetition. */
        private UnboundedPathPolicy unboundedPathPolicy =
            UnboundedPathPolicy.ESCALATE;
        /** Handling of multi-table labels and types. */
        private MultiEntityPolicy multiEntityPolicy = MultiEntityPolicy.UNION;
        /** Case-insensitive schema lookup fallback. */
        private boolean caseInsensitiveLookup = true;
        /** Cap on enumerated paths. */
        private int maxEnumeratedPaths = DEFAULT_MAX_ENUMERATED_PATHS;
        /** Cycle policy for path enumeration. */
        private CyclePolicy defaultCyclePolicy = CyclePolicy.FORBIDDEN;
        /** Span export switch. */
        private boolean tracingEnabled = true;
        private String otlpEndpoint = DEFAULT_OTLP_ENDPOINT;
        private String serviceName = DEFAULT_SERVICE_NAME;

        private Builder() {
        }

        /**
         * Set the ceiling on bounded repetition.
         *
         * @param value the ceiling, at least 1
         * @return this builder
         */
        public Builder maxPathDepth(final int value) {
            this.maxPathDepth = value;
            return this;
        }

        /**
         * Set the handling of unbounded repetition.
         *
         * @param value the policy
         * @return this builder
         */
        public Builder unboundedPathPolicy(final UnboundedPathPolicy value) {
            this.unboundedPathPolicy = Objects.requireNonNull(value);
            return this;
        }

        /**
         * Set the handling of labels backed by several tables.
         *
         * @param value the policy
         * @return this builder
         */
        public Builder multiEntityPolicy(final MultiEntityPolicy value) {
            this.multiEntityPolicy = Objects.requireNonNull(value);
            return this;
        }

        /**
         * Enable or disable the case-insensitive lookup fallback.
         *
         * @param value whether to enable it
         * @return this builder
         */
        public Builder caseInsensitiveLookup(final boolean value) {
            this.caseInsensitiveLookup = value;
            return this;
        }

        /**
         * Set the default cap on enumerated paths.
         *
         * @param value the cap, at least 1
         * @return this builder
         */
        public Builder maxEnumeratedPaths(final int value) {
            this.maxEnumeratedPaths = value;
            return this;
        }

        /**
         * Set the default cycle policy for path enumeration.
         *
         * @param value the policy
         * @return this builder
         */
        public Builder defaultCyclePolicy(final CyclePolicy value) {
            this.defaultCyclePolicy = Objects.requireNonNull(value);
            return this;
        }

        /**
         * Enable or disable span export.
         *
         * @param value whether to export spans
         * @return this builder
         */
        public Builder tracingEnabled(final boolean value) {
            this.tracingEnabled = value;
            return this;
        }

        /**
         * Set the OTLP/gRPC collector endpoint.
         *
         * @param value the endpoint URL
         * @return this builder
         */
        public Builder otlpEndpoint(final String value) {
            this.otlpEndpoint = Objects.requireNonNull(value);
            return this;
        }

        /**
         * Set the service name attached to exported spans.
         *
         * @param value the name
         * @return this builder
         */
        public Builder serviceName(final String value) {
            this.serviceName = Objects.requireNonNull(value);
            return this;
        }

        /**
         * Build the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if a numeric setting is below 1
         *         or a tracing setting is blank
         */
        public TranslatorConfig build() {
            if (maxPathDepth < 1) {
                throw new IllegalArgumentException(
                    "maxPathDepth must be at least 1: " + maxPathDepth);
            }
            if (maxEnumeratedPaths < 1) {
                throw new IllegalArgumentException(
                    "maxEnumeratedPaths must be at least 1: "
                        + maxEnumeratedPaths);
            }
            if (otlpEndpoint.isBlank() || serviceName.isBlank()) {
                throw new IllegalArgumentException(
                    "otlpEndpoint and serviceName must not be blank");
            }
            return new TranslatorConfig(this);
        }
    }
}
