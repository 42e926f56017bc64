package com.yellowstone.kql.tracing;

import com.yellowstone.kql.TranslatorConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide tracing for the translator.
 *
 * <p>Tracing is set up once from a {@link TranslatorConfig}: its tracing
 * switch, OTLP endpoint and service name. An application installs it
 * explicitly with {@link #install(TranslatorConfig)}; otherwise the first
 * tracer lookup installs it from {@link TranslatorConfig#fromEnvironment()}.
 * Call {@link #shutdown()} before exit to flush batched spans.</p>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Instrumentation scope for query translation. */
    public static final String SCOPE_TRANSLATOR =
        "com.yellowstone.kql.CypherToKqlTranslator";

    /** Instrumentation scope for schema loading. */
    public static final String SCOPE_SCHEMA =
        "com.yellowstone.kql.schema.SchemaLoader";

    /** Instrumentation scope for path algorithm rendering. */
    public static final String SCOPE_PATHS = "com.yellowstone.kql.paths";

    private static volatile OpenTelemetry installed;

    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * Install tracing for the process. The first installation wins; later
     * calls return it unchanged.
     *
     * @param config the settings
     * @return the installed instance
     */
    public static synchronized OpenTelemetry install(
            final TranslatorConfig config) {
        if (installed != null) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Tracing already installed, ignoring {}", config);
            }
            return installed;
        }
        installed = create(config);
        return installed;
    }

    /**
     * Get a tracer for an instrumentation scope, installing tracing from the
     * environment if nothing was installed yet.
     *
     * @param scopeName the scope name, one of the {@code SCOPE_*} constants
     * @return the tracer
     */
    public static Tracer getTracer(final String scopeName) {
        OpenTelemetry openTelemetry = installed;
        if (openTelemetry == null) {
            openTelemetry = install(TranslatorConfig.fromEnvironment());
        }
        return openTelemetry.getTracer(scopeName);
    }

    /**
     * Build an OpenTelemetry instance without installing it: a no-op when
     * tracing is disabled, an OTLP/gRPC exporting SDK otherwise.
     *
     * @param config the settings
     * @return the instance
     */
    public static OpenTelemetry create(final TranslatorConfig config) {
        if (!config.isTracingEnabled()) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("OpenTelemetry tracing is disabled");
            }
            return OpenTelemetry.noop();
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Exporting spans of {} to {}", config.getServiceName(),
                config.getOtlpEndpoint());
        }
        OtlpGrpcSpanExporter exporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(config.getOtlpEndpoint())
            .build();
        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider(config,
                BatchSpanProcessor.builder(exporter).build()))
            .setPropagators(ContextPropagators.create(
                W3CTraceContextPropagator.getInstance()))
            .build();
    }

    /**
     * Tracer provider tagging every span with the configured service name.
     *
     * @param config the settings
     * @param processor receives ended spans
     * @return the provider
     */
    static SdkTracerProvider tracerProvider(final TranslatorConfig config,
            final SpanProcessor processor) {
        Resource resource = Resource.getDefault()
            .merge(Resource.create(Attributes.of(
                ServiceAttributes.SERVICE_NAME, config.getServiceName())));
        return SdkTracerProvider.builder()
            .addSpanProcessor(processor)
            .setResource(resource)
            .build();
    }

    /**
     * Flush and shut down installed tracing, if it exports spans.
     */
    public static void shutdown() {
        if (installed instanceof OpenTelemetrySdk sdk) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Shutting down OpenTelemetry SDK");
            }
            sdk.getSdkTracerProvider().shutdown();
        }
    }
}
