/**
 * OpenTelemetry tracing for the translator.
 *
 * <p>Spans are recorded around query translation, schema loading and path
 * searches, and exported via the OTLP protocol to a collector such as
 * Jaeger. Setting {@code OTEL_TRACING_ENABLED=false} switches to a no-op
 * implementation.</p>
 *
 * @see com.yellowstone.kql.tracing.TracingUtil
 */
package com.yellowstone.kql.tracing;
