package com.yellowstone.kql.schema;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.yellowstone.kql.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads schema documents and builds validated {@link SchemaMapper}s.
 *
 * <p>Documents are YAML; JSON documents parse too since YAML is a superset
 * of JSON. Unknown keys are ignored.</p>
 *
 * <pre>{@code
 * SchemaMapper mapper = SchemaLoader.loadDefault();
 * SchemaMapper custom = SchemaLoader.load(Path.of("schema.yaml"));
 * }</pre>
 */
public final class SchemaLoader {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SchemaLoader.class);

    /** Classpath resource of the bundled Sentinel schema. */
    public static final String DEFAULT_SCHEMA_RESOURCE =
        "/default_sentinel_schema.yaml";

    private static final Tracer TRACER = TracingUtil.getTracer(
        TracingUtil.SCOPE_SCHEMA);

    private static final AttributeKey<String> ATTR_SOURCE =
        AttributeKey.stringKey("yellowstone.schema.source");

    private static final AttributeKey<String> ATTR_VERSION =
        AttributeKey.stringKey("yellowstone.schema.version");

    private static final AttributeKey<Long> ATTR_WARNING_COUNT =
        AttributeKey.longKey("yellowstone.schema.warning_count");

    private static final ObjectMapper MAPPER = new ObjectMapper(
        new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private SchemaLoader() {
        throw new AssertionError("No instances");
    }

    /**
     * Load the bundled default schema.
     *
     * @return the mapper
     * @throws SchemaLoadException if the resource is missing or invalid
     */
    public static SchemaMapper loadDefault() throws SchemaLoadException {
        return loadResource(DEFAULT_SCHEMA_RESOURCE);
    }

    /**
     * Load a schema from the classpath.
     *
     * @param resource absolute resource path
     * @return the mapper
     * @throws SchemaLoadException if the resource is missing or invalid
     */
    public static SchemaMapper loadResource(final String resource)
            throws SchemaLoadException {
        try (InputStream in = SchemaLoader.class.getResourceAsStream(
                resource)) {
            if (in == null) {
                throw new SchemaLoadException("Schema resource not found: "
                    + resource, (Throwable) null);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema resource "
                + resource, e);
        }
    }

    /**
     * Load a schema file.
     *
     * @param path the file
     * @return the mapper
     * @throws SchemaLoadException if the file cannot be read or is invalid
     */
    public static SchemaMapper load(final Path path)
            throws SchemaLoadException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema file "
                + path, e);
        }
    }

    /**
     * Load a schema from a stream. The stream is not closed.
     *
     * @param in the document
     * @param sourceName name used in messages and spans
     * @return the mapper
     * @throws SchemaLoadException if the document is malformed or invalid
     */
    public static SchemaMapper load(final InputStream in,
            final String sourceName) throws SchemaLoadException {
        Span span = TRACER.spanBuilder("SchemaLoader.load")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_SOURCE, sourceName)
            .startSpan();
        try (Scope scope = span.makeCurrent()) {
            SchemaDocument document = read(in, sourceName);
            SchemaMapper mapper = fromDocument(document, sourceName);
            span.setAttribute(ATTR_VERSION, String.valueOf(document.version()));
            span.setStatus(StatusCode.OK);
            return mapper;
        } catch (SchemaLoadException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Load a schema from YAML text.
     *
     * @param yaml the document text
     * @return the mapper
     * @throws SchemaLoadException if the document is malformed or invalid
     */
    public static SchemaMapper fromYaml(final String yaml)
            throws SchemaLoadException {
        SchemaDocument document;
        try {
            document = MAPPER.readValue(yaml, SchemaDocument.class);
        } catch (JacksonException e) {
            throw new SchemaLoadException("Malformed schema document: "
                + e.getOriginalMessage(), e);
        }
        return fromDocument(document, "inline");
    }

    /**
     * Validate a document and build a mapper from it.
     *
     * @param document the document
     * @param sourceName name used in messages
     * @return the mapper
     * @throws SchemaLoadException if validation reports errors
     */
    public static SchemaMapper fromDocument(final SchemaDocument document,
            final String sourceName) throws SchemaLoadException {
        if (document == null) {
            throw new SchemaLoadException("Empty schema document "
                + sourceName, (Throwable) null);
        }
        SchemaValidator.ValidationResult result =
            SchemaValidator.validate(document);
        Span.current().setAttribute(ATTR_WARNING_COUNT,
            (long) result.warnings().size());
        if (LOGGER.isWarnEnabled()) {
            for (String warning : result.warnings()) {
                LOGGER.warn("Schema {}: {}", sourceName, warning);
            }
        }
        if (!result.isValid()) {
            throw new SchemaLoadException("Invalid schema " + sourceName,
                result.errors());
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Loaded schema {} version {}: {} labels, {} "
                + "relationship types, {} tables", sourceName,
                document.version(), result.nodeCount(), result.edgeCount(),
                result.tableCount());
        }
        return new SchemaMapper(document);
    }

    private static SchemaDocument read(final InputStream in,
            final String sourceName) throws SchemaLoadException {
        try {
            return MAPPER.readValue(in, SchemaDocument.class);
        } catch (JacksonException e) {
            throw new SchemaLoadException("Malformed schema document "
                + sourceName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema document "
                + sourceName, e);
        }
    }
}
