package com.yellowstone.kql;

import com.yellowstone.kql.schema.SchemaLoadException;
import com.yellowstone.kql.schema.SchemaLoader;
import com.yellowstone.kql.schema.SchemaMapper;

/**
 * Shared schema fixtures for translator tests.
 */
public final class TestSchemas {

    /** Classpath location of the small test graph. */
    public static final String TEST_SCHEMA = "/test_schema.yaml";

    private TestSchemas() {
        throw new AssertionError("No instances");
    }

    /**
     * Load the test graph: User, Device and Alert nodes joined by KNOWS,
     * LOGGED_IN and RAISED.
     *
     * @return the mapper
     */
    public static SchemaMapper testSchema() {
        try {
            return SchemaLoader.loadResource(TEST_SCHEMA);
        } catch (SchemaLoadException e) {
            throw new IllegalStateException("Test schema failed to load", e);
        }
    }
}
