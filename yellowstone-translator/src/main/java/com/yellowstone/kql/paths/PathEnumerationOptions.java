package com.yellowstone.kql.paths;

import com.yellowstone.kql.ast.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Limits and filters for path enumeration.
 *
 * <p>Unset limits fall back to the translator configuration: the
 * enumerated path cap, the maximum path depth and the default cycle
 * policy.</p>
 *
 * <pre>{@code
 * PathEnumerationOptions options = PathEnumerationOptions.builder()
 *     .maxPaths(50)
 *     .maxDepth(4)
 *     .excludeNodeLabels("Device")
 *     .build();
 * }</pre>
 */
public final class PathEnumerationOptions {

    private final Integer maxPaths;
    private final Integer maxDepth;
    private final int minDepth;
    private final List<String> excludedNodeLabels;
    private final List<String> excludedRelationshipTypes;
    private final Expression predicate;
    private final String rawPredicate;
    private final CyclePolicy cyclePolicy;

    private PathEnumerationOptions(final Builder builder) {
        this.maxPaths = builder.maxPaths;
        this.maxDepth = builder.maxDepth;
        this.minDepth = builder.minDepth;
        this.excludedNodeLabels = List.copyOf(builder.excludedNodeLabels);
        this.excludedRelationshipTypes = List.copyOf(
            builder.excludedRelationshipTypes);
        this.predicate = builder.predicate;
        this.rawPredicate = builder.rawPredicate;
        this.cyclePolicy = builder.cyclePolicy;
    }

    /**
     * Options with every limit taken from the configuration.
     *
     * @return the options
     */
    public static PathEnumerationOptions defaults() {
        return builder().build();
    }

    /**
     * Start building options.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Cap on returned paths.
     *
     * @return the cap, or null for the configured cap
     */
    public Integer getMaxPaths() {
        return maxPaths;
    }

    /**
     * Maximum hops per path.
     *
     * @return the depth, or null for the configured ceiling
     */
    public Integer getMaxDepth() {
        return maxDepth;
    }

    /**
     * Minimum hops per path.
     *
     * @return the minimum
     */
    public int getMinDepth() {
        return minDepth;
    }

    /**
     * Labels no intermediate node may carry.
     *
     * @return the labels
     */
    public List<String> getExcludedNodeLabels() {
        return excludedNodeLabels;
    }

    /**
     * Relationship types no traversed edge may have.
     *
     * @return the types
     */
    public List<String> getExcludedRelationshipTypes() {
        return excludedRelationshipTypes;
    }

    /**
     * Extra condition over the path variables.
     *
     * @return the condition, or null
     */
    public Expression getPredicate() {
        return predicate;
    }

    /**
     * Extra condition in target syntax, passed through as is.
     *
     * @return the condition text, or null
     */
    public String getRawPredicate() {
        return rawPredicate;
    }

    /**
     * Whether paths may revisit nodes.
     *
     * @return the policy, or null for the configured default
     */
    public CyclePolicy getCyclePolicy() {
        return cyclePolicy;
    }

    /** Builder for {@link PathEnumerationOptions}. */
    public static final class Builder {

        private Integer maxPaths;
        private Integer maxDepth;
        private int minDepth = 1;
        private final List<String> excludedNodeLabels = new ArrayList<>();
        private final List<String> excludedRelationshipTypes =
            new ArrayList<>();
        private Expression predicate;
        private String rawPredicate;
        private CyclePolicy cyclePolicy;

        private Builder() {
        }

        /**
         * Set the cap on returned paths.
         *
         * @param value the cap, positive
         * @return this builder
         */
        public Builder maxPaths(final int value) {
            this.maxPaths = value;
            return this;
        }

        /**
         * Set the maximum hops per path.
         *
         * @param value the depth, positive
         * @return this builder
         */
        public Builder maxDepth(final int value) {
            this.maxDepth = value;
            return this;
        }

        /**
         * Set the minimum hops per path.
         *
         * @param value the minimum, non-negative
         * @return this builder
         */
        public Builder minDepth(final int value) {
            this.minDepth = value;
            return this;
        }

        /**
         * Exclude intermediate nodes carrying any of these labels.
         *
         * @param labels the labels
         * @return this builder
         */
        public Builder excludeNodeLabels(final String... labels) {
            excludedNodeLabels.addAll(Arrays.asList(labels));
            return this;
        }

        /**
         * Exclude edges of any of these relationship types.
         *
         * @param types the types
         * @return this builder
         */
        public Builder excludeRelationshipTypes(final String... types) {
            excludedRelationshipTypes.addAll(Arrays.asList(types));
            return this;
        }

        /**
         * Add a condition over the endpoint and edge variables.
         *
         * @param value the condition
         * @return this builder
         */
        public Builder predicate(final Expression value) {
            this.predicate = value;
            return this;
        }

        /**
         * Add a condition written in target syntax.
         *
         * @param value the condition text
         * @return this builder
         */
        public Builder rawPredicate(final String value) {
            this.rawPredicate = value;
            return this;
        }

        /**
         * Set whether paths may revisit nodes.
         *
         * @param value the policy
         * @return this builder
         */
        public Builder cyclePolicy(final CyclePolicy value) {
            this.cyclePolicy = value;
            return this;
        }

        /**
         * Build the options.
         *
         * @return the options
         * @throws IllegalArgumentException if both predicate forms are set
         */
        public PathEnumerationOptions build() {
            if (predicate != null && rawPredicate != null) {
                throw new IllegalArgumentException(
                    "Set either a predicate or a raw predicate, not both");
            }
            return new PathEnumerationOptions(this);
        }
    }
}
