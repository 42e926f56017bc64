package com.yellowstone.kql.translate;

import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.CypherText;
import com.yellowstone.kql.ast.MatchClause;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.OrderItem;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PropertyAccess;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.ast.ReturnItem;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.error.UnboundIdentifierException;
import com.yellowstone.kql.error.UnresolvedSchemaReferenceException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.schema.BackingEntityRef;
import com.yellowstone.kql.schema.EntityKind;
import com.yellowstone.kql.schema.SchemaMapper;
import com.yellowstone.kql.visitor.DefaultAstVisitor;
import com.yellowstone.kql.visitor.IdentifierCollector;
import com.yellowstone.kql.visitor.IdentifierCollector.VariableKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves every label, relationship type and property of a query against
 * the schema and produces the {@link TranslationContext} used by the clause
 * translators.
 *
 * <h2>Rules:</h2>
 * <ul>
 *   <li>A variable collects the labels of every pattern that binds it; all of
 *       them must resolve to the same tables.</li>
 *   <li>A label or type backed by several tables is handled by the configured
 *       {@link com.yellowstone.kql.schema.MultiEntityPolicy}; UNION and
 *       PRIMARY are recorded as approximations.</li>
 *   <li>Anonymous patterns with property maps get generated variables
 *       ({@code _n0}, {@code _r0}, ...) in source order.</li>
 *   <li>Properties of unlabeled variables resolve only when unique across
 *       the schema.</li>
 * </ul>
 */
public final class SchemaResolver {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SchemaResolver.class);

    private final SchemaMapper mapper;
    private final TranslatorConfig config;
    private final boolean caseInsensitive;

    private final Map<String, VariableKind> kinds = new LinkedHashMap<>();
    private final Map<String, List<String>> labels = new LinkedHashMap<>();
    private final Map<String, List<BackingEntityRef>> entities =
        new LinkedHashMap<>();
    private final Set<String> generated = new HashSet<>();
    private final Set<String> reservedNames;
    private final IdentityHashMap<NodePattern, String> nodeVariables =
        new IdentityHashMap<>();
    private final IdentityHashMap<NodePattern, List<BackingEntityRef>>
        nodeEntities = new IdentityHashMap<>();
    private final IdentityHashMap<RelationshipPattern, String>
        relationshipVariables = new IdentityHashMap<>();
    private final IdentityHashMap<RelationshipPattern, List<BackingEntityRef>>
        relationshipEntities = new IdentityHashMap<>();
    private final Map<String, String> physicalProperties =
        new LinkedHashMap<>();
    private final Set<String> approximations = new LinkedHashSet<>();
    private final Set<String> secondAttempts = new LinkedHashSet<>();
    private int nextNode;
    private int nextRelationship;

    private SchemaResolver(final SchemaMapper mapper,
            final TranslatorConfig config, final Set<String> reservedNames) {
        this.mapper = mapper;
        this.config = config;
        this.caseInsensitive = config.isCaseInsensitiveLookup();
        this.reservedNames = reservedNames;
    }

    /**
     * Resolve a query.
     *
     * @param query a structurally valid query
     * @param mapper the schema
     * @param config the configuration
     * @return the context
     * @throws TranslationException if a reference does not resolve or the
     *         multi-entity policy rejects it
     */
    public static TranslationContext resolve(final Query query,
            final SchemaMapper mapper, final TranslatorConfig config)
            throws TranslationException {
        IdentifierCollector ids = IdentifierCollector.collect(query);
        Set<String> reserved = new HashSet<>(ids.getBindings().keySet());
        reserved.addAll(ids.getAliases());
        SchemaResolver resolver = new SchemaResolver(mapper, config, reserved);
        for (MatchClause clause : query.matchClauses()) {
            for (PathExpression path : clause.paths()) {
                resolver.bindPath(path);
            }
        }
        for (MatchClause clause : query.matchClauses()) {
            for (PathExpression path : clause.paths()) {
                resolver.resolvePatternProperties(path);
            }
        }
        for (Map.Entry<PropertyAccess, String> access
                : PropertyAccessCollector.collect(query).entrySet()) {
            resolver.resolveAccess(access.getKey(), access.getValue());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Resolved {} bindings and {} properties",
                resolver.kinds.size(), resolver.physicalProperties.size());
        }
        return resolver.context();
    }

    private TranslationContext context() {
        Map<String, VariableBinding> bindings = new LinkedHashMap<>();
        kinds.forEach((name, kind) -> bindings.put(name, new VariableBinding(
            name, kind, labels.getOrDefault(name, List.of()),
            entities.getOrDefault(name, List.of()),
            generated.contains(name))));
        return new TranslationContext(mapper, config, bindings, nodeVariables,
            nodeEntities, relationshipVariables, relationshipEntities,
            physicalProperties, new ArrayList<>(approximations),
            new ArrayList<>(secondAttempts));
    }

    private void bindPath(final PathExpression path)
            throws TranslationException {
        if (path.pathVariable() != null) {
            kinds.putIfAbsent(path.pathVariable(), VariableKind.PATH);
        }
        for (NodePattern node : path.nodes()) {
            bindNode(node);
        }
        for (RelationshipPattern rel : path.relationships()) {
            bindRelationship(rel);
        }
    }

    private void bindNode(final NodePattern node) throws TranslationException {
        List<BackingEntityRef> raw = new ArrayList<>();
        for (String label : node.labels()) {
            SchemaMapper.Resolution<List<BackingEntityRef>> resolution =
                mapper.lookupLabel(label, caseInsensitive);
            noteSecondAttempt(resolution, "label");
            raw = merge(raw, resolution.value(), CypherText.of(node),
                node.position());
        }
        String name = node.variable();
        if (name == null && !node.properties().isEmpty()) {
            name = generateName("_n", true);
            nodeVariables.put(node, name);
        }
        if (name != null) {
            bindVariable(name, VariableKind.NODE, node.labels(), raw,
                CypherText.of(node), node.position());
        }
        if (!raw.isEmpty()) {
            nodeEntities.put(node, applyPolicy(raw, CypherText.of(node),
                node.position()));
        }
    }

    private void bindRelationship(final RelationshipPattern rel)
            throws TranslationException {
        List<BackingEntityRef> raw = new ArrayList<>();
        for (String type : rel.types()) {
            SchemaMapper.Resolution<List<BackingEntityRef>> resolution =
                mapper.lookupRelationshipType(type, caseInsensitive);
            noteSecondAttempt(resolution, "relationship type");
            for (BackingEntityRef ref : resolution.value()) {
                if (!raw.contains(ref)) {
                    raw.add(ref);
                }
            }
        }
        String name = rel.variable();
        if (name == null && !rel.properties().isEmpty()) {
            name = generateName("_r", false);
            relationshipVariables.put(rel, name);
        }
        if (name != null) {
            kinds.putIfAbsent(name, VariableKind.RELATIONSHIP);
            labels.computeIfAbsent(name, k -> new ArrayList<>())
                .addAll(rel.types());
            entities.put(name, raw);
        }
        if (!raw.isEmpty()) {
            relationshipEntities.put(rel, applyTypePolicy(rel, raw));
        }
    }

    /*
     * Alternative relationship types are a union by construction; only a
     * single type backed by several tables counts as an approximation.
     */
    private List<BackingEntityRef> applyTypePolicy(
            final RelationshipPattern rel, final List<BackingEntityRef> raw)
            throws UnsupportedPatternException {
        List<BackingEntityRef> rendered = new ArrayList<>();
        for (String type : rel.types()) {
            List<BackingEntityRef> ofType = new ArrayList<>();
            for (BackingEntityRef ref : raw) {
                if (ref.logicalName().equalsIgnoreCase(type)) {
                    ofType.add(ref);
                }
            }
            for (BackingEntityRef ref : applyPolicy(ofType,
                    CypherText.of(rel), rel.position())) {
                if (!rendered.contains(ref)) {
                    rendered.add(ref);
                }
            }
        }
        return rendered;
    }

    private List<BackingEntityRef> merge(final List<BackingEntityRef> current,
            final List<BackingEntityRef> next, final String pattern,
            final int position) throws UnsupportedPatternException {
        if (current.isEmpty()) {
            return new ArrayList<>(next);
        }
        if (!tables(current).equals(tables(next))) {
            throw new UnsupportedPatternException("Labels of " + pattern
                + " resolve to different tables " + tables(current) + " and "
                + tables(next), UnsupportedPatternException.CONFLICTING_LABELS,
                pattern, position);
        }
        List<BackingEntityRef> merged = new ArrayList<>(current);
        merged.addAll(next);
        return merged;
    }

    private static List<String> tables(final List<BackingEntityRef> refs) {
        List<String> tables = new ArrayList<>();
        for (BackingEntityRef ref : refs) {
            if (!tables.contains(ref.entityId())) {
                tables.add(ref.entityId());
            }
        }
        return tables;
    }

    private void bindVariable(final String name, final VariableKind kind,
            final List<String> patternLabels,
            final List<BackingEntityRef> raw, final String pattern,
            final int position) throws UnsupportedPatternException {
        kinds.putIfAbsent(name, kind);
        List<String> known = labels.computeIfAbsent(name,
            k -> new ArrayList<>());
        for (String label : patternLabels) {
            if (!known.contains(label)) {
                known.add(label);
            }
        }
        List<BackingEntityRef> existing = entities.get(name);
        if (existing == null || existing.isEmpty()) {
            entities.put(name, raw);
        } else if (!raw.isEmpty()) {
            entities.put(name, merge(existing, raw, pattern, position));
        }
    }

    private List<BackingEntityRef> applyPolicy(
            final List<BackingEntityRef> raw, final String pattern,
            final int position) throws UnsupportedPatternException {
        List<String> tables = tables(raw);
        if (tables.size() <= 1) {
            return raw.isEmpty() ? raw : List.of(raw.get(0));
        }
        String name = raw.get(0).logicalName();
        switch (config.getMultiEntityPolicy()) {
            case REJECT -> throw new UnsupportedPatternException("'" + name
                + "' is backed by several tables " + tables
                + " and the multi-entity policy is REJECT",
                UnsupportedPatternException.MULTI_ENTITY, pattern, position);
            case PRIMARY -> {
                approximations.add("'" + name + "' is backed by " + tables
                    + "; only " + tables.get(0) + " is queried");
                return List.of(raw.get(0));
            }
            default -> {
                approximations.add("'" + name + "' is backed by " + tables
                    + "; rendered as a union of all of them");
                List<BackingEntityRef> distinct = new ArrayList<>();
                for (BackingEntityRef ref : raw) {
                    if (distinct.stream().noneMatch(d ->
                            d.entityId().equals(ref.entityId()))) {
                        distinct.add(ref);
                    }
                }
                return distinct;
            }
        }
    }

    private String generateName(final String prefix, final boolean node) {
        String name;
        do {
            name = prefix + (node ? nextNode++ : nextRelationship++);
        } while (reservedNames.contains(name) || kinds.containsKey(name));
        generated.add(name);
        return name;
    }

    private void noteSecondAttempt(final SchemaMapper.Resolution<?> resolution,
            final String what) {
        if (resolution.secondAttempt()) {
            secondAttempts.add(what + " '" + resolution.requested()
                + "' matched '" + resolution.matchedName()
                + "' ignoring case");
        }
    }

    private void resolvePatternProperties(final PathExpression path)
            throws TranslationException {
        for (NodePattern node : path.nodes()) {
            String variable = node.variable() != null ? node.variable()
                : nodeVariables.get(node);
            for (String property : node.properties().keySet()) {
                resolveProperty(variable, property, node.position());
            }
        }
        for (RelationshipPattern rel : path.relationships()) {
            String variable = rel.variable() != null ? rel.variable()
                : relationshipVariables.get(rel);
            for (String property : rel.properties().keySet()) {
                resolveProperty(variable, property, rel.position());
            }
        }
    }

    private void resolveAccess(final PropertyAccess access,
            final String clause) throws TranslationException {
        if (!kinds.containsKey(access.variable())) {
            throw new UnboundIdentifierException(access.variable(),
                clause, access.position());
        }
        resolveProperty(access.variable(), access.property(),
            access.position());
    }

    private void resolveProperty(final String variable, final String property,
            final int position) throws TranslationException {
        String key = TranslationContext.propertyKey(variable, property);
        if (physicalProperties.containsKey(key)) {
            return;
        }
        VariableKind kind = kinds.get(variable);
        if (kind == VariableKind.PATH) {
            throw new UnsupportedPatternException("Path variable '" + variable
                + "' has no property '" + property + "'",
                UnsupportedPatternException.PATH_PROPERTY,
                variable + "." + property, position);
        }
        List<BackingEntityRef> refs = entities.getOrDefault(variable,
            List.of());
        SchemaMapper.Resolution<SchemaMapper.ResolvedProperty> resolution;
        if (refs.isEmpty()) {
            resolution = mapper.resolveUnlabeledProperty(
                kind == VariableKind.NODE ? EntityKind.NODE
                    : EntityKind.RELATIONSHIP, property, caseInsensitive);
        } else {
            resolution = mapper.lookupProperty(refs, property,
                caseInsensitive);
        }
        noteSecondAttempt(resolution, "property");
        physicalProperties.put(key, resolution.value().physicalName());
    }

    /** Collects property accesses outside MATCH. */
    private static final class PropertyAccessCollector
            extends DefaultAstVisitor<Void> {

        private final Map<PropertyAccess, String> accesses =
            new LinkedHashMap<>();

        private String clause;

        static Map<PropertyAccess, String> collect(final Query query) {
            PropertyAccessCollector collector = new PropertyAccessCollector();
            if (query.whereClause() != null) {
                collector.clause = "WHERE";
                query.whereClause().accept(collector);
            }
            collector.clause = "RETURN";
            for (ReturnItem item : query.returnClause().items()) {
                item.accept(collector);
            }
            collector.clause = "ORDER BY";
            for (OrderItem item : query.returnClause().orderBy()) {
                item.accept(collector);
            }
            return collector.accesses;
        }

        @Override
        public Void visitPropertyAccess(final PropertyAccess access) {
            accesses.putIfAbsent(access, clause);
            return null;
        }
    }
}
