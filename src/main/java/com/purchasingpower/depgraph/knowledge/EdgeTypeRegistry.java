package com.purchasingpower.depgraph.knowledge;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of known edge types and their inference flags.
 *
 * <p>Seeded with the core types emitted by extraction; custom types may be
 * added at runtime. Unknown types are still legal on edges, they simply have
 * no transitive or inheritable behaviour.
 *
 * @since 2.0.0
 */
@Slf4j
@Component
public class EdgeTypeRegistry {

    public static final String EXTENDS = "extends";
    public static final String IMPLEMENTS = "implements";

    private final Map<String, EdgeTypeDefinition> definitions = new ConcurrentHashMap<>();

    public EdgeTypeRegistry() {
        coreTypes().forEach(definition -> definitions.put(definition.getType(), definition));
    }

    public void register(EdgeTypeDefinition definition) {
        Preconditions.checkNotNull(definition, "definition");
        Preconditions.checkArgument(definition.getType() != null && !definition.getType().isBlank(),
                "Edge type name is required");
        definitions.put(definition.getType(), definition);
        log.info("Registered edge type '{}' (parent={}, transitive={}, inheritable={})",
                definition.getType(), definition.getParentType(),
                definition.isTransitive(), definition.isInheritable());
    }

    public Optional<EdgeTypeDefinition> get(String type) {
        return Optional.ofNullable(type == null ? null : definitions.get(type));
    }

    public Collection<EdgeTypeDefinition> getAll() {
        return definitions.values().stream()
                .sorted((a, b) -> a.getType().compareTo(b.getType()))
                .toList();
    }

    public boolean isTransitive(String type) {
        return get(type).map(EdgeTypeDefinition::isTransitive).orElse(false);
    }

    public boolean isInheritable(String type) {
        return get(type).map(EdgeTypeDefinition::isInheritable).orElse(false);
    }

    /**
     * Direct child types of {@code parentType}, sorted by name.
     */
    public List<String> getChildren(String parentType) {
        return definitions.values().stream()
                .filter(d -> parentType.equals(d.getParentType()))
                .map(EdgeTypeDefinition::getType)
                .sorted()
                .toList();
    }

    /**
     * The type itself followed by every registered descendant type.
     */
    public Set<String> withSubtypes(String type) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(type);
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (result.add(current)) {
                pending.addAll(getChildren(current));
            }
        }
        return result;
    }

    /**
     * Path from the root of the hierarchy down to {@code type}.
     */
    public List<String> getHierarchyPath(String type) {
        List<String> path = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = type;
        while (current != null && seen.add(current)) {
            path.add(0, current);
            current = get(current).map(EdgeTypeDefinition::getParentType).orElse(null);
        }
        return path;
    }

    /**
     * Checks that every parent type is registered and no type is its own ancestor.
     *
     * @return Error messages, empty when the hierarchy is sound
     */
    public List<String> validateHierarchy() {
        List<String> errors = new ArrayList<>();
        for (EdgeTypeDefinition definition : getAll()) {
            String parent = definition.getParentType();
            if (parent != null && !definitions.containsKey(parent)) {
                errors.add("Edge type '" + definition.getType() + "' has unknown parent '" + parent + "'");
            }
            Set<String> seen = new HashSet<>();
            String current = definition.getType();
            while (current != null) {
                if (!seen.add(current)) {
                    errors.add("Circular edge type hierarchy at '" + definition.getType() + "'");
                    break;
                }
                current = get(current).map(EdgeTypeDefinition::getParentType).orElse(null);
            }
        }
        return errors;
    }

    private static List<EdgeTypeDefinition> coreTypes() {
        return List.of(
                type("contains", "Structural containment", null, true, true, 0),
                type("declares", "Declaration inside a scope", "contains", false, true, 5),
                type("belongs_to", "Ownership by an enclosing element", null, true, false, 0),
                type("depends_on", "Generic dependency", null, true, false, 0),
                type("imports", "Module import", "depends_on", false, false, 5),
                type("exports_to", "Module export", null, false, false, 0),
                type("calls", "Function or method invocation", "depends_on", false, false, 5),
                type("references", "Symbol reference", "depends_on", false, false, 5),
                type(EXTENDS, "Class or interface inheritance", "depends_on", false, true, 5),
                type(IMPLEMENTS, "Interface implementation", "depends_on", false, true, 5),
                type("uses", "Type or value usage", "depends_on", false, false, 5),
                type("instantiates", "Object construction", "depends_on", false, false, 5),
                type("has_type", "Declared type", null, false, false, 0),
                type("returns", "Return type", null, false, false, 0),
                type("throws", "Declared or thrown exception", null, false, false, 0),
                type("assigns_to", "Assignment target", null, false, false, 0),
                type("accesses", "Property access", "depends_on", false, false, 5),
                type("overrides", "Method override", null, false, false, 0),
                type("shadows", "Name shadowing", null, false, false, 0),
                type("annotated_with", "Annotation or decorator", null, false, false, 0),
                type("imports_library", "Import of an external library", "imports", false, false, 6),
                type("imports_file", "Import of a project file", "imports", false, false, 6),
                type("aliasOf", "Alias of another symbol", "references", false, false, 5));
    }

    private static EdgeTypeDefinition type(String name, String description, String parent,
                                           boolean transitive, boolean inheritable, int priority) {
        return EdgeTypeDefinition.builder()
                .type(name)
                .description(description)
                .parentType(parent)
                .transitive(transitive)
                .inheritable(inheritable)
                .priority(priority)
                .build();
    }
}
