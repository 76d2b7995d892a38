package com.purchasingpower.depgraph.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of node kinds an address may name.
 *
 * <p>The label is the exact token used in the canonical address string
 * ({@code <project>/<file>#<label>:<symbol>}). Relational labels are lower case
 * and kept as written.
 *
 * @since 2.0.0
 */
public enum NodeType {

    // Structural
    CLASS("Class"),
    INTERFACE("Interface"),
    FUNCTION("Function"),
    METHOD("Method"),
    PROPERTY("Property"),
    VARIABLE("Variable"),
    TYPE("Type"),
    ENUM("Enum"),
    NAMESPACE("Namespace"),

    // Document
    HEADING("Heading"),
    SECTION("Section"),
    PARAGRAPH("Paragraph"),

    // Relational
    TAG("tag"),
    PARSED_BY("parsed-by"),
    DEFINED_IN("defined-in"),
    EXTENDS("extends"),
    IMPLEMENTS("implements"),
    USED_BY("used-by");

    private static final Map<String, NodeType> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(NodeType::getLabel, Function.identity()));

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Exact label lookup, as used by address parsing.
     */
    public static Optional<NodeType> fromLabel(String label) {
        return Optional.ofNullable(label == null ? null : BY_LABEL.get(label));
    }

    /**
     * Forgiving lookup for query text: ignores case, accepts the enum name,
     * simple plurals ("classes", "methods") and underscores for dashes.
     */
    public static Optional<NodeType> fromLenient(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String candidate = text.trim();
        Optional<NodeType> exact = fromLabel(candidate);
        if (exact.isPresent()) {
            return exact;
        }
        String lowered = candidate.toLowerCase(Locale.ROOT).replace('_', '-');
        for (String form : singularForms(lowered)) {
            for (NodeType type : values()) {
                if (type.label.toLowerCase(Locale.ROOT).equals(form)
                        || type.name().toLowerCase(Locale.ROOT).replace('_', '-').equals(form)) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }

    private static String[] singularForms(String word) {
        if (word.endsWith("sses")) {
            return new String[]{word, word.substring(0, word.length() - 2)};
        }
        if (word.endsWith("ies")) {
            return new String[]{word, word.substring(0, word.length() - 3) + "y"};
        }
        if (word.endsWith("s")) {
            return new String[]{word, word.substring(0, word.length() - 1)};
        }
        return new String[]{word};
    }

    @Override
    public String toString() {
        return label;
    }
}
