package com.purchasingpower.depgraph.query;

import com.purchasingpower.depgraph.core.GraphNode;

import java.util.Locale;
import java.util.Map;

/**
 * Resolves field names used in queries against a node.
 *
 * <p>Built-in fields come from the address; anything else is looked up in the
 * node metadata, with an optional {@code metadata.} prefix.
 */
public final class QueryField {

    public static final String ADDRESS = "address";
    public static final String PROJECT_NAME = "projectName";
    public static final String FILE_PATH = "filePath";
    public static final String NODE_TYPE = "nodeType";
    public static final String SYMBOL_NAME = "symbolName";
    public static final String DEPTH = "depth";
    public static final String METADATA = "metadata";

    private static final String METADATA_PREFIX = "metadata.";

    private QueryField() {
    }

    /**
     * Maps aliases ({@code name}, {@code type}, {@code file}, {@code project}) to
     * canonical field names; metadata keys are returned unchanged.
     */
    public static String canonical(String field) {
        return switch (field.toLowerCase(Locale.ROOT)) {
            case "address", "id" -> ADDRESS;
            case "projectname", "project" -> PROJECT_NAME;
            case "filepath", "file", "path" -> FILE_PATH;
            case "nodetype", "type", "kind" -> NODE_TYPE;
            case "symbolname", "name", "symbol" -> SYMBOL_NAME;
            case "depth" -> DEPTH;
            case "metadata" -> METADATA;
            default -> field;
        };
    }

    public static boolean isBuiltIn(String canonicalField) {
        return switch (canonicalField) {
            case ADDRESS, PROJECT_NAME, FILE_PATH, NODE_TYPE, SYMBOL_NAME, DEPTH, METADATA -> true;
            default -> false;
        };
    }

    /**
     * @param depth Traversal depth of the node, or null outside traversals
     */
    public static Object resolve(String field, GraphNode node, Integer depth) {
        String name = canonical(field);
        return switch (name) {
            case ADDRESS -> node.getId();
            case PROJECT_NAME -> node.getAddress().getProjectName();
            case FILE_PATH -> node.getAddress().getFilePath();
            case NODE_TYPE -> node.getAddress().getNodeType().getLabel();
            case SYMBOL_NAME -> node.getAddress().getSymbolName();
            case DEPTH -> depth;
            case METADATA -> node.getMetadata();
            default -> metadataValue(node.getMetadata(), name);
        };
    }

    private static Object metadataValue(Map<String, Object> metadata, String name) {
        String key = name.startsWith(METADATA_PREFIX) ? name.substring(METADATA_PREFIX.length()) : name;
        return metadata.get(key);
    }
}
