package com.purchasingpower.depgraph.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes and decodes symbolic addresses of the form
 * {@code <projectName>/<filePath>#<NodeType>:<SymbolName>}.
 *
 * <p>All operations are pure and never throw on malformed input; problems are
 * reported through {@link ParsedAddress#getErrors()} or a {@code null} return.
 *
 * <p>Path normalization converts backslashes to forward slashes, collapses
 * repeated slashes and strips a leading {@code ./} or {@code /}.
 *
 * @since 2.0.0
 */
public final class AddressCodec {

    private static final Pattern ADDRESS = Pattern.compile("^([^/]+)/(.+)#([^:]+):(.+)$");

    // Same shape with every part optional, used only to explain a failed strict match.
    private static final Pattern LOOSE_ADDRESS = Pattern.compile("^([^/]*)/(.*)#([^:]*):(.*)$");

    private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");

    private AddressCodec() {
    }

    public static String create(String projectName, String filePath, NodeType nodeType, String symbolName) {
        return create(projectName, filePath, nodeType.getLabel(), symbolName);
    }

    public static String create(String projectName, String filePath, String nodeType, String symbolName) {
        return projectName + "/" + normalizePath(filePath) + "#" + nodeType + ":" + symbolName;
    }

    public static ParsedAddress parse(String address) {
        if (address == null || address.isBlank()) {
            return ParsedAddress.invalid(List.of("Address is empty"));
        }

        Matcher matcher = ADDRESS.matcher(address);
        if (!matcher.matches()) {
            return ParsedAddress.invalid(explainMismatch(address));
        }

        List<String> errors = new ArrayList<>();
        String projectName = matcher.group(1);
        String filePath = normalizePath(matcher.group(2));
        String typeLabel = matcher.group(3);
        String symbolName = matcher.group(4);

        Optional<NodeType> nodeType = NodeType.fromLabel(typeLabel);
        if (nodeType.isEmpty()) {
            errors.add("Unknown node type: " + typeLabel);
        }
        if (symbolName.isBlank()) {
            errors.add("Symbol name is empty");
        }
        if (filePath.isEmpty()) {
            errors.add("File path is empty");
        }
        if (!errors.isEmpty()) {
            return ParsedAddress.invalid(errors);
        }

        return ParsedAddress.builder()
                .projectName(projectName)
                .filePath(filePath)
                .nodeType(nodeType.get())
                .symbolName(symbolName)
                .valid(true)
                .build();
    }

    public static AddressValidation validate(String address) {
        ParsedAddress parsed = parse(address);
        return new AddressValidation(parsed.isValid(), parsed.getErrors());
    }

    /**
     * Re-serializes a valid address with a normalized path. Invalid input comes
     * back with only its separators normalized. Idempotent.
     */
    public static String normalize(String address) {
        ParsedAddress parsed = parse(address);
        if (!parsed.isValid()) {
            return address == null ? null : address.replace('\\', '/');
        }
        return create(parsed.getProjectName(), parsed.getFilePath(), parsed.getNodeType(), parsed.getSymbolName());
    }

    public static boolean compare(String first, String second) {
        ParsedAddress a = parse(first);
        ParsedAddress b = parse(second);
        if (!a.isValid() || !b.isValid()) {
            return false;
        }
        return a.toAddress().equals(b.toAddress());
    }

    public static Optional<Address> toAddress(String address) {
        ParsedAddress parsed = parse(address);
        return parsed.isValid() ? Optional.of(parsed.toAddress()) : Optional.empty();
    }

    public static String extractProjectName(String address) {
        ParsedAddress parsed = parse(address);
        return parsed.isValid() ? parsed.getProjectName() : null;
    }

    public static String extractFilePath(String address) {
        ParsedAddress parsed = parse(address);
        return parsed.isValid() ? parsed.getFilePath() : null;
    }

    public static NodeType extractNodeType(String address) {
        ParsedAddress parsed = parse(address);
        return parsed.isValid() ? parsed.getNodeType() : null;
    }

    public static String extractSymbolName(String address) {
        ParsedAddress parsed = parse(address);
        return parsed.isValid() ? parsed.getSymbolName() : null;
    }

    public static String normalizePath(String filePath) {
        if (filePath == null) {
            return "";
        }
        String path = REPEATED_SLASHES.matcher(filePath.replace('\\', '/')).replaceAll("/");
        while (path.startsWith("./") || path.startsWith("/")) {
            path = path.substring(path.startsWith("/") ? 1 : 2);
        }
        return path;
    }

    private static List<String> explainMismatch(String address) {
        Matcher loose = LOOSE_ADDRESS.matcher(address);
        if (!loose.matches()) {
            return List.of("Invalid address format, expected <project>/<filePath>#<NodeType>:<SymbolName>: " + address);
        }
        List<String> errors = new ArrayList<>();
        if (loose.group(1).isEmpty()) {
            errors.add("Project name is empty");
        }
        if (loose.group(2).isEmpty()) {
            errors.add("File path is empty");
        }
        if (loose.group(3).isEmpty()) {
            errors.add("Node type is empty");
        } else if (NodeType.fromLabel(loose.group(3)).isEmpty()) {
            errors.add("Unknown node type: " + loose.group(3));
        }
        if (loose.group(4).isEmpty()) {
            errors.add("Symbol name is empty");
        }
        if (errors.isEmpty()) {
            errors.add("Invalid address format: " + address);
        }
        return errors;
    }
}
