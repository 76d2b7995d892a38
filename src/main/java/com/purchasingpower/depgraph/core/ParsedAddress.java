package com.purchasingpower.depgraph.core;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of {@link AddressCodec#parse(String)}. Component fields are {@code null}
 * whenever {@code valid} is false.
 */
@Value
@Builder
public class ParsedAddress {

    String projectName;
    String filePath;
    NodeType nodeType;
    String symbolName;
    boolean valid;
    @Builder.Default
    List<String> errors = List.of();

    public static ParsedAddress invalid(List<String> errors) {
        return ParsedAddress.builder()
                .valid(false)
                .errors(List.copyOf(errors))
                .build();
    }

    public Address toAddress() {
        if (!valid) {
            throw new IllegalStateException("Cannot build an address from invalid input: " + errors);
        }
        return new Address(projectName, filePath, nodeType, symbolName);
    }
}
