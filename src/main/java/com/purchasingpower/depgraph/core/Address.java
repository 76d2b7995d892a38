package com.purchasingpower.depgraph.core;

import lombok.Value;

/**
 * Immutable symbolic address of a code element.
 *
 * <p>Equality covers the four components only. The canonical string form is
 * produced by {@link AddressCodec}.
 *
 * @since 2.0.0
 */
@Value
public class Address implements Comparable<Address> {

    String projectName;
    String filePath;
    NodeType nodeType;
    String symbolName;

    public static Address of(String projectName, String filePath, NodeType nodeType, String symbolName) {
        return new Address(projectName, AddressCodec.normalizePath(filePath), nodeType, symbolName);
    }

    public String toCanonical() {
        return AddressCodec.create(projectName, filePath, nodeType, symbolName);
    }

    @Override
    public int compareTo(Address other) {
        return toCanonical().compareTo(other.toCanonical());
    }

    @Override
    public String toString() {
        return toCanonical();
    }
}
