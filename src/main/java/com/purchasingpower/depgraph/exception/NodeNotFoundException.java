package com.purchasingpower.depgraph.exception;

import lombok.Getter;

@Getter
public class NodeNotFoundException extends RuntimeException {

    private final String address;

    public NodeNotFoundException(String address) {
        super("Node not found: " + address);
        this.address = address;
    }
}
