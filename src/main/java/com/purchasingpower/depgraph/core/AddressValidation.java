package com.purchasingpower.depgraph.core;

import java.util.List;

public record AddressValidation(boolean valid, List<String> errors) {

    public AddressValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
