package com.cbcluster.common.model;

import java.util.List;

public record ScopeDefinition(String name, List<String> collections) {

    public ScopeDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Scope name must be provided");
        }
        collections = collections == null ? List.of() : List.copyOf(collections);
    }
}
