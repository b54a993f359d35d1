package com.cbcluster.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScopesResponse(
        @JsonProperty("scopes")
        List<Scope> scopes
) {

    public ScopesResponse {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public Optional<Scope> scope(String name) {
        return scopes.stream().filter(scope -> name.equals(scope.name())).findFirst();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Scope(
            @JsonProperty("name")
            String name,

            @JsonProperty("collections")
            List<Collection> collections
    ) {

        public boolean hasCollection(String collectionName) {
            return collections != null && collections.stream().anyMatch(c -> collectionName.equals(c.name()));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Collection(
            @JsonProperty("name")
            String name
    ) {
    }
}
