package com.cbcluster.common.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public record ServerGroup(String name, Set<CouchbaseService> services, List<ServerNode> nodes) {

    public ServerGroup {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Server group name must be provided");
        }
        services = services == null || services.isEmpty()
                ? CouchbaseService.DEFAULT_SERVICES
                : Set.copyOf(EnumSet.copyOf(services));
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public int bitmask() {
        return CouchbaseService.toBitmask(services);
    }
}
