package com.cbcluster.common.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Services that can be enabled on a cluster node.
 */
public enum CouchbaseService implements WireValue {
    DATA("kv", 1),
    QUERY("n1ql", 2),
    INDEX("index", 4),
    SEARCH("fts", 8),
    ANALYTICS("cbas", 16),
    EVENTING("eventing", 32),
    BACKUP("backup", 64);

    public static final Set<CouchbaseService> DEFAULT_SERVICES =
            Set.copyOf(EnumSet.of(DATA, QUERY, INDEX, SEARCH));

    private final String wireValue;
    private final int flag;

    CouchbaseService(String wireValue, int flag) {
        this.wireValue = wireValue;
        this.flag = flag;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public int flag() {
        return flag;
    }

    /**
     * Builds the comma separated services parameter, e.g. {@code kv,n1ql,index}.
     */
    public static String toServicesParameter(Collection<CouchbaseService> services) {
        return Arrays.stream(values())
                .filter(services::contains)
                .map(CouchbaseService::wireValue)
                .collect(Collectors.joining(","));
    }

    public static int toBitmask(Collection<CouchbaseService> services) {
        int mask = 0;
        for (CouchbaseService service : services) {
            mask |= service.flag;
        }
        return mask;
    }

    public static Set<CouchbaseService> fromBitmask(int mask) {
        EnumSet<CouchbaseService> services = EnumSet.noneOf(CouchbaseService.class);
        for (CouchbaseService service : values()) {
            if ((mask & service.flag) != 0) {
                services.add(service);
            }
        }
        return services;
    }
}
