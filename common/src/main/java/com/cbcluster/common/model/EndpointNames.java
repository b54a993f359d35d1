package com.cbcluster.common.model;

import java.util.Map;
import java.util.Optional;

/**
 * Names of the endpoints a node publishes, and the alternate address port key
 * each one is registered under.
 */
public final class EndpointNames {

    public static final String DATA = "data";
    public static final String DATA_SECURE = "datas";
    public static final String MANAGEMENT = "management";
    public static final String MANAGEMENT_SECURE = "managements";
    public static final String VIEWS = "view";
    public static final String VIEWS_SECURE = "views";
    public static final String QUERY = "query";
    public static final String QUERY_SECURE = "querys";
    public static final String FTS = "fts";
    public static final String FTS_SECURE = "ftss";
    public static final String ANALYTICS = "analytic";
    public static final String ANALYTICS_SECURE = "analytics";
    public static final String EVENTING = "eventing";
    public static final String EVENTING_SECURE = "eventings";
    public static final String EVENTING_DEBUG = "eventingdebug";
    public static final String BACKUP = "backup";
    public static final String BACKUP_SECURE = "backups";

    private static final Map<String, String> SERVICE_PORT_KEYS = Map.ofEntries(
            Map.entry(MANAGEMENT, "mgmt"),
            Map.entry(MANAGEMENT_SECURE, "mgmtSSL"),
            Map.entry(DATA, "kv"),
            Map.entry(DATA_SECURE, "kvSSL"),
            Map.entry(VIEWS, "capi"),
            Map.entry(VIEWS_SECURE, "capiSSL"),
            Map.entry(QUERY, "n1ql"),
            Map.entry(QUERY_SECURE, "n1qlSSL"),
            Map.entry(FTS, "fts"),
            Map.entry(FTS_SECURE, "ftsSSL"),
            Map.entry(ANALYTICS, "cbas"),
            Map.entry(ANALYTICS_SECURE, "cbasSSL"),
            Map.entry(EVENTING, "eventingAdminPort"),
            Map.entry(EVENTING_SECURE, "eventingSSL"),
            Map.entry(EVENTING_DEBUG, "eventingDebug"),
            Map.entry(BACKUP, "backupAPI"),
            Map.entry(BACKUP_SECURE, "backupAPIHTTPS")
    );

    private EndpointNames() {
    }

    public static Optional<String> servicePortKey(String endpointName) {
        return Optional.ofNullable(SERVICE_PORT_KEYS.get(endpointName));
    }
}
