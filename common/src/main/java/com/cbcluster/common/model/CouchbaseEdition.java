package com.cbcluster.common.model;

/**
 * Edition of Couchbase Server running on the nodes.
 */
public enum CouchbaseEdition {
    ENTERPRISE,
    COMMUNITY
}
