package com.cbcluster.common.model;

/**
 * Administrator credentials of the cluster, immutable for its lifetime.
 */
public record ClusterCredentials(String username, String password) {

    public static final String DEFAULT_USERNAME = "Administrator";

    public ClusterCredentials {
        username = username == null || username.isBlank() ? DEFAULT_USERNAME : username;
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Cluster password must be provided");
        }
    }

    @Override
    public String toString() {
        return "ClusterCredentials[username=" + username + ", password=****]";
    }
}
