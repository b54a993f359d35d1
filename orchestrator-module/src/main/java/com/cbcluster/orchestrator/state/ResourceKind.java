package com.cbcluster.orchestrator.state;

public enum ResourceKind {
    CLUSTER,
    SERVER_GROUP,
    SERVER,
    BUCKET
}
