package com.cbcluster.common.model;

/**
 * How a bucket is provisioned.
 */
public enum BucketKind {
    /** Created empty with {@link BucketSettings}. */
    STANDARD,
    /** Installed from a pre-built sample dataset. */
    SAMPLE
}
