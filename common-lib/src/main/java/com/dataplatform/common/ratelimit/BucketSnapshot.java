package com.dataplatform.common.ratelimit;

/**
 * Read-only view of one admission bucket for the health surface.
 */
public record BucketSnapshot(
    String name,
    double available,
    int    capacity
) {}
