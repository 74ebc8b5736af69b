package com.qqsuccubus.pipeline.core.pipeline;

import lombok.Value;

/**
 * Result of one sweep pass.
 */
@Value
public class SweepReport {
    int evictedAssemblies;
    int expiredRecords;
}
