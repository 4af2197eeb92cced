package com.purchasingpower.flowgraph.model.execution;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * One task that ran to completion.
 */
@Value
@Builder
public class TaskExecutionRecord {
    int index;
    int order;
    String taskName;
    String toolName;
    long durationMillis;
    Set<String> outputKeys;
}
