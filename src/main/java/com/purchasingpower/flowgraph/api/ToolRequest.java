package com.purchasingpower.flowgraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Create or update a tool.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolRequest {

    private String name;
    private String description;
    private String callable;
}
