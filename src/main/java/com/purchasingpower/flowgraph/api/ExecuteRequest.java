package com.purchasingpower.flowgraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteRequest {

    @Builder.Default
    private Map<String, Object> context = new HashMap<>();
}
