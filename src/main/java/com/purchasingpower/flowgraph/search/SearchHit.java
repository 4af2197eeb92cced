package com.purchasingpower.flowgraph.search;

import com.purchasingpower.flowgraph.core.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entity returned by a hybrid search, with its graph neighbourhood.
 *
 * <p>{@code details} depends on the kind:
 * <ul>
 *   <li>WORKFLOW: {@code tasks}, a list of {order, task, tool}</li>
 *   <li>TASK: {@code tool} and {@code workflows}, a list of {workflow, order}</li>
 *   <li>TOOL: {@code callable} and {@code usedBy}, a list of task names</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    private EntityKind kind;
    private String name;
    private String description;

    private double score;
    private double vectorScore;
    private double fulltextScore;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
}
