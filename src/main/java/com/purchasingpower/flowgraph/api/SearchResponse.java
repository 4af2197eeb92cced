package com.purchasingpower.flowgraph.api;

import com.purchasingpower.flowgraph.search.SearchHit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Search response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private boolean success;
    private String error;

    @Builder.Default
    private List<SearchHit> results = new ArrayList<>();

    public static SearchResponse success(List<SearchHit> results) {
        return SearchResponse.builder()
            .success(true)
            .results(results)
            .build();
    }

    public static SearchResponse error(String error) {
        return SearchResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
