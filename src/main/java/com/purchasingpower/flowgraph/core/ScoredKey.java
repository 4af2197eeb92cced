package com.purchasingpower.flowgraph.core;

/**
 * Candidate returned by an index query: the unique name of a node and its raw score.
 */
public record ScoredKey(String key, double score) {
}
