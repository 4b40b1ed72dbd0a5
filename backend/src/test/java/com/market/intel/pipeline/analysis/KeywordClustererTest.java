package com.market.intel.pipeline.analysis;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordClustererTest {
    private final KeywordClusterer clusterer = new KeywordClusterer();

    @Test
    void overlappingKeywordSetsShareCluster() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("doc-c", List.of("bread", "pastry", "bakery"));
        keywords.put("doc-b", List.of("cloud", "api", "kubernetes"));
        keywords.put("doc-a", List.of("cloud", "api", "devops"));

        Map<String, String> clusters = clusterer.cluster(keywords, 10, 0.3);

        assertThat(clusters).containsEntry("doc-a", "cluster-001")
            .containsEntry("doc-b", "cluster-001")
            .containsEntry("doc-c", "cluster-002");
    }

    @Test
    void similarityIsTransitiveThroughChains() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("doc-1", List.of("a", "b", "c"));
        keywords.put("doc-2", List.of("c", "d", "e"));
        keywords.put("doc-3", List.of("e", "f", "g"));

        Map<String, String> clusters = clusterer.cluster(keywords, 10, 0.2);

        assertThat(clusters.values()).containsOnly("cluster-001");
    }

    @Test
    void onlyTopKeywordsAreCompared() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("doc-1", List.of("alpha", "beta", "shared"));
        keywords.put("doc-2", List.of("gamma", "delta", "shared"));

        assertThat(clusterer.cluster(keywords, 2, 0.1)).containsEntry("doc-1", "cluster-001")
            .containsEntry("doc-2", "cluster-002");
        assertThat(clusterer.cluster(keywords, 3, 0.1).values()).containsOnly("cluster-001");
    }

    @Test
    void documentsWithoutKeywordsStayAlone() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("doc-1", List.of());
        keywords.put("doc-2", List.of());

        assertThat(clusterer.cluster(keywords, 10, 0.0)).containsEntry("doc-1", "cluster-001")
            .containsEntry("doc-2", "cluster-002");
    }
}
