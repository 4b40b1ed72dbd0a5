package com.market.intel.pipeline.analysis;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups documents whose top keyword sets overlap (Jaccard) above a threshold. Union-find over every
 * pair, so the grouping does not depend on input order.
 */
@Component
public class KeywordClusterer {

    public Map<String, String> cluster(Map<String, List<String>> keywordsByDocument, int topN, double threshold) {
        List<String> documentIds = new ArrayList<>(new TreeMap<>(keywordsByDocument).keySet());
        List<Set<String>> sets = new ArrayList<>();
        for (String documentId : documentIds) {
            List<String> keywords = keywordsByDocument.get(documentId);
            sets.add(new HashSet<>(keywords.subList(0, Math.min(topN, keywords.size()))));
        }

        int[] parent = new int[documentIds.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < sets.size(); i++) {
            if (sets.get(i).isEmpty()) {
                continue;
            }
            for (int j = i + 1; j < sets.size(); j++) {
                if (!sets.get(j).isEmpty() && jaccard(sets.get(i), sets.get(j)) >= threshold) {
                    union(parent, i, j);
                }
            }
        }

        // document ids are sorted, so the first member seen for a root is its smallest id
        Map<Integer, String> clusterIds = new TreeMap<>();
        Map<String, String> assignment = new TreeMap<>();
        int next = 1;
        for (int i = 0; i < documentIds.size(); i++) {
            int root = find(parent, i);
            String clusterId = clusterIds.get(root);
            if (clusterId == null) {
                clusterId = String.format("cluster-%03d", next++);
                clusterIds.put(root, clusterId);
            }
            assignment.put(documentIds.get(i), clusterId);
        }
        return assignment;
    }

    static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private int find(int[] parent, int index) {
        while (parent[index] != index) {
            parent[index] = parent[parent[index]];
            index = parent[index];
        }
        return index;
    }

    private void union(int[] parent, int left, int right) {
        int a = find(parent, left);
        int b = find(parent, right);
        if (a != b) {
            parent[Math.max(a, b)] = Math.min(a, b);
        }
    }
}
