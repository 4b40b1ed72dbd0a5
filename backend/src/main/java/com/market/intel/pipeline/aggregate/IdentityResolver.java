package com.market.intel.pipeline.aggregate;

import com.market.intel.pipeline.model.CleanedDocument;
import com.market.intel.pipeline.model.IdentityBasis;
import com.market.intel.pipeline.model.SourceCategory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps every document to an identity key. Domain-bearing company and freelance pages resolve by
 * domain; directory listings and host-less documents resolve by fuzzy name match.
 */
public class IdentityResolver {
    private static final Set<String> LEGAL_SUFFIXES = Set.of(
        "sarl", "sas", "sasu", "eurl", "inc", "ltd", "llc", "gmbh", "sa", "corp", "co"
    );

    private final double nameSimilarityThreshold;

    public IdentityResolver(double nameSimilarityThreshold) {
        this.nameSimilarityThreshold = nameSimilarityThreshold;
    }

    public Map<String, Identity> resolve(List<CleanedDocument> documents) {
        Map<String, Identity> identities = new TreeMap<>();
        Map<String, String> nameByDocument = new TreeMap<>();
        for (CleanedDocument document : documents) {
            boolean domainBased = document.category() != SourceCategory.DIRECTORY;
            if (domainBased && document.domain() != null && !document.domain().isBlank()) {
                identities.put(document.documentId(), new Identity("domain:" + document.domain(), IdentityBasis.DOMAIN));
                continue;
            }
            String name = normalizeName(document.entityName());
            if (name.isEmpty()) {
                identities.put(document.documentId(), new Identity("doc:" + document.documentId(), IdentityBasis.DOCUMENT));
            } else {
                nameByDocument.put(document.documentId(), name);
            }
        }

        Map<String, String> canonical = groupNames(new TreeSet<>(nameByDocument.values()));
        nameByDocument.forEach((documentId, name) ->
            identities.put(documentId, new Identity("name:" + canonical.get(name), IdentityBasis.NAME)));
        return identities;
    }

    private Map<String, String> groupNames(TreeSet<String> distinctNames) {
        List<String> names = new ArrayList<>(distinctNames);
        int[] parent = new int[names.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                if (similarity(names.get(i), names.get(j)) >= nameSimilarityThreshold) {
                    int a = find(parent, i);
                    int b = find(parent, j);
                    if (a != b) {
                        parent[Math.max(a, b)] = Math.min(a, b);
                    }
                }
            }
        }
        // roots are always the smallest index of their group, and names are sorted
        Map<String, String> canonical = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            canonical.put(names.get(i), names.get(find(parent, i)));
        }
        return canonical;
    }

    private int find(int[] parent, int index) {
        while (parent[index] != index) {
            parent[index] = parent[parent[index]];
            index = parent[index];
        }
        return index;
    }

    /**
     * Lower-cased, accents removed, punctuation collapsed to single spaces, legal-form tokens dropped.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        String stripped = Normalizer.normalize(name, Normalizer.Form.NFKD)
            .replaceAll("\\p{M}+", "")
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}]+", " ")
            .trim();
        if (stripped.isEmpty()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String token : stripped.split(" ")) {
            if (!LEGAL_SUFFIXES.contains(token)) {
                kept.add(token);
            }
        }
        return String.join(" ", kept);
    }

    static double similarity(String left, String right) {
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / longest;
    }

    static int levenshtein(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }
}
