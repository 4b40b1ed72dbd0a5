package com.market.intel.pipeline.aggregate;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.analysis.ThemeClassifier;
import com.market.intel.pipeline.model.AggregatedProfile;
import com.market.intel.pipeline.model.AnalysisResult;
import com.market.intel.pipeline.model.CleanedDocument;
import com.market.intel.pipeline.model.EntityType;
import com.market.intel.pipeline.model.IdentityBasis;
import com.market.intel.pipeline.model.ProfileField;
import com.market.intel.pipeline.model.ProfileItem;
import com.market.intel.pipeline.model.RankedKeyword;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Merges documents into one profile per resolved identity. The result depends only on the set of
 * documents and analyses, never on their order or on when the merge runs.
 */
@Service
public class ProfileAggregator {
    private static final Logger log = LoggerFactory.getLogger(ProfileAggregator.class);

    static final Comparator<CleanedDocument> CAPTURE_ORDER = Comparator
        .comparing(CleanedDocument::capturedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(CleanedDocument::documentId);

    private final PipelineProperties properties;

    public ProfileAggregator(PipelineProperties properties) {
        this.properties = properties;
    }

    public List<AggregatedProfile> aggregate(List<CleanedDocument> documents, List<AnalysisResult> analyses) {
        Map<String, AnalysisResult> analysisByDocument = new HashMap<>();
        for (AnalysisResult analysis : analyses) {
            analysisByDocument.put(analysis.documentId(), analysis);
        }
        IdentityResolver resolver = new IdentityResolver(properties.getAggregation().getNameSimilarityThreshold());
        Map<String, Identity> identities = resolver.resolve(documents);

        Map<String, List<CleanedDocument>> groups = new TreeMap<>();
        Map<String, IdentityBasis> bases = new HashMap<>();
        for (CleanedDocument document : documents) {
            Identity identity = identities.get(document.documentId());
            groups.computeIfAbsent(identity.key(), ignored -> new ArrayList<>()).add(document);
            bases.put(identity.key(), identity.basis());
        }

        List<AggregatedProfile> profiles = new ArrayList<>();
        groups.forEach((key, members) -> {
            List<CleanedDocument> ordered = new ArrayList<>(members);
            ordered.sort(CAPTURE_ORDER);
            profiles.add(merge(key, bases.get(key), ordered, analysisByDocument));
        });
        log.info("Aggregated {} documents into {} profiles", documents.size(), profiles.size());
        return List.copyOf(profiles);
    }

    private AggregatedProfile merge(
        String profileId,
        IdentityBasis basis,
        List<CleanedDocument> ordered,
        Map<String, AnalysisResult> analysisByDocument
    ) {
        Map<String, ProfileField> fields = new TreeMap<>();
        putLatest(fields, "name", ordered, CleanedDocument::entityName);
        putLatest(fields, "title", ordered, CleanedDocument::title);
        putLatest(fields, "description", ordered, CleanedDocument::description);
        putLatest(fields, "summary", ordered, document -> {
            AnalysisResult analysis = analysisByDocument.get(document.documentId());
            return analysis == null ? null : analysis.summary();
        });
        TreeSet<String> sectionLabels = new TreeSet<>();
        for (CleanedDocument document : ordered) {
            sectionLabels.addAll(document.sections().keySet());
        }
        for (String label : sectionLabels) {
            putLatest(fields, "section." + label, ordered, document -> document.sections().get(label));
        }

        Map<String, Double> keywordScores = new HashMap<>();
        List<String> themes = new ArrayList<>();
        TreeSet<String> clusterIds = new TreeSet<>();
        for (CleanedDocument document : ordered) {
            AnalysisResult analysis = analysisByDocument.get(document.documentId());
            if (analysis == null || analysis.hasError()) {
                themes.add(null);
                continue;
            }
            for (RankedKeyword keyword : analysis.keywords()) {
                keywordScores.merge(keyword.term(), keyword.score(), Math::max);
            }
            themes.add(analysis.theme());
            if (analysis.clusterId() != null) {
                clusterIds.add(analysis.clusterId());
            }
        }
        List<RankedKeyword> keywords = keywordScores.entrySet().stream()
            .map(entry -> new RankedKeyword(entry.getKey(), entry.getValue()))
            .sorted(RankedKeyword.RANKING)
            .limit(properties.getAnalysis().getTopKeywords())
            .toList();

        Map<String, Integer> themeVotes = new TreeMap<>();
        for (String theme : themes) {
            if (theme != null) {
                themeVotes.merge(theme, 1, Integer::sum);
            }
        }
        String theme = vote(themes);
        List<String> entityTypes = ordered.stream()
            .map(document -> EntityType.fromCategory(document.category()).name())
            .toList();
        String entityType = vote(entityTypes);

        String domain = null;
        for (int i = ordered.size() - 1; i >= 0 && domain == null; i--) {
            String candidate = ordered.get(i).domain();
            if (candidate != null && !candidate.isBlank()) {
                domain = candidate;
            }
        }

        List<String> documentIds = ordered.stream().map(CleanedDocument::documentId).toList();
        List<String> sourceIds = List.copyOf(new TreeSet<>(ordered.stream().map(CleanedDocument::sourceId).toList()));
        // Undated documents sort first, so the last capture is dated whenever any member is.
        Instant first = ordered.stream()
            .map(CleanedDocument::capturedAt)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
        Instant last = ordered.get(ordered.size() - 1).capturedAt();

        return new AggregatedProfile(
            profileId,
            basis,
            entityType == null ? EntityType.UNKNOWN : EntityType.valueOf(entityType),
            domain,
            fields,
            union(ordered, CleanedDocument::emails),
            union(ordered, CleanedDocument::phones),
            union(ordered, CleanedDocument::technologies),
            union(ordered, CleanedDocument::services),
            keywords,
            theme == null ? ThemeClassifier.GENERAL : theme,
            themeVotes,
            List.copyOf(clusterIds),
            documentIds,
            sourceIds,
            first,
            last
        );
    }

    /**
     * Most recently captured non-blank value. Documents are in capture order, so the last one wins,
     * which also settles equal timestamps in favour of the larger document id.
     */
    private void putLatest(
        Map<String, ProfileField> fields,
        String name,
        List<CleanedDocument> ordered,
        Function<CleanedDocument, String> getter
    ) {
        for (int i = ordered.size() - 1; i >= 0; i--) {
            CleanedDocument document = ordered.get(i);
            String value = getter.apply(document);
            if (value != null && !value.isBlank()) {
                fields.put(name, new ProfileField(value, document.documentId(), document.url(), document.capturedAt()));
                return;
            }
        }
    }

    private List<ProfileItem> union(List<CleanedDocument> ordered, Function<CleanedDocument, List<String>> getter) {
        Map<String, ProfileItem> items = new LinkedHashMap<>();
        for (CleanedDocument document : ordered) {
            List<String> values = getter.apply(document);
            if (values == null) {
                continue;
            }
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    items.putIfAbsent(value, new ProfileItem(value, document.documentId()));
                }
            }
        }
        return List.copyOf(items.values());
    }

    /**
     * Majority label over votes in capture order; ties go to the label of the most recent voter among
     * the tied labels. Null votes are ignored.
     */
    static String vote(List<String> votes) {
        Map<String, Integer> counts = new HashMap<>();
        for (String vote : votes) {
            if (vote != null) {
                counts.merge(vote, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return null;
        }
        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        for (int i = votes.size() - 1; i >= 0; i--) {
            String vote = votes.get(i);
            if (vote != null && counts.get(vote) == max) {
                return vote;
            }
        }
        return null;
    }
}
