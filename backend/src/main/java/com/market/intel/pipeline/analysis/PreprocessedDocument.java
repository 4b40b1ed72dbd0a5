package com.market.intel.pipeline.analysis;

import java.util.List;
import java.util.Map;

/**
 * Lemma sequence of one document plus, for each lemma, how often each surface token produced it.
 */
public record PreprocessedDocument(
    String documentId,
    String language,
    List<String> lemmas,
    Map<String, Map<String, Integer>> surfaceForms
) {
}
