package com.market.intel.pipeline.extract;

import org.jsoup.nodes.Document;

import java.util.Optional;

/**
 * One strategy for locating a labelled section. Matchers are tried in order and the first hit wins.
 */
public interface SectionMatcher {
    Optional<String> match(Document document, String label, SectionDictionary dictionary, int maxChars);
}
