package com.market.intel.pipeline.aggregate;

import com.market.intel.pipeline.model.CleanedDocument;
import com.market.intel.pipeline.model.IdentityBasis;
import com.market.intel.pipeline.model.SourceCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.market.intel.pipeline.PipelineFixtures.CAPTURED_AT;
import static com.market.intel.pipeline.PipelineFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class IdentityResolverTest {
    private final IdentityResolver resolver = new IdentityResolver(0.85);

    @Test
    void normalizesAccentsPunctuationAndLegalForms() {
        assertEquals("creations eloise", IdentityResolver.normalizeName("Créations Éloïse, SARL"));
        assertEquals("acme", IdentityResolver.normalizeName("  ACME Inc. "));
        assertEquals("", IdentityResolver.normalizeName("GmbH"));
        assertEquals("", IdentityResolver.normalizeName(null));
    }

    @Test
    void levenshteinSimilarity() {
        assertEquals(3, IdentityResolver.levenshtein("kitten", "sitting"));
        assertEquals(1.0, IdentityResolver.similarity("acme", "acme"));
        assertThat(IdentityResolver.similarity("atelier dupont", "atelier dupond")).isGreaterThan(0.85);
    }

    @Test
    void companyPagesResolveByDomainAndListingsByName() {
        List<CleanedDocument> documents = List.of(
            document("doc-1", "https://www.acme.example/", SourceCategory.COMPANY, "Acme", CAPTURED_AT, "a"),
            document("doc-2", "https://annuaire.example/acme", SourceCategory.DIRECTORY, "Atelier Dupont", CAPTURED_AT, "b"),
            document("doc-3", "https://annuaire.example/dupond", SourceCategory.DIRECTORY, "Atelier Dupond", CAPTURED_AT, "c")
        );

        Map<String, Identity> identities = resolver.resolve(documents);

        assertEquals(new Identity("domain:acme.example", IdentityBasis.DOMAIN), identities.get("doc-1"));
        assertEquals(new Identity("name:atelier dupond", IdentityBasis.NAME), identities.get("doc-2"));
        assertEquals(identities.get("doc-2"), identities.get("doc-3"));
    }
}
