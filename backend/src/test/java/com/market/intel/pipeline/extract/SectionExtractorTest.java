package com.market.intel.pipeline.extract;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.model.ExtractedRecord;
import org.junit.jupiter.api.Test;

import static com.market.intel.pipeline.PipelineFixtures.capture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SectionExtractorTest {
    private final SectionExtractor extractor = new SectionExtractor(new PipelineProperties());

    @Test
    void recognisesFrenchSectionHeadingsAndContacts() {
        String html = "<html><head><title>Atelier Dupont</title>"
            + "<meta name=\"description\" content=\"Agence web à Lyon\"></head><body>"
            + "<h1>Atelier Dupont</h1>"
            + "<h2>Qui sommes-nous ?</h2><p>Une agence lyonnaise fondée par des développeurs passionnés.</p>"
            + "<h2>Nos services</h2><ul><li>Développement web sur mesure</li><li>Référencement naturel</li></ul>"
            + "<h2>Contactez-nous</h2><p>Écrivez à <a href=\"mailto:contact@atelier-dupont.fr\">contact@atelier-dupont.fr</a>"
            + " ou appelez le <a href=\"tel:+33123456789\">+33 1 23 45 67 89</a></p>"
            + "</body></html>";

        ExtractedRecord record = extractor.extract(capture("https://atelier-dupont.fr/", null, html));

        assertThat(record.sections().get(SectionDictionary.ABOUT)).contains("agence lyonnaise");
        assertThat(record.sections().get(SectionDictionary.SERVICES)).contains("Développement web sur mesure");
        assertThat(record.found(SectionDictionary.CONTACT)).isTrue();
        assertThat(record.emails()).containsExactly("contact@atelier-dupont.fr");
        assertThat(record.phones()).containsExactly("+33123456789");
        assertThat(record.services()).contains("Web development", "SEO");
        assertThat(record.description()).isEqualTo("Agence web à Lyon");
        assertThat(record.found(SectionDictionary.CLIENTS)).isFalse();
        assertThat(record.sections().get(SectionDictionary.CLIENTS)).isEmpty();
    }

    @Test
    void aboutFallsBackToFirstParagraphAfterTitle() {
        String html = "<html><body><nav><p>Home Products Pricing Contact and many more navigation links</p></nav>"
            + "<h1>Northwind Labs</h1>"
            + "<p>Short intro.</p>"
            + "<p>Northwind Labs designs data platforms and analytics dashboards for logistics companies.</p>"
            + "</body></html>";

        ExtractedRecord record = extractor.extract(capture("https://northwind.example/", null, html));

        assertThat(record.found(SectionDictionary.ABOUT)).isTrue();
        assertThat(record.sections().get(SectionDictionary.ABOUT))
            .startsWith("Northwind Labs designs data platforms");
    }

    @Test
    void detectsTechnologyMentionsOnWordBoundaries() {
        String html = "<html><body><p>We ship React front ends and Kubernetes clusters on AWS.</p>"
            + "<p>Our javascripting workshop is not a language.</p></body></html>";

        ExtractedRecord record = extractor.extract(capture("https://stack.example/", null, html));

        assertThat(record.technologies()).contains("React", "Kubernetes", "AWS");
        assertThat(record.technologies()).doesNotContain("JavaScript", "Java");
        assertThat(record.found(SectionExtractor.FIELD_TECHNOLOGIES)).isTrue();
    }

    @Test
    void entityNamePrefersTitleSegmentMatchingHost() {
        String html = "<html><head><title>Services | Acme Studio</title></head><body><p>Hello</p></body></html>";

        ExtractedRecord record = extractor.extract(capture("https://www.acme-studio.com/services", null, html));

        assertThat(record.entityName()).isEqualTo("Acme Studio");
    }

    @Test
    void sourceNameOverridesPageDerivedName() {
        String html = "<html><head><title>Home | Something Else</title></head><body><p>Hello</p></body></html>";

        ExtractedRecord record = extractor.extract(capture("https://acme.example/", "Acme Corp", html));

        assertThat(record.entityName()).isEqualTo("Acme Corp");
    }

    @Test
    void detectsOfferAndNoveltySnippets() {
        String html = "<html><body>"
            + "<p>Découvrez nos offres et tarifs pour les PME</p>"
            + "<p>Nouveau : lancement de notre application mobile</p>"
            + "<p>Une équipe de dix personnes</p>"
            + "</body></html>";

        ExtractedRecord record = extractor.extract(capture("https://agence.example/", null, html));

        assertThat(record.offers()).containsExactly("Découvrez nos offres et tarifs pour les PME");
        assertThat(record.novelties()).containsExactly("Nouveau : lancement de notre application mobile");
    }

    @Test
    void emptyMarkupYieldsAllFieldsDefaulted() {
        ExtractedRecord record = extractor.extract(capture("https://empty.example/", null, ""));

        assertThat(record.confidence()).isNotEmpty();
        assertThat(record.confidence().values()).containsOnly(false);
        assertThat(record.text()).isEmpty();
        assertThat(record.entityName()).isEqualTo("empty.example");
    }

    @Test
    void malformedMarkupNeverThrows() {
        String html = "<<<div><p>Broken <b>markup <table><tr><td>cell</p></div></span>>>";

        assertThatCode(() -> extractor.extract(capture("https://broken.example/", null, html)))
            .doesNotThrowAnyException();
        ExtractedRecord record = extractor.extract(capture("https://broken.example/", null, html));
        assertThat(record.text()).contains("cell");
        assertThat(record.found(SectionExtractor.FIELD_EMAILS)).isFalse();
    }
}
