package com.market.intel.pipeline.normalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {
    private final TextCleaner cleaner = new TextCleaner();

    @Test
    void removesBoilerplateUrlsAndMarkupResidue() {
        String raw = "We use cookies to improve your experience\n"
            + "Acme builds <b>cloud</b> platforms — see https://acme.example/docs\n"
            + "undefined\n"
            + "Read more\n"
            + "© 2024 Acme. All rights reserved.";

        String cleaned = cleaner.clean(raw);

        assertThat(cleaned).isEqualTo("Acme builds cloud platforms - see");
    }

    @Test
    void collapsesDuplicateAndRepetitiveLines() {
        String raw = "Our services\nOUR SERVICES\nbuy buy buy buy buy buy buy buy\nWeb design for small shops";

        assertThat(cleaner.clean(raw)).isEqualTo("Our services\nWeb design for small shops");
    }

    @Test
    void cleaningIsIdempotent() {
        String raw = "  Nos  offres  2024 \n«Nouveau» service… \n<p>Design</p>\nhttp://x.y\nNos offres 2024\n"
            + "Politique de confidentialité\n   \nDéveloppement   web → mobile";

        String once = cleaner.clean(raw);

        assertThat(cleaner.clean(once)).isEqualTo(once);
        assertThat(once).contains("\"Nouveau\" service...", "Développement web -> mobile");
    }

    @Test
    void blankInputCleansToEmpty() {
        assertThat(cleaner.clean(null)).isEmpty();
        assertThat(cleaner.clean(" \n\t ")).isEmpty();
    }
}
