package com.market.intel.pipeline.extract;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Semantic section labels with their heading synonyms (English and French) and anchor keywords.
 */
public final class SectionDictionary {
    public static final String ABOUT = "about";
    public static final String SERVICES = "services";
    public static final String CLIENTS = "clients";
    public static final String TECHNOLOGIES = "technologies";
    public static final String CONTACT = "contact";
    public static final String JOBS = "jobs";
    public static final String BLOG = "blog";

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final Map<String, List<String>> headingSynonyms = new LinkedHashMap<>();
    private final Map<String, List<String>> anchorKeywords = new LinkedHashMap<>();

    private SectionDictionary() {
    }

    public static SectionDictionary defaults() {
        SectionDictionary dictionary = new SectionDictionary();
        dictionary.define(
            ABOUT,
            List.of("qui sommes-nous", "qui sommes nous", "about us", "about", "à propos", "a propos",
                "présentation", "notre histoire", "our story", "who we are", "mission", "vision", "l'entreprise"),
            List.of("about", "a-propos", "apropos", "qui-sommes-nous", "presentation", "mission", "who-we-are")
        );
        dictionary.define(
            SERVICES,
            List.of("nos services", "services", "our services", "offre", "nos offres", "solutions", "prestations",
                "what we do", "ce que nous faisons", "expertise", "savoir-faire"),
            List.of("services", "solutions", "offres", "prestations", "expertise", "what-we-do")
        );
        dictionary.define(
            CLIENTS,
            List.of("nos clients", "clients", "our clients", "ils nous font confiance", "témoignages", "testimonials",
                "références", "references", "portfolio", "customers", "case studies"),
            List.of("clients", "customers", "references", "testimonials", "temoignages", "portfolio")
        );
        dictionary.define(
            TECHNOLOGIES,
            List.of("technologies", "our stack", "stack", "tech stack", "frameworks", "tools", "outils", "langages"),
            List.of("technologies", "tech-stack", "stack")
        );
        dictionary.define(
            CONTACT,
            List.of("contact", "contactez-nous", "nous contacter", "contact us", "get in touch", "coordonnées"),
            List.of("contact")
        );
        dictionary.define(
            JOBS,
            List.of("carrière", "carrières", "careers", "jobs", "recrutement", "nous rejoindre", "join us", "emplois"),
            List.of("careers", "jobs", "recrutement", "carriere", "join-us")
        );
        dictionary.define(
            BLOG,
            List.of("blog", "actualités", "news", "articles", "latest news", "dernières actualités"),
            List.of("blog", "news", "actualites", "articles")
        );
        return dictionary;
    }

    private void define(String label, List<String> synonyms, List<String> anchors) {
        headingSynonyms.put(label, synonyms.stream().map(SectionDictionary::normalize).toList());
        anchorKeywords.put(label, List.copyOf(anchors));
    }

    public List<String> labels() {
        return List.copyOf(headingSynonyms.keySet());
    }

    public List<String> headingSynonyms(String label) {
        return headingSynonyms.getOrDefault(label, List.of());
    }

    public List<String> anchorKeywords(String label) {
        return anchorKeywords.getOrDefault(label, List.of());
    }

    /**
     * True when the heading text names the label, either exactly or as a whole-word phrase.
     */
    public boolean headingMatches(String label, String headingText) {
        String heading = normalize(headingText);
        if (heading.isEmpty() || heading.length() > 60) {
            return false;
        }
        String padded = " " + heading + " ";
        for (String synonym : headingSynonyms(label)) {
            if (heading.equals(synonym) || padded.contains(" " + synonym + " ")) {
                return true;
            }
        }
        return false;
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        return NON_ALNUM.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
