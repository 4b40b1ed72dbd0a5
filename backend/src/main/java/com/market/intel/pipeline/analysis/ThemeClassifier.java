package com.market.intel.pipeline.analysis;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyword-overlap theme scoring. Labels are declared in priority order, which also breaks score ties.
 */
@Component
public class ThemeClassifier {
    public static final String GENERAL = "general";

    private static final Map<String, List<String>> LEXICONS = new LinkedHashMap<>();

    static {
        LEXICONS.put("technology", List.of(
            "technology", "technologie", "software", "logiciel", "cloud", "api", "deployment", "deploy",
            "déploiement", "devops", "infrastructure", "platform", "plateforme", "saas", "developer",
            "développeur", "development", "développement", "code", "application", "server", "serveur",
            "hosting", "hébergement", "integration", "intégration", "microservice", "kubernetes", "docker",
            "security", "sécurité", "cybersecurity", "network", "réseau", "web", "mobile"
        ));
        LEXICONS.put("data", List.of(
            "data", "donnée", "données", "analytics", "analyse", "intelligence", "machine", "learning",
            "dashboard", "statistics", "statistique", "algorithm", "algorithme", "model", "modèle",
            "prediction", "prédiction", "reporting"
        ));
        LEXICONS.put("ecommerce", List.of(
            "ecommerce", "commerce", "shop", "store", "boutique", "product", "produit", "cart", "panier",
            "order", "commande", "payment", "paiement", "delivery", "livraison", "marketplace", "vente",
            "catalogue", "catalog"
        ));
        LEXICONS.put("marketing", List.of(
            "marketing", "brand", "marque", "seo", "référencement", "campaign", "campagne", "social",
            "content", "contenu", "advertising", "publicité", "communication", "audience", "influence",
            "newsletter", "visibility", "visibilité", "growth", "lead", "acquisition"
        ));
        LEXICONS.put("design", List.of(
            "design", "graphic", "graphique", "creative", "créatif", "créative", "logo", "interface",
            "identity", "identité", "illustration", "mockup", "maquette", "prototype", "visual", "visuel",
            "photo", "video", "vidéo"
        ));
        LEXICONS.put("consulting", List.of(
            "consulting", "consultant", "advisory", "strategy", "stratégie", "conseil", "audit",
            "transformation", "management", "accompagnement", "expertise", "business"
        ));
        LEXICONS.put("training", List.of(
            "training", "formation", "course", "cours", "workshop", "atelier", "coaching", "certification",
            "teaching", "enseignement", "apprentissage", "student", "étudiant"
        ));
    }

    private final Map<String, Map<String, Set<String>>> stemmedLexicons = new ConcurrentHashMap<>();

    public List<String> labels() {
        return List.copyOf(LEXICONS.keySet());
    }

    /**
     * Highest summed keyword score wins; ties go to the label declared first; no overlap gives {@link #GENERAL}.
     */
    public String classify(List<ScoredTerm> keywords, String language) {
        Map<String, Set<String>> lexicons = lexiconsFor(language);
        String best = GENERAL;
        double bestScore = 0.0;
        for (Map.Entry<String, Set<String>> entry : lexicons.entrySet()) {
            double score = 0.0;
            for (ScoredTerm keyword : keywords) {
                if (entry.getValue().contains(keyword.lemma())) {
                    score += keyword.score();
                }
            }
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }
        return best;
    }

    private Map<String, Set<String>> lexiconsFor(String language) {
        return stemmedLexicons.computeIfAbsent(language, this::stemLexicons);
    }

    private Map<String, Set<String>> stemLexicons(String language) {
        Lemmatizer lemmatizer = Lemmatizer.forLanguage(language);
        Lemmatizer english = Lemmatizer.forLanguage("en");
        Map<String, Set<String>> stemmed = new LinkedHashMap<>();
        LEXICONS.forEach((label, words) -> {
            Set<String> lemmas = new HashSet<>();
            for (String word : words) {
                lemmas.add(lemmatizer.lemma(word));
                lemmas.add(english.lemma(word));
            }
            stemmed.put(label, Set.copyOf(lemmas));
        });
        return stemmed;
    }
}
