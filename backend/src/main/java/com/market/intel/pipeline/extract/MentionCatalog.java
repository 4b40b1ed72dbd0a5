package com.market.intel.pipeline.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Curated technology and service names, matched on word boundaries.
 */
public final class MentionCatalog {
    private final Map<String, Pattern> entries = new LinkedHashMap<>();

    private MentionCatalog() {
    }

    public static MentionCatalog technologies() {
        MentionCatalog catalog = new MentionCatalog();
        catalog.add("Java", "java");
        catalog.add("JavaScript", "javascript");
        catalog.add("TypeScript", "typescript");
        catalog.add("Python", "python");
        catalog.add("PHP", "php");
        catalog.add("C#", "c#");
        catalog.add(".NET", "asp\\.net", "\\.net", "dotnet");
        catalog.add("Kotlin", "kotlin");
        catalog.add("Swift", "swift");
        catalog.add("React", "react", "react\\.js", "reactjs");
        catalog.add("React Native", "react native");
        catalog.add("Angular", "angular");
        catalog.add("Vue.js", "vue\\.js", "vuejs");
        catalog.add("Node.js", "node\\.js", "nodejs");
        catalog.add("Django", "django");
        catalog.add("Flask", "flask");
        catalog.add("Spring", "spring boot", "spring framework");
        catalog.add("Laravel", "laravel");
        catalog.add("Symfony", "symfony");
        catalog.add("Flutter", "flutter");
        catalog.add("AWS", "aws", "amazon web services");
        catalog.add("Azure", "azure");
        catalog.add("Google Cloud", "google cloud", "gcp");
        catalog.add("Docker", "docker");
        catalog.add("Kubernetes", "kubernetes", "k8s");
        catalog.add("Terraform", "terraform");
        catalog.add("PostgreSQL", "postgresql", "postgres");
        catalog.add("MySQL", "mysql");
        catalog.add("MongoDB", "mongodb");
        catalog.add("WordPress", "wordpress");
        catalog.add("Shopify", "shopify");
        catalog.add("Magento", "magento");
        catalog.add("PrestaShop", "prestashop");
        catalog.add("Salesforce", "salesforce");
        catalog.add("HubSpot", "hubspot");
        catalog.add("Figma", "figma");
        catalog.add("Power BI", "power bi");
        catalog.add("TensorFlow", "tensorflow");
        catalog.add("PyTorch", "pytorch");
        return catalog;
    }

    public static MentionCatalog services() {
        MentionCatalog catalog = new MentionCatalog();
        catalog.add("Web development", "web development", "développement web", "developpement web",
            "website development", "création de sites?", "creation de sites?", "sites? web");
        catalog.add("Mobile development", "mobile development", "mobile apps?", "applications? mobiles?",
            "développement mobile", "developpement mobile");
        catalog.add("Software development", "software development", "développement logiciel",
            "custom software", "logiciels? sur mesure");
        catalog.add("UI/UX design", "ui/ux", "ux design", "ui design", "web design", "webdesign", "design ux");
        catalog.add("SEO", "seo", "référencement", "referencement");
        catalog.add("Digital marketing", "digital marketing", "marketing digital", "social media",
            "réseaux sociaux", "community management");
        catalog.add("E-commerce", "e-commerce", "ecommerce", "boutiques? en ligne", "online stores?");
        catalog.add("Consulting", "consulting", "conseil", "advisory");
        catalog.add("Cloud & DevOps", "devops", "cloud migration", "migration cloud", "infogérance", "cloud services");
        catalog.add("Data & AI", "data analytics", "data science", "machine learning", "big data",
            "business intelligence", "intelligence artificielle", "artificial intelligence");
        catalog.add("Cybersecurity", "cybersecurity", "cybersécurité", "security audit", "pentest",
            "sécurité informatique");
        catalog.add("Branding", "branding", "brand identity", "identité visuelle", "logo design");
        catalog.add("Training", "training", "formations?");
        catalog.add("Hosting & maintenance", "hosting", "hébergement", "hebergement", "maintenance");
        catalog.add("Recruitment", "recruitment", "recrutement", "staffing");
        return catalog;
    }

    private void add(String name, String... alternatives) {
        String joined = String.join("|", alternatives);
        entries.put(name, Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?:" + joined + ")(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        ));
    }

    public List<String> find(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : entries.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                found.add(entry.getKey());
            }
        }
        return found;
    }
}
