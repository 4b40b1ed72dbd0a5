package com.market.intel.pipeline.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ContactPatterns {
    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+(?:\\.[a-zA-Z0-9-]+)+");
    private static final Pattern PHONE = Pattern.compile(
        "(?<![\\w+])(?:\\+?\\d{1,3}[\\s\\-.]?)?(?:\\(?\\d{1,4}\\)?[\\s\\-.]?)?\\d{2,5}(?:[\\s\\-.]?\\d{2,5}){1,4}(?!\\w)"
    );
    private static final Pattern YEAR_RANGE = Pattern.compile("(?:19|20)\\d{2}\\s*[-–]\\s*(?:19|20)\\d{2}");
    private static final Set<String> IMAGE_SUFFIXES = Set.of("png", "jpg", "jpeg", "gif", "svg", "webp");
    private static final int MIN_PHONE_DIGITS = 8;
    private static final int MAX_PHONE_DIGITS = 15;

    private ContactPatterns() {
    }

    public static List<String> emails(Document document, String text) {
        Set<String> emails = new LinkedHashSet<>();
        for (Element link : document.select("a[href^=mailto:]")) {
            String address = link.attr("href").substring("mailto:".length());
            int query = address.indexOf('?');
            if (query >= 0) {
                address = address.substring(0, query);
            }
            addEmail(emails, URLDecoder.decode(address, StandardCharsets.UTF_8));
        }
        Matcher matcher = EMAIL.matcher(text == null ? "" : text);
        while (matcher.find()) {
            addEmail(emails, matcher.group());
        }
        return List.copyOf(emails);
    }

    public static List<String> phones(Document document, String text) {
        Set<String> phones = new LinkedHashSet<>();
        for (Element link : document.select("a[href^=tel:]")) {
            addPhone(phones, link.attr("href").substring("tel:".length()));
        }
        Matcher matcher = PHONE.matcher(text == null ? "" : text);
        while (matcher.find()) {
            String candidate = matcher.group();
            if (YEAR_RANGE.matcher(candidate.trim()).matches()) {
                continue;
            }
            addPhone(phones, candidate);
        }
        return List.copyOf(phones);
    }

    static String normalizePhone(String raw) {
        if (raw == null) {
            return null;
        }
        StringBuilder digits = new StringBuilder();
        String trimmed = raw.trim();
        if (trimmed.startsWith("+")) {
            digits.append('+');
        }
        for (char c : trimmed.toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(c);
            }
        }
        int count = digits.length() - (digits.length() > 0 && digits.charAt(0) == '+' ? 1 : 0);
        if (count < MIN_PHONE_DIGITS || count > MAX_PHONE_DIGITS) {
            return null;
        }
        return digits.toString();
    }

    private static void addPhone(Set<String> phones, String raw) {
        String normalized = normalizePhone(raw);
        if (normalized != null) {
            phones.add(normalized);
        }
    }

    private static void addEmail(Set<String> emails, String raw) {
        if (raw == null) {
            return;
        }
        String email = raw.trim().toLowerCase(Locale.ROOT);
        while (email.endsWith(".")) {
            email = email.substring(0, email.length() - 1);
        }
        if (!EMAIL.matcher(email).matches()) {
            return;
        }
        String suffix = email.substring(email.lastIndexOf('.') + 1);
        if (IMAGE_SUFFIXES.contains(suffix)) {
            return;
        }
        emails.add(email);
    }
}
