package com.market.intel.pipeline.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonical URL and domain forms used for visited-set dedup and entity identity.
 */
public final class UrlNormalizer {
    private UrlNormalizer() {
    }

    public static URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            URI uri = new URI(value);
            return uri.getHost() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static String normalize(String url) {
        URI uri = toUri(url);
        if (uri == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
            port = -1;
        }
        String path = uri.normalize().getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        StringBuilder result = new StringBuilder();
        result.append(scheme).append("://").append(host);
        if (port != -1) {
            result.append(':').append(port);
        }
        result.append(path);
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            result.append('?').append(uri.getRawQuery());
        }
        return result.toString();
    }

    public static String host(String url) {
        URI uri = toUri(url);
        return uri == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * Lower-cased host without a leading {@code www.}, keeping an explicit non-default port.
     */
    public static String domainKey(String url) {
        URI uri = toUri(url);
        if (uri == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int port = uri.getPort();
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (port == -1 || ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
            return host;
        }
        return host + ":" + port;
    }

    public static boolean sameHost(String left, String right) {
        String a = host(left);
        String b = host(right);
        if (a == null || b == null) {
            return false;
        }
        return stripWww(a).equals(stripWww(b));
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
