package com.eainde.research.text;

import com.google.common.net.InternetDomainName;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Extracts the comparable domain of a source URL: lower-cased host without a leading
 * {@code www.}. URLs without a scheme ("aws.com/blog") are accepted.
 */
public final class UrlDomains {

    private UrlDomains() {
    }

    public static String domainOf(String url) {
        if (url == null || url.isBlank()) return "";
        String trimmed = url.trim();
        String host = hostOf(trimmed);
        if (host == null && !trimmed.contains("://")) {
            host = hostOf("https://" + trimmed);
        }
        if (host == null) {
            host = fallbackHost(trimmed);
        }
        host = host.toLowerCase(Locale.ROOT);
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    /**
     * Reduces a domain to the site that registered it ({@code en.wikipedia.org} and
     * {@code de.wikipedia.org} both give {@code wikipedia.org}). Hosts outside the public
     * suffix list come back unchanged.
     */
    public static String siteOf(String domain) {
        if (domain == null || domain.isBlank()) return "";
        if (!InternetDomainName.isValid(domain)) return domain;
        InternetDomainName name = InternetDomainName.from(domain);
        return name.isUnderPublicSuffix() ? name.topPrivateDomain().toString() : domain;
    }

    /** Both domains belong to the same registered site. Empty domains never match. */
    public static boolean sameSite(String left, String right) {
        String a = siteOf(left);
        return !a.isEmpty() && a.equals(siteOf(right));
    }

    /** Two URLs refer to the same resource, ignoring case, scheme and a trailing slash. */
    public static boolean sameResource(String left, String right) {
        if (left == null || right == null || left.isBlank() || right.isBlank()) return false;
        return comparable(left).equals(comparable(right));
    }

    private static String comparable(String url) {
        String value = url.trim().toLowerCase(Locale.ROOT);
        int scheme = value.indexOf("://");
        if (scheme >= 0) value = value.substring(scheme + 3);
        if (value.startsWith("www.")) value = value.substring(4);
        while (value.endsWith("/")) value = value.substring(0, value.length() - 1);
        return value;
    }

    private static String hostOf(String url) {
        try {
            return new URI(url).getHost();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String fallbackHost(String url) {
        String value = url;
        int scheme = value.indexOf("://");
        if (scheme >= 0) value = value.substring(scheme + 3);
        int end = value.length();
        for (char c : new char[]{'/', '?', '#', ':'}) {
            int idx = value.indexOf(c);
            if (idx >= 0 && idx < end) end = idx;
        }
        return value.substring(0, end);
    }
}
