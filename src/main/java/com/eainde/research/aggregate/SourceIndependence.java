package com.eainde.research.aggregate;

import com.eainde.research.model.Source;
import com.eainde.research.text.UrlDomains;

import java.util.Locale;

/**
 * Decides whether two sources corroborate a claim independently.
 *
 * <p>Independent when all hold:</p>
 * <ol>
 *   <li>different registered sites (subdomains of one site count as the same)</li>
 *   <li>different authors (both known and distinct) OR different organizations
 *       (organization defaults to the site)</li>
 *   <li>neither republishes the other, and they do not republish the same original</li>
 * </ol>
 * Publication date plays no part.
 */
public class SourceIndependence {

    public boolean independent(Source a, Source b) {
        if (a.url().equals(b.url())) return false;
        if (a.domain().equals(b.domain()) || UrlDomains.sameSite(a.domain(), b.domain())) return false;
        if (!differentAuthors(a, b) && !differentOrganizations(a, b)) return false;
        return !republishes(a, b);
    }

    private static boolean differentAuthors(Source a, Source b) {
        if (isBlank(a.author()) || isBlank(b.author())) return false;
        return !normalize(a.author()).equals(normalize(b.author()));
    }

    private static boolean differentOrganizations(Source a, Source b) {
        return !normalize(organizationOf(a)).equals(normalize(organizationOf(b)));
    }

    private static boolean republishes(Source a, Source b) {
        if (UrlDomains.sameResource(a.republishedFrom(), b.url())) return true;
        if (UrlDomains.sameResource(b.republishedFrom(), a.url())) return true;
        return UrlDomains.sameResource(a.republishedFrom(), b.republishedFrom());
    }

    private static String organizationOf(Source source) {
        return isBlank(source.organization()) ? UrlDomains.siteOf(source.domain()) : source.organization();
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
