package ru.javaboys.huntysourcing.engine;

import org.apache.commons.lang3.StringUtils;
import ru.javaboys.huntysourcing.engine.score.FitScorer;
import ru.javaboys.huntysourcing.engine.text.TextNormalizer;

import java.util.Locale;

/**
 * Dedup fingerprint of a candidate: email, else profile URL, else name + company + title.
 */
public final class IdentityKeys {

    private IdentityKeys() {
    }

    public static String of(Candidate c) {
        String email = c.getEmail();
        if (StringUtils.isNotBlank(email) && !FitScorer.NO_EMAIL.equalsIgnoreCase(email.trim())) {
            return "email:" + email.trim().toLowerCase(Locale.ROOT);
        }
        String url = normalizeUrl(c.getUrl());
        if (!url.isEmpty()) {
            return "url:" + url;
        }
        return "person:" + TextNormalizer.normalize(c.getFullName())
                + "|" + TextNormalizer.normalize(c.getCompany())
                + "|" + TextNormalizer.normalize(c.getTitle());
    }

    static String normalizeUrl(String url) {
        if (StringUtils.isBlank(url)) return "";
        String u = url.trim().toLowerCase(Locale.ROOT);
        u = u.replaceFirst("^[a-z]+://", "");
        u = u.replaceFirst("^www\\.", "");
        u = u.replaceFirst("^[a-z]{2}\\.linkedin\\.com", "linkedin.com");
        int q = u.indexOf('?');
        if (q >= 0) u = u.substring(0, q);
        int h = u.indexOf('#');
        if (h >= 0) u = u.substring(0, h);
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }
}
