package com.keystone.security.tenant;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches request paths against a public route template such as {@code /public/book/{slug}}.
 *
 * <p>The slug segment accepts {@code [a-z0-9-]+}, case-insensitively, and is returned in lower
 * case. Trailing path segments are allowed.
 */
public final class PublicSlugRoute {

    private static final String SLUG = "{slug}";

    private final String template;
    private final Pattern pattern;

    public PublicSlugRoute(String template) {
        int at = template == null ? -1 : template.indexOf(SLUG);
        if (at < 0) {
            throw new IllegalArgumentException("route template must contain " + SLUG);
        }
        this.template = template;
        String prefix = template.substring(0, at);
        String suffix = template.substring(at + SLUG.length());
        this.pattern = Pattern.compile(
                "^" + Pattern.quote(prefix) + "([a-z0-9-]+)" + Pattern.quote(suffix) + "(?:/.*)?$",
                Pattern.CASE_INSENSITIVE);
    }

    public Optional<String> extractSlug(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(path);
        return matcher.matches()
                ? Optional.of(matcher.group(1).toLowerCase(Locale.ROOT))
                : Optional.empty();
    }

    public String template() {
        return template;
    }
}
