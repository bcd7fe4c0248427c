package uk.gegc.mdexport.features.markdown.domain;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Produces anchor ids for headings, unique within one document.
 * Not thread-safe; create one per conversion.
 */
public class HeadingIdGenerator {

    private final Set<String> emitted = new HashSet<>();
    private final Map<String, Integer> suffixes = new HashMap<>();

    /**
     * Returns the heading's slug, or the slug with the lowest free numeric suffix when the
     * slug or a suffixed variant has already been handed out.
     */
    public String next(String text) {
        String slug = slugify(text);
        String id = slug;
        int suffix = suffixes.getOrDefault(slug, 0);
        while (emitted.contains(id)) {
            suffix++;
            id = slug + "-" + suffix;
        }
        suffixes.put(slug, suffix);
        emitted.add(id);
        return id;
    }

    static String slugify(String text) {
        if (text == null) {
            return "section";
        }
        String slug = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
        return slug.isEmpty() ? "section" : slug;
    }
}
