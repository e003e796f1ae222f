package com.aiv.organizer.core.match;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Requested image formats: literal suffixes such as {@code .bmp} or {@code .png}, plus the
 * semantic tokens {@link #ORIGINAL_JPG} and {@link #FOV_JPG}.
 */
public record FormatSelection(Set<String> tokens) {
    public static final String ORIGINAL_JPG = "org_jpg";
    public static final String FOV_JPG = "fov_jpg";

    public FormatSelection {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        if (tokens != null) {
            for (String token : tokens) {
                if (token != null && !token.isBlank()) {
                    normalized.add(token.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        tokens = Set.copyOf(normalized);
    }

    public static FormatSelection of(String... tokens) {
        return new FormatSelection(new LinkedHashSet<>(Arrays.asList(tokens)));
    }

    public static FormatSelection of(Collection<String> tokens) {
        return new FormatSelection(tokens == null ? Set.of() : new LinkedHashSet<>(tokens));
    }

    public static FormatSelection none() {
        return new FormatSelection(Set.of());
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean accepts(String filename) {
        return IdentifierMatcher.isValidFile(filename, tokens);
    }
}
