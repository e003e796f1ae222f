package com.aiv.organizer.core.fs;

import java.util.Locale;
import java.util.Set;

/**
 * Classification and by-product folder names that never name an inspected sample.
 */
public final class IgnoredFolders {
    /** {@code ok}, {@code ng}, {@code ng_info}, {@code crop}, {@code thumbnail}. */
    public static final Set<String> DEFAULT = Set.of("ok", "ng", "ng_info", "crop", "thumbnail");

    /** Verdict folders only; used for the NG count yield denominator. */
    public static final Set<String> CLASSIFICATION = Set.of("ok", "ng", "ng_info");

    private IgnoredFolders() {
    }

    public static boolean isIgnored(String folderName, Set<String> ignoreNames) {
        if (folderName == null || ignoreNames == null || ignoreNames.isEmpty()) {
            return false;
        }
        return ignoreNames.contains(folderName.toLowerCase(Locale.ROOT));
    }
}
