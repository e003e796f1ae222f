package com.aiv.organizer.core.match;

import java.util.Collection;
import java.util.Locale;

/**
 * Pure name rules shared by every procedure: format eligibility and identifier extraction
 * from inspection file and folder names. No I/O.
 */
public final class IdentifierMatcher {
    public static final int SAMPLE_KEY_LENGTH = 15;

    private static final String JPG_SUFFIX = ".jpg";
    private static final String FOV_TAG = "fov";

    private IdentifierMatcher() {
    }

    /**
     * Tests a file name against a format set. A {@code .jpg} name is only ever matched through
     * the semantic tokens: {@code org_jpg} when the name has no {@code fov} in it, {@code fov_jpg}
     * when it has.
     */
    public static boolean isValidFile(String filename, Collection<String> formats) {
        if (filename == null || formats == null || formats.isEmpty()) {
            return false;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(JPG_SUFFIX)) {
            boolean fovTagged = lower.contains(FOV_TAG);
            for (String format : formats) {
                String token = normalize(format);
                if (FormatSelection.ORIGINAL_JPG.equals(token) && !fovTagged) {
                    return true;
                }
                if (FormatSelection.FOV_JPG.equals(token) && fovTagged) {
                    return true;
                }
            }
            return false;
        }
        for (String format : formats) {
            String token = normalize(format);
            if (token.isEmpty()
                    || FormatSelection.ORIGINAL_JPG.equals(token)
                    || FormatSelection.FOV_JPG.equals(token)) {
                continue;
            }
            if (lower.endsWith(token)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Identifier encoded before the first underscore: {@code "fov12_a.bmp" -> "12"},
     * {@code "7_b.png" -> "7"}. Returns null when there is no underscore or no digit.
     */
    public static String extractNumericPrefix(String filename) {
        if (filename == null) {
            return null;
        }
        int underscore = filename.indexOf('_');
        if (underscore < 0) {
            return null;
        }
        return digitsOnly(stripFovTag(filename.substring(0, underscore)));
    }

    /**
     * FOV number of an Attach-FOV capture such as {@code fov3_x.jpg} or {@code FOV12.jpg}: the part
     * before the first underscore, or the whole base name when there is none.
     */
    public static String extractFovNumber(String filename) {
        if (filename == null) {
            return null;
        }
        String base = stripExtension(filename);
        int underscore = base.indexOf('_');
        String head = underscore < 0 ? base : base.substring(0, underscore);
        return digitsOnly(stripFovTag(head));
    }

    /** True for capture names that open with the {@code fov} tag, in any case. */
    public static boolean startsWithFovTag(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).startsWith(FOV_TAG);
    }

    /**
     * Trailing characters of a folder name used to pair the same sample across two trees.
     */
    public static String lastCharacters(String name, int count) {
        if (name == null) {
            return "";
        }
        return name.length() <= count ? name : name.substring(name.length() - count);
    }

    public static String sampleKey(String folderName) {
        return lastCharacters(folderName, SAMPLE_KEY_LENGTH);
    }

    public static String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot <= 0 ? filename : filename.substring(0, dot);
    }

    public static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot <= 0 ? "" : filename.substring(dot);
    }

    private static String stripFovTag(String text) {
        if (text.toLowerCase(Locale.ROOT).startsWith(FOV_TAG)) {
            return text.substring(FOV_TAG.length());
        }
        return text;
    }

    private static String digitsOnly(String text) {
        StringBuilder digits = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.length() == 0 ? null : digits.toString();
    }

    private static String normalize(String format) {
        return format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
    }
}
