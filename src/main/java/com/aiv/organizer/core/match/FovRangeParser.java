package com.aiv.organizer.core.match;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses user FOV expressions such as {@code "1,3,5/7"} into decimal strings.
 * A token is either all digits or an inclusive {@code start/end} range with {@code start <= end}.
 */
public final class FovRangeParser {
    private static final int MAX_RANGE_SIZE = 100_000;

    private FovRangeParser() {
    }

    public static FovRangeParseResult parse(String expression) {
        LinkedHashSet<String> accepted = new LinkedHashSet<>();
        List<String> rejected = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return new FovRangeParseResult(accepted, rejected);
        }
        for (String raw : expression.split(",")) {
            String token = raw.trim();
            if (token.isEmpty()) {
                continue;
            }
            if (token.contains("/")) {
                if (!expandRange(token, accepted)) {
                    rejected.add(token);
                }
            } else if (isAllDigits(token)) {
                accepted.add(token);
            } else {
                rejected.add(token);
            }
        }
        return new FovRangeParseResult(accepted, rejected);
    }

    /**
     * Lenient variant used by batch procedures: invalid tokens are dropped.
     *
     * @return the accepted FOV numbers, or null when nothing was accepted
     */
    public static Set<String> parseFovRangeExpression(String expression) {
        FovRangeParseResult result = parse(expression);
        return result.isEmpty() ? null : result.fovNumbers();
    }

    private static boolean expandRange(String token, Set<String> out) {
        String[] bounds = token.split("/", -1);
        if (bounds.length != 2) {
            return false;
        }
        String startText = bounds[0].trim();
        String endText = bounds[1].trim();
        if (!isAllDigits(startText) || !isAllDigits(endText)) {
            return false;
        }
        long start;
        long end;
        try {
            start = Long.parseLong(startText);
            end = Long.parseLong(endText);
        } catch (NumberFormatException e) {
            return false;
        }
        if (start > end || end - start >= MAX_RANGE_SIZE) {
            return false;
        }
        for (long n = start; n <= end; n++) {
            out.add(Long.toString(n));
        }
        return true;
    }

    private static boolean isAllDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
