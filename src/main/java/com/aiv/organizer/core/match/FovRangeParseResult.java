package com.aiv.organizer.core.match;

import java.util.List;
import java.util.Set;

/**
 * Outcome of parsing a FOV number expression. Callers decide whether rejected tokens are
 * fatal (interactive validation) or merely reported (batch runs).
 */
public record FovRangeParseResult(Set<String> fovNumbers, List<String> rejectedTokens) {
    public FovRangeParseResult {
        fovNumbers = Set.copyOf(fovNumbers);
        rejectedTokens = List.copyOf(rejectedTokens);
    }

    public boolean isEmpty() {
        return fovNumbers.isEmpty();
    }

    public boolean hasRejectedTokens() {
        return !rejectedTokens.isEmpty();
    }
}
