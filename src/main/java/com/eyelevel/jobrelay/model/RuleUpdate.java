package com.eyelevel.jobrelay.model;

import java.util.List;

/**
 * Outcome of adding items to a rule category. {@code added} is empty when every item was already present.
 */
public record RuleUpdate(String category, List<String> added, String message) {

    public boolean changed() {
        return !added.isEmpty();
    }
}
