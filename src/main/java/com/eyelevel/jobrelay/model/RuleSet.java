package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The JSON document stored at {@code rules/active_rules.json}. Workers read the {@code rules}
 * categories on every job; their values are lists, numbers or flags depending on the category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleSet {

    private String version;
    private String lastUpdated;
    @Builder.Default
    private Map<String, Object> rules = new LinkedHashMap<>();
}
