package com.textcache.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Actionable suggestion derived from invalidation statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationRecommendation {
    private Severity severity;
    private String issue;
    private String message;
    private List<String> suggestions;
}
