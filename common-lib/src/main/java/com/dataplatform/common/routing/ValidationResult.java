package com.dataplatform.common.routing;

import java.util.List;

/**
 * Pre-flight feedback on a request, produced without side effects.
 *
 * @param valid            false when the request cannot be served as stated
 * @param warnings         human-readable problems, in detection order
 * @param suggestedFilters concrete filter changes that would route better
 */
public record ValidationResult(
    boolean                valid,
    List<String>           warnings,
    List<SuggestedFilter>  suggestedFilters
) {

    public ValidationResult {
        warnings         = List.copyOf(warnings);
        suggestedFilters = List.copyOf(suggestedFilters);
    }

    /**
     * @param field          filter field to change, e.g. {@code "sector"} or {@code "entityKeys"}
     * @param suggestedValue replacement value; may be a list
     * @param reason         why the change helps
     */
    public record SuggestedFilter(String field, Object suggestedValue, String reason) {}
}
