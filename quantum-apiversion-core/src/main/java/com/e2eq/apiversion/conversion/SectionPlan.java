package com.e2eq.apiversion.conversion;

import java.util.List;

/**
 * Field mappings for one section ({@code spec} or {@code status}) in both directions.
 *
 * @param section            section name
 * @param toHub              spoke to hub copies
 * @param fromHub            hub to spoke copies
 * @param unmatchedHubFields hub fields no spoke field populates; they stay zero-valued on convertTo
 * @param lossySpokeFields   spoke fields with no hub counterpart; their values are dropped on convertTo
 */
public record SectionPlan(String section,
                          List<FieldMapping> toHub,
                          List<FieldMapping> fromHub,
                          List<String> unmatchedHubFields,
                          List<String> lossySpokeFields) {

    public SectionPlan {
        toHub = List.copyOf(toHub);
        fromHub = List.copyOf(fromHub);
        unmatchedHubFields = List.copyOf(unmatchedHubFields);
        lossySpokeFields = List.copyOf(lossySpokeFields);
    }

    public boolean isLossless() {
        return unmatchedHubFields.isEmpty() && lossySpokeFields.isEmpty();
    }
}
