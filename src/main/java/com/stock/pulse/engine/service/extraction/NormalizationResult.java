package com.stock.pulse.engine.service.extraction;

import com.stock.pulse.engine.model.canonical.CanonicalFields;

import java.util.List;

/**
 * @param fields   canonical values that survived validation
 * @param warnings one entry per dropped value
 * @param unmapped upstream keys with no canonical counterpart
 */
public record NormalizationResult(CanonicalFields fields, List<String> warnings, List<String> unmapped) {

    public NormalizationResult {
        warnings = List.copyOf(warnings);
        unmapped = List.copyOf(unmapped);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
