package com.stock.pulse.engine.scoring;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Confidence and its four terms, each 0-100.
 */
@Value
@Builder
@Jacksonized
public class ConfidenceBreakdown {
    double score;
    double completeness;
    double freshness;
    double sourceAgreement;
    double modelConfidence;
    int expectedFields;
    int availableFields;
    int agreementChecks;
}
