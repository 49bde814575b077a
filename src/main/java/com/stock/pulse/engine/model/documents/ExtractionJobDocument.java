package com.stock.pulse.engine.model.documents;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Finished extraction job as kept for history. Keyed by job id so a re-save replaces it.
 */
@Document("pipeline_jobs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionJobDocument {

    @Id
    private String jobId;

    @Field("extraction_type")
    private String extractionType;

    private String status;
    private List<String> symbols;

    @Indexed
    @Field("created_at")
    private Instant createdAt;
    @Field("started_at")
    private Instant startedAt;
    @Field("completed_at")
    private Instant completedAt;

    @Field("success_count")
    private int successCount;
    @Field("failed_count")
    private int failedCount;
    @Field("skipped_count")
    private int skippedCount;
    @Field("data_points")
    private long dataPoints;

    @Field("fatal_error")
    private String fatalError;

    // symbol -> SUCCESS/FAILED/SKIPPED
    @Field("symbol_status")
    private Map<String, String> symbolStatus;

    private List<String> errors;
}
