package com.stock.pulse.engine.model.documents;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Insert-only record of one symbol's normalized extraction. Never updated.
 */
@Document("extraction_logs")
@CompoundIndex(name = "symbol_source_ts_idx", def = "{'symbol': 1, 'source': 1, 'ts': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionAuditLog {

    private @Id String id;

    @Indexed
    @Field("job_id")
    private String jobId;

    private String symbol;
    private String source;      // e.g. "groww"
    private Instant ts;

    @Field("payload_shape")
    private String payloadShape;

    @Field("field_count")
    private int fieldCount;

    // canonical key -> value; dates and timestamps as ISO strings
    private Map<String, Object> fields;

    private List<String> warnings;
}
