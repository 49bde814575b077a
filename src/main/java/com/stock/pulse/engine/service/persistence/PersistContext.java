package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.enums.PayloadShape;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Where a record came from. {@code jobId} is null for writes outside a pipeline job.
 */
public record PersistContext(String jobId, String source, Instant asOf, PayloadShape shape, List<String> warnings) {

    public PersistContext {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(asOf, "asOf");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static PersistContext adhoc(String source, Instant asOf) {
        return new PersistContext(null, source, asOf, null, List.of());
    }
}
