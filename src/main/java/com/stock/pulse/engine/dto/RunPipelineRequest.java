package com.stock.pulse.engine.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Manual trigger. No symbols means the whole universe.
 */
@Data
@NoArgsConstructor
public class RunPipelineRequest {
    private List<String> symbols;
    private String extractionType;
}
