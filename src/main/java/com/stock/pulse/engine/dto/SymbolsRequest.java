package com.stock.pulse.engine.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
public class SymbolsRequest {
    @NotEmpty
    private List<String> symbols;
    private String category;
}
