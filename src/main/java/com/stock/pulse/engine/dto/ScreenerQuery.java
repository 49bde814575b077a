package com.stock.pulse.engine.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreenerQuery {

    @Valid
    @Builder.Default
    private List<ScreenerFilter> filters = new ArrayList<>();

    // restricts the result to these symbols when non-empty
    private List<String> symbols;

    private String sortBy;

    // asc or desc
    private String sortOrder;

    private Integer limit;
}
