package com.stock.pulse.engine.web;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.exception.Http;
import com.stock.pulse.engine.dto.ScreenerQuery;
import com.stock.pulse.engine.service.persistence.TimeSeriesStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/screener")
@RequiredArgsConstructor
public class ScreenerController {

    private final TimeSeriesStore store;

    @PostMapping
    public ResponseEntity<?> screen(@Valid @RequestBody ScreenerQuery query) {
        List<Map<String, Object>> rows = store.screen(query);
        return Http.from(Result.ok(Map.of("count", rows.size(), "results", rows)));
    }
}
