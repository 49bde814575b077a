package com.stock.pulse.engine.web;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.exception.Http;
import com.stock.pulse.engine.service.analysis.AnalysisService;
import com.stock.pulse.engine.service.persistence.CacheService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/stocks")
@RequiredArgsConstructor
public class StockController {

    private final CacheService cache;
    private final AnalysisService analysis;

    /**
     * Cached quote, else the latest stored price.
     */
    @GetMapping("/{symbol}/quote")
    public ResponseEntity<?> quote(@PathVariable("symbol") String symbol) {
        return Http.from(cache.quote(symbol)
                .map(Result::ok)
                .orElseGet(() -> Result.fail("ERR-NOT-FOUND", "No quote for " + symbol)));
    }

    @GetMapping("/{symbol}/analysis")
    public ResponseEntity<?> analysis(@PathVariable("symbol") String symbol,
                                      @RequestParam(name = "refresh", defaultValue = "false") boolean refresh) {
        return Http.from(analysis.analyze(symbol, refresh));
    }
}
