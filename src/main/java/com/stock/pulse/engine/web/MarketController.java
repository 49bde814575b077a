package com.stock.pulse.engine.web;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.exception.Http;
import com.stock.pulse.engine.service.persistence.CacheService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
public class MarketController {

    private final CacheService cache;

    /**
     * Gainers and losers of the last finished job.
     */
    @GetMapping("/top-movers")
    public ResponseEntity<?> topMovers(@RequestParam(name = "count", defaultValue = "10") int count) {
        return Http.from(Result.ok(cache.topMovers(Math.min(Math.max(count, 1), 50))));
    }
}
