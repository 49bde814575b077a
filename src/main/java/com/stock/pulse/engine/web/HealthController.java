package com.stock.pulse.engine.web;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.exception.Http;
import com.stock.pulse.engine.service.health.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/database")
@RequiredArgsConstructor
public class HealthController {

    private final HealthService health;

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return Http.from(Result.ok(health.check()));
    }
}
