package com.stock.pulse.engine.web;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.constants.PipelineConsts;
import com.stock.pulse.engine.common.exception.Http;
import com.stock.pulse.engine.dto.RunPipelineRequest;
import com.stock.pulse.engine.dto.SchedulerRequest;
import com.stock.pulse.engine.dto.SymbolsRequest;
import com.stock.pulse.engine.dto.TestApiRequest;
import com.stock.pulse.engine.service.pipeline.PipelineScheduler;
import com.stock.pulse.engine.service.pipeline.PipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

    private final PipelineService pipeline;
    private final PipelineScheduler scheduler;

    @PostMapping("/run")
    public ResponseEntity<?> run(@RequestBody(required = false) RunPipelineRequest req) {
        RunPipelineRequest r = req == null ? new RunPipelineRequest() : req;
        String type = r.getExtractionType() == null ? PipelineConsts.Jobs.DEFAULT_EXTRACTION_TYPE : r.getExtractionType();
        log.info("Pipeline run requested: {} symbols, type={}", r.getSymbols() == null ? "all" : r.getSymbols().size(), type);
        return Http.from(pipeline.trigger(r.getSymbols(), type));
    }

    @PostMapping("/jobs/{id}/stop")
    public ResponseEntity<?> stop(@PathVariable("id") String id) {
        log.info("Stop requested for job {}", id);
        return Http.from(pipeline.stopJob(id));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("pipeline", pipeline.status());
        out.put("scheduler", scheduler.state());
        return Http.from(Result.ok(out));
    }

    @GetMapping("/jobs")
    public ResponseEntity<?> jobs(@RequestParam(name = "limit", defaultValue = "20") int limit) {
        return Http.from(Result.ok(pipeline.jobs(Math.min(Math.max(limit, 1), 100))));
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<?> job(@PathVariable("id") String id) {
        return Http.from(pipeline.getJob(id));
    }

    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return Http.from(Result.ok(pipeline.history(Math.min(Math.max(limit, 1), 100))));
    }

    @GetMapping("/logs")
    public ResponseEntity<?> logs(@RequestParam(name = "event_type", required = false) String eventType,
                                  @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return Http.from(Result.ok(pipeline.logs(eventType, Math.min(Math.max(limit, 1), 1000))));
    }

    @GetMapping("/metrics")
    public ResponseEntity<?> metrics() {
        return Http.from(Result.ok(pipeline.metrics()));
    }

    @GetMapping("/data-summary")
    public ResponseEntity<?> dataSummary() {
        return Http.from(Result.ok(pipeline.dataSummary()));
    }

    // ---- scheduler ----

    @PostMapping("/scheduler/start")
    public ResponseEntity<?> startScheduler(@RequestBody(required = false) SchedulerRequest req) {
        int minutes = req == null || req.getIntervalMinutes() == null
                ? scheduler.state().intervalMinutes() : req.getIntervalMinutes();
        return Http.from(Result.ok(scheduler.start(minutes)));
    }

    @PostMapping("/scheduler/stop")
    public ResponseEntity<?> stopScheduler() {
        return Http.from(Result.ok(scheduler.stop()));
    }

    @PutMapping("/scheduler/config")
    public ResponseEntity<?> configureScheduler(@RequestBody SchedulerRequest req) {
        return Http.from(Result.ok(scheduler.configure(req.getIntervalMinutes(), req.getAutoStart())));
    }

    // ---- symbol universe ----

    @GetMapping("/symbol-categories")
    public ResponseEntity<?> symbolCategories() {
        return Http.from(Result.ok(pipeline.symbolCategories()));
    }

    @PostMapping("/symbols/add")
    public ResponseEntity<?> addSymbols(@Valid @RequestBody SymbolsRequest req) {
        return Http.from(Result.ok(pipeline.addSymbols(req.getSymbols(), req.getCategory())));
    }

    @PostMapping("/symbols/remove")
    public ResponseEntity<?> removeSymbols(@Valid @RequestBody SymbolsRequest req) {
        return Http.from(Result.ok(pipeline.removeSymbols(req.getSymbols())));
    }

    @PostMapping("/test-api")
    public ResponseEntity<?> testApi(@RequestBody(required = false) TestApiRequest req) {
        return Http.from(Result.ok(pipeline.testConnection(req == null ? null : req.getSymbol())));
    }
}
