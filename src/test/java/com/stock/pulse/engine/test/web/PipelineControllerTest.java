package com.stock.pulse.engine.test.web;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.exception.GlobalExceptionHandler;
import com.stock.pulse.engine.common.exception.ValidationException;
import com.stock.pulse.engine.config.CustomConfig;
import com.stock.pulse.engine.service.pipeline.JobSnapshot;
import com.stock.pulse.engine.service.pipeline.PipelineScheduler;
import com.stock.pulse.engine.service.pipeline.PipelineService;
import com.stock.pulse.engine.service.pipeline.SymbolUniverse;
import com.stock.pulse.engine.web.PipelineController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PipelineControllerTest {

    private PipelineService pipeline;
    private PipelineScheduler scheduler;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        pipeline = mock(PipelineService.class);
        scheduler = mock(PipelineScheduler.class);
        mvc = MockMvcBuilders.standaloneSetup(new PipelineController(pipeline, scheduler))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new CustomConfig().mapper()))
                .build();
    }

    @Test
    void runReturnsThePendingJob() throws Exception {
        when(pipeline.trigger(eq(List.of("TCS")), anyString()))
                .thenReturn(Result.ok(JobSnapshot.builder().jobId("j1").status("pending").totalSymbols(1).build()));

        mvc.perform(post("/api/pipeline/run").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\": [\"TCS\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value("j1"))
                .andExpect(jsonPath("$.total_symbols").value(1));
    }

    @Test
    void runWhileBusyIsAConflict() throws Exception {
        when(pipeline.trigger(any(), anyString()))
                .thenReturn(Result.fail(PipelineService.JOB_RUNNING, "Job j0 is already running"));

        mvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ERR-JOB-409"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(pipeline.getJob("nope")).thenReturn(Result.fail("ERR-NOT-FOUND", "Job not found: nope"));

        mvc.perform(get("/api/pipeline/jobs/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: nope"));
    }

    @Test
    void badSchedulerIntervalIsABadRequest() throws Exception {
        when(scheduler.start(anyInt())).thenThrow(new ValidationException("Interval must be between 5 and 1440 minutes, got 2"));

        mvc.perform(post("/api/pipeline/scheduler/start").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"interval_minutes\": 2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ERR-VAL-001"));
        verify(scheduler).start(2);
    }

    @Test
    void addingSymbolsNeedsAList() throws Exception {
        mvc.perform(post("/api/pipeline/symbols/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ERR-VAL-003"));
        verifyNoInteractions(pipeline);
    }

    @Test
    void addingSymbolsReportsTheChange() throws Exception {
        when(pipeline.addSymbols(anyList(), eq("watch_list")))
                .thenReturn(new SymbolUniverse.ChangeResult(List.of("NEWCO"), List.of(), 144));

        mvc.perform(post("/api/pipeline/symbols/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\": [\"newco\"], \"category\": \"watch_list\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed[0]").value("NEWCO"))
                .andExpect(jsonPath("$.total_symbols").value(144));
    }
}
