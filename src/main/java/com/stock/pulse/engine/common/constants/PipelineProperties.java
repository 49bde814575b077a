package com.stock.pulse.engine.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "stockpulse.pipeline")
public class PipelineProperties {
    private int concurrency = 5;
    private int schedulerIntervalMinutes = 15;
    private boolean autoStart = true;
    private int historySize = 100;
    private int eventLogSize = 1000;
    private String zone = "Asia/Kolkata";
    private String source = "groww";
    private int technicalLookbackDays = 400;
}
