package com.stock.pulse.engine.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class SchedulerRequest {
    private Integer intervalMinutes;
    private Boolean autoStart;
}
