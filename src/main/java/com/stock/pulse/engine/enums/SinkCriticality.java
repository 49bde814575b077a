package com.stock.pulse.engine.enums;

public enum SinkCriticality {
    /** failure propagates and stops the job */
    AUTHORITATIVE,
    /** failure is logged and the write continues with the next sink */
    BEST_EFFORT
}
