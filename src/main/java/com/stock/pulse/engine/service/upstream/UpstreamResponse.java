package com.stock.pulse.engine.service.upstream;

public record UpstreamResponse(int status, String body) {

    public boolean is2xx() {
        return status / 100 == 2;
    }
}
