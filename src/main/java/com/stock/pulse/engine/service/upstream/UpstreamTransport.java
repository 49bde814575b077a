package com.stock.pulse.engine.service.upstream;

import java.io.IOException;

/**
 * Wire-level quote call. Implementations do no retrying and no status interpretation.
 */
public interface UpstreamTransport {

    UpstreamResponse execute(UpstreamRequest request, String bearerToken) throws IOException, InterruptedException;
}
