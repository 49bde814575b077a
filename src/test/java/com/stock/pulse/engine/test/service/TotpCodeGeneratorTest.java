package com.stock.pulse.engine.test.service;

import com.stock.pulse.engine.service.upstream.TotpCodeGenerator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TotpCodeGeneratorTest {

    // base32 of the ASCII seed "12345678901234567890"
    private static final String SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private static String codeAt(long epochSecond) {
        return new TotpCodeGenerator(Clock.fixed(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC)).currentCode(SECRET);
    }

    @Test
    void matchesPublishedSha1Vectors() {
        assertThat(codeAt(59L)).isEqualTo("287082");
        assertThat(codeAt(1111111109L)).isEqualTo("081804");
        assertThat(codeAt(1234567890L)).isEqualTo("005924");
    }

    @Test
    void codeIsStableWithinAStep() {
        assertThat(codeAt(60L)).isEqualTo(codeAt(89L));
    }
}
