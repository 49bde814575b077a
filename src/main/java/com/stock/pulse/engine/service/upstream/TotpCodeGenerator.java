package com.stock.pulse.engine.service.upstream;

import com.stock.pulse.engine.common.exception.AuthenticationException;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Six-digit SHA1 TOTP codes with a 30 second step, seeded from the base32 secret
 * registered with the provider.
 */
@Component
public class TotpCodeGenerator {

    private static final int PERIOD_SECONDS = 30;

    private final CodeGenerator generator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, 6);
    private final Clock clock;

    public TotpCodeGenerator(Clock clock) {
        this.clock = clock;
    }

    public String currentCode(String secret) {
        long counter = Math.floorDiv(clock.instant().getEpochSecond(), PERIOD_SECONDS);
        try {
            return generator.generate(secret, counter);
        } catch (CodeGenerationException e) {
            throw new AuthenticationException("Failed to generate TOTP code", e);
        }
    }
}
