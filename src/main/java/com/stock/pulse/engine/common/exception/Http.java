package com.stock.pulse.engine.common.exception;

import com.stock.pulse.engine.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");
        if (r.isOk()) return ResponseEntity.ok(r.getData());

        String code = r.getErrorCode();
        if (code == null) {
            return ResponseEntity.badRequest().body(new ErrorResponse(null, r.getError(), r.getTimestamp()));
        }
        return ResponseEntity.status(statusFor(code)).body(new ErrorResponse(code, r.getError(), r.getTimestamp()));
    }

    static HttpStatus statusFor(String code) {
        return switch (code) {
            case "ERR-NOT-FOUND" -> HttpStatus.NOT_FOUND;
            case "ERR-VAL-001", "ERR-VAL-002", "ERR-VAL-003", "ERR-REQ-001", "ERR-REQ-003" -> HttpStatus.BAD_REQUEST;
            case "ERR-JOB-409" -> HttpStatus.CONFLICT;
            case "ERR-AUTH-101", "ERR-AUTH-102", "ERR-UPS-001", "ERR-UPS-002", "ERR-UPS-429" -> HttpStatus.BAD_GATEWAY;
            case "ERR-NRM-001", "ERR-SCR-001" -> HttpStatus.UNPROCESSABLE_ENTITY;
            case "ERR-DB-101", "ERR-DB-002" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    /**
     * Error body returned to clients.
     */
    private record ErrorResponse(String code, String message, Instant timestamp) {
    }
}
