package com.stock.pulse.engine.service.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stock.pulse.engine.enums.PayloadShape;

import java.util.List;
import java.util.Optional;

/**
 * Quote wrapped one level down: under {@code data}, {@code quote}, {@code result} or the symbol.
 */
public class NestedPayloadDecoder implements PayloadDecoder {

    private static final List<String> WRAPPER_KEYS = List.of("data", "quote", "result");

    @Override
    public PayloadShape shape() {
        return PayloadShape.NESTED_UNDER_KEY;
    }

    @Override
    public Optional<ObjectNode> decode(String symbol, JsonNode root) {
        if (!root.isObject()) return Optional.empty();
        for (String k : WRAPPER_KEYS) {
            JsonNode inner = root.get(k);
            if (inner != null && inner.isObject()) {
                return PayloadDecoder.underSymbolKey(symbol, inner).or(() -> Optional.of((ObjectNode) inner));
            }
        }
        return PayloadDecoder.underSymbolKey(symbol, root);
    }
}
