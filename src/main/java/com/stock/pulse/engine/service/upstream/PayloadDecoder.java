package com.stock.pulse.engine.service.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stock.pulse.engine.enums.PayloadShape;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One known upstream payload layout.
 */
public interface PayloadDecoder {

    PayloadShape shape();

    /**
     * @return the quote object when {@code root} has this decoder's layout, empty otherwise
     */
    Optional<ObjectNode> decode(String symbol, JsonNode root);

    /**
     * Finds an object stored under the symbol itself, e.g. {@code "RELIANCE"} or {@code "NSE_RELIANCE"}.
     */
    static Optional<ObjectNode> underSymbolKey(String symbol, JsonNode node) {
        if (node == null || !node.isObject() || symbol == null) return Optional.empty();
        String want = symbol.toUpperCase(Locale.ROOT);
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String k = e.getKey().toUpperCase(Locale.ROOT);
            if ((k.equals(want) || k.endsWith("_" + want) || k.endsWith(":" + want)) && e.getValue().isObject()) {
                return Optional.of((ObjectNode) e.getValue());
            }
        }
        return Optional.empty();
    }
}
