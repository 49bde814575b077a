package com.stock.pulse.engine.service.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stock.pulse.engine.enums.FieldCategory;
import com.stock.pulse.engine.enums.PayloadShape;
import com.stock.pulse.engine.service.extraction.FieldSynonyms;

import java.util.Iterator;
import java.util.Optional;

/**
 * Quote fields straight at the top level. Accepted only when at least one top-level
 * key is a known price or volume field, so unrelated objects fall through.
 */
public class FlatPayloadDecoder implements PayloadDecoder {

    @Override
    public PayloadShape shape() {
        return PayloadShape.FLAT;
    }

    @Override
    public Optional<ObjectNode> decode(String symbol, JsonNode root) {
        if (!root.isObject()) return Optional.empty();
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            boolean priceField = FieldSynonyms.resolveRaw(names.next())
                    .map(f -> f.category() == FieldCategory.PRICE_VOLUME)
                    .orElse(false);
            if (priceField) return Optional.of((ObjectNode) root);
        }
        return Optional.empty();
    }
}
