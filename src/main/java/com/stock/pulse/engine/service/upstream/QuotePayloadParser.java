package com.stock.pulse.engine.service.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stock.pulse.engine.common.exception.NormalizationException;
import com.stock.pulse.engine.common.exception.TransientNetworkException;
import com.stock.pulse.engine.enums.PayloadShape;

import java.util.List;
import java.util.Optional;

/**
 * Tries each known payload layout in order. No match is a {@link NormalizationException};
 * a body that is not JSON at all is treated as a transient transport problem.
 */
public class QuotePayloadParser {

    private final ObjectMapper mapper;
    private final List<PayloadDecoder> decoders = List.of(
            new EnvelopePayloadDecoder(),
            new NestedPayloadDecoder(),
            new FlatPayloadDecoder());

    public QuotePayloadParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Decoded parse(String symbol, int status, String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new TransientNetworkException(status, "Malformed upstream body for " + symbol, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new TransientNetworkException(status, "Empty upstream body for " + symbol);
        }
        for (PayloadDecoder d : decoders) {
            Optional<ObjectNode> fields = d.decode(symbol, root);
            if (fields.isPresent()) return new Decoded(d.shape(), fields.get());
        }
        throw new NormalizationException("Unrecognised payload shape for " + symbol);
    }

    public record Decoded(PayloadShape shape, ObjectNode fields) {
    }
}
