package com.visionai.gateway.core.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.visionai.gateway.core.model.BusMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON text encoding shared by the transports.
 *
 * <h2>Encoding</h2>
 * <ul>
 *   <li>{@link String} payloads pass through unchanged.</li>
 *   <li>Anything else is written with the application {@link ObjectMapper}.</li>
 * </ul>
 *
 * <h2>Decoding</h2>
 * Any JSON value (object, array, scalar, {@code null}) becomes a parsed {@link BusMessage}; objects are
 * additionally exposed as fields. Text that is not a single JSON value becomes an unparsed message carrying
 * only the raw text. Decoding never throws.
 */
public class MessageCodec {

    private static final Logger log = LoggerFactory.getLogger(MessageCodec.class);

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.reader = mapper.readerFor(Object.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public String encode(Object data) {
        if (data instanceof String s) {
            return s;
        }
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    public BusMessage decode(String channel, String text) {
        if (text == null || text.isBlank()) {
            return BusMessage.unparsed(channel, text);
        }
        try {
            return BusMessage.parsed(channel, text, reader.readValue(text));
        } catch (JsonProcessingException e) {
            log.warn("Delivering unparsed message on channel={} err={}", channel, e.getOriginalMessage());
            return BusMessage.unparsed(channel, text);
        }
    }
}
