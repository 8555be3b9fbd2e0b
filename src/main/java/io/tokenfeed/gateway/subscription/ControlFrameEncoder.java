package io.tokenfeed.gateway.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tokenfeed.gateway.model.ControlFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes control frames to the feed's JSON request format.
 * Thread-safe and reusable.
 *
 * <pre>
 * {"method":"subscribeNewToken"}
 * {"method":"subscribeTokenTrade","keys":["MINT_A","MINT_B"]}
 * </pre>
 */
public class ControlFrameEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFrameEncoder.class);

    private final ObjectMapper objectMapper;

    public ControlFrameEncoder() {
        this(new ObjectMapper());
    }

    public ControlFrameEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ControlFrame frame) {
        ObjectNode root = objectMapper.createObjectNode();
        String method = frame.action() == ControlFrame.Action.SUBSCRIBE
            ? frame.kind().subscribeMethod()
            : frame.kind().unsubscribeMethod();
        root.put("method", method);

        if (frame.kind().keyed()) {
            ArrayNode keys = root.putArray("keys");
            frame.topics().forEach(keys::add);
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode control frame: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to encode control frame", e);
        }
    }
}
