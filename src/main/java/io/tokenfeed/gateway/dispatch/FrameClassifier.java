package io.tokenfeed.gateway.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tokenfeed.gateway.model.FeedEvent;
import io.tokenfeed.gateway.model.Side;
import io.tokenfeed.gateway.model.TokenCreatedEvent;
import io.tokenfeed.gateway.model.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;

/**
 * Classifies raw feed frames into typed events.
 *
 * <p>The {@code txType} field discriminates the variant: {@code create} yields a
 * {@link TokenCreatedEvent}, {@code buy} and {@code sell} yield a {@link TradeEvent}.
 * Trade events are stamped with the tracked token count read at classification time.
 * Feed replies to control frames ({@code message} or {@code errors} objects) classify to
 * an empty result.
 */
public class FrameClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(FrameClassifier.class);

    private static final String TX_TYPE = "txType";
    private static final String TX_CREATE = "create";

    private final ObjectMapper objectMapper;
    private final IntSupplier trackedCount;
    private final LongSupplier clock;

    /**
     * @param trackedCount Supplies the number of desired token-trade topics
     */
    public FrameClassifier(IntSupplier trackedCount) {
        this(trackedCount, System::currentTimeMillis);
    }

    /**
     * @param trackedCount Supplies the number of desired token-trade topics
     * @param clock        Receive time for frames without a timestamp field, in milliseconds
     */
    public FrameClassifier(IntSupplier trackedCount, LongSupplier clock) {
        this.objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.trackedCount = trackedCount;
        this.clock = clock;
    }

    /**
     * Classifies a raw frame.
     *
     * @return the event, or empty for feed replies that carry no event
     * @throws MalformedFrameException if the frame is not a JSON object with a known
     *                                 {@code txType} and the fields that type requires
     */
    public Optional<FeedEvent> classify(String rawFrame) {
        if (rawFrame == null || rawFrame.isBlank()) {
            throw new MalformedFrameException("Empty frame");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawFrame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException("Frame is not a JSON object");
        }

        JsonNode txType = root.get(TX_TYPE);
        if (txType == null || !txType.isTextual()) {
            return classifyReply(root);
        }

        String type = txType.asText();
        if (TX_CREATE.equalsIgnoreCase(type)) {
            return Optional.of(parseCreated(root));
        }

        Side side = Side.fromString(type);
        if (side == Side.UNKNOWN) {
            throw new MalformedFrameException("Unknown txType: " + type);
        }
        return Optional.of(parseTrade(root, side));
    }

    private Optional<FeedEvent> classifyReply(JsonNode root) {
        JsonNode message = root.get("message");
        if (message != null && message.isTextual()) {
            LOGGER.info("Feed reply: {}", message.asText());
            return Optional.empty();
        }
        JsonNode errors = root.get("errors");
        if (errors != null) {
            LOGGER.warn("Feed reported errors: {}", errors.isTextual() ? errors.asText() : errors.toString());
            return Optional.empty();
        }
        throw new MalformedFrameException("Frame has no txType discriminator");
    }

    private TokenCreatedEvent parseCreated(JsonNode root) {
        return new TokenCreatedEvent(
            requiredText(root, "mint"),
            optionalText(root, "name"),
            optionalText(root, "symbol"),
            optionalText(root, "signature"),
            optionalText(root, "traderPublicKey"),
            optionalDecimal(root, "marketCapSol"),
            timestamp(root)
        );
    }

    private TradeEvent parseTrade(JsonNode root, Side side) {
        String mint = requiredText(root, "mint");
        BigDecimal solAmount = optionalDecimal(root, "solAmount");
        if (solAmount == null) {
            throw new MalformedFrameException("Trade frame for " + mint + " has no solAmount");
        }
        return new TradeEvent(
            mint,
            side,
            solAmount,
            optionalDecimal(root, "tokenAmount"),
            optionalText(root, "traderPublicKey"),
            optionalText(root, "signature"),
            optionalDecimal(root, "marketCapSol"),
            optionalDecimal(root, "tokensInPool"),
            optionalDecimal(root, "solInPool"),
            optionalText(root, "pool"),
            trackedCount.getAsInt(),
            timestamp(root)
        );
    }

    private long timestamp(JsonNode root) {
        JsonNode ts = root.get("timestamp");
        if (ts != null && ts.canConvertToLong()) {
            return ts.asLong();
        }
        if (ts != null && ts.isTextual()) {
            try {
                return Long.parseLong(ts.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedFrameException("Invalid timestamp: " + ts.asText(), e);
            }
        }
        return clock.getAsLong();
    }

    private static String requiredText(JsonNode root, String field) {
        String value = optionalText(root, field);
        if (value == null || value.isBlank()) {
            throw new MalformedFrameException("Missing required field: " + field);
        }
        return value;
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static BigDecimal optionalDecimal(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedFrameException("Invalid number in " + field + ": " + node.asText(), e);
            }
        }
        throw new MalformedFrameException("Field " + field + " is not numeric");
    }
}
