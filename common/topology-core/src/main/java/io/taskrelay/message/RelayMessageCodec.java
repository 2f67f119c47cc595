package io.taskrelay.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.taskrelay.model.AgentRole;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Converts {@link RelayMessage} envelopes to and from their UTF-8 JSON wire form.
 * <p>
 * Decoding validates the envelope before any payload is bound: the body must be a JSON object,
 * {@code message_type} must name a known {@link MessageType}, and the identifiers that type
 * requires must be present. Every rejection surfaces as a {@link MalformedMessageException}.
 */
public final class RelayMessageCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public RelayMessageCodec() {
        this(defaultMapper());
    }

    public RelayMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public RelayMessage decode(String json) throws MalformedMessageException {
        if (json == null) {
            throw new MalformedMessageException("message body is empty");
        }
        return decode(json.getBytes(StandardCharsets.UTF_8));
    }

    public RelayMessage decode(byte[] body) throws MalformedMessageException {
        if (body == null || body.length == 0) {
            throw new MalformedMessageException("message body is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new MalformedMessageException("message body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("message body must be a JSON object");
        }
        String rawType = text(root, "message_type");
        if (rawType == null) {
            throw new MalformedMessageException("message_type is required");
        }
        MessageType type = MessageType.fromWire(rawType)
            .orElseThrow(() -> new UnknownMessageTypeException(rawType));

        AgentRole fromRole = role(root, "from_role");
        AgentRole toRole = role(root, "to_role");
        Instant timestamp = timestamp(root, "timestamp");
        MessagePayload payload = payload(root, type);
        BrokerMetadata brokerMetadata = brokerMetadata(root);
        try {
            return new RelayMessage(type, text(root, "task_id"), text(root, "request_id"),
                fromRole, toRole, timestamp, payload, brokerMetadata);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage(), e);
        }
    }

    public byte[] encode(RelayMessage message) {
        try {
            return mapper.writeValueAsBytes(toTree(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise " + message.type().wire() + " message", e);
        }
    }

    /**
     * The wire form as a plain map, used when a raw envelope is archived with an activity.
     */
    public Map<String, Object> toMap(RelayMessage message) {
        return mapper.convertValue(toTree(message), MAP_TYPE);
    }

    private ObjectNode toTree(RelayMessage message) {
        Objects.requireNonNull(message, "message");
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("message_type", message.type().wire());
        putIfPresent(root, "task_id", message.taskId());
        putIfPresent(root, "request_id", message.requestId());
        if (message.fromRole() != null) {
            root.put("from_role", message.fromRole().wire());
        }
        if (message.toRole() != null) {
            root.put("to_role", message.toRole().wire());
        }
        if (message.timestamp() != null) {
            root.put("timestamp", message.timestamp().toString());
        }
        root.set("payload", mapper.valueToTree(message.payload()));
        BrokerMetadata metadata = message.brokerMetadata();
        if (metadata != null) {
            ObjectNode node = root.putObject("broker_metadata");
            node.put("message_id", metadata.messageId());
            node.put("published_at", metadata.publishedAt().toString());
            node.put("queue", metadata.queue());
        }
        return root;
    }

    private MessagePayload payload(JsonNode root, MessageType type) throws MalformedMessageException {
        JsonNode node = root.get("payload");
        if (node == null || node.isNull()) {
            node = JsonNodeFactory.instance.objectNode();
        }
        if (!node.isObject()) {
            throw new MalformedMessageException("payload of " + type.wire() + " must be a JSON object");
        }
        try {
            return mapper.treeToValue(node, type.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("invalid " + type.wire() + " payload: " + e.getMessage(), e);
        }
    }

    private BrokerMetadata brokerMetadata(JsonNode root) throws MalformedMessageException {
        JsonNode node = root.get("broker_metadata");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new MalformedMessageException("broker_metadata must be a JSON object");
        }
        String messageId = text(node, "message_id");
        Instant publishedAt = timestamp(node, "published_at");
        String queue = text(node, "queue");
        if (messageId == null || publishedAt == null || queue == null) {
            throw new MalformedMessageException("broker_metadata requires message_id, published_at and queue");
        }
        return new BrokerMetadata(messageId, publishedAt, queue);
    }

    private static AgentRole role(JsonNode root, String field) throws MalformedMessageException {
        String value = text(root, field);
        if (value == null) {
            return null;
        }
        try {
            return AgentRole.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(field + ": " + e.getMessage(), e);
        }
    }

    /**
     * Accepts ISO-8601 instants and zone-less local date-times, the latter read as UTC.
     */
    private static Instant timestamp(JsonNode root, String field) throws MalformedMessageException {
        String value = text(root, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException notAnInstant) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new MalformedMessageException(field + " is not an ISO-8601 timestamp: '" + value + "'", e);
            }
        }
    }

    private static String text(JsonNode node, String field) throws MalformedMessageException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MalformedMessageException(field + " must be a string");
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
