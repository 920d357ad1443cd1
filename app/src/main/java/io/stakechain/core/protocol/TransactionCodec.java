package io.stakechain.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON wire form of a transaction:
 * {@code id, from, to, amount, fee, timestamp, type, payload, signature}.
 */
public final class TransactionCodec {
    private static final ObjectMapper JSON = LedgerJson.mapper();

    private TransactionCodec(){}

    public static ObjectNode toNode(Transaction tx) {
        ObjectNode node = JSON.createObjectNode();
        node.put("id", tx.id());
        node.put("from", tx.from());
        node.put("to", tx.to());
        node.put("amount", tx.amount());
        node.put("fee", tx.fee());
        node.put("timestamp", tx.timestamp());
        node.put("type", tx.type().wireName());
        if (tx.payload().isPresent()) {
            node.set("payload", JSON.valueToTree(tx.payload().get()));
        } else {
            node.putNull("payload");
        }
        node.put("signature", tx.signature());
        return node;
    }

    public static String toJson(Transaction tx) {
        return toNode(tx).toString();
    }

    public static Transaction fromNode(JsonNode node) {
        try {
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("expected a JSON object");
            }
            Transaction.Builder builder = Transaction.builder()
                    .id(text(node, "id"))
                    .from(text(node, "from"))
                    .to(text(node, "to"))
                    .amount(node.path("amount").asDouble())
                    .fee(node.path("fee").asDouble())
                    .timestamp(node.path("timestamp").asLong())
                    .type(TransactionType.fromWire(node.path("type").asText("transfer")))
                    .signature(text(node, "signature"));
            JsonNode payload = node.get("payload");
            if (payload != null && payload.isObject()) {
                builder.payload(JSON.treeToValue(payload, Payload.class));
            }
            return builder.build();
        } catch (JsonProcessingException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction JSON", ex);
        }
    }

    public static Transaction fromJson(String json) {
        try {
            return fromNode(JSON.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed Transaction JSON", ex);
        }
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
