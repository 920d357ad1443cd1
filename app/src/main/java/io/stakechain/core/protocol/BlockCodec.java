package io.stakechain.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON wire form of a block. Decoding restores every field verbatim; call
 * {@link Block#isValid()} to find out whether the document is consistent.
 */
public final class BlockCodec {
    private static final ObjectMapper JSON = LedgerJson.mapper();

    private BlockCodec(){}

    public static ObjectNode toNode(Block block) {
        ObjectNode node = JSON.createObjectNode();
        node.put("index", block.index());
        node.put("timestamp", block.timestamp());
        ArrayNode txs = node.putArray("transactions");
        for (Transaction tx : block.transactions()) {
            txs.add(TransactionCodec.toNode(tx));
        }
        node.put("previousHash", block.previousHash());
        node.put("hash", block.hash());
        node.put("nonce", block.nonce());
        node.put("producer", block.producer());
        node.put("signature", block.signature());
        node.put("merkleRoot", block.merkleRoot());
        node.put("stateRoot", block.stateRoot());
        node.put("transactionCount", block.transactionCount());
        node.put("totalFees", block.totalFees());
        node.put("reward", block.reward());
        return node;
    }

    public static String toJson(Block block) {
        return toNode(block).toString();
    }

    public static Block fromNode(JsonNode node) {
        try {
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("expected a JSON object");
            }
            List<Transaction> txs = new ArrayList<>();
            for (JsonNode txNode : node.path("transactions")) {
                txs.add(TransactionCodec.fromNode(txNode));
            }
            return Block.restore(
                    node.path("index").asLong(),
                    node.path("timestamp").asLong(),
                    txs,
                    TransactionCodec.text(node, "previousHash"),
                    TransactionCodec.text(node, "hash"),
                    node.path("nonce").asLong(),
                    TransactionCodec.text(node, "producer"),
                    TransactionCodec.text(node, "signature"),
                    TransactionCodec.text(node, "merkleRoot"),
                    TransactionCodec.text(node, "stateRoot"),
                    node.path("transactionCount").asInt(),
                    node.path("totalFees").asDouble(),
                    node.path("reward").asDouble()
            );
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Block JSON", ex);
        }
    }

    public static Block fromJson(String json) {
        try {
            return fromNode(JSON.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed Block JSON", ex);
        }
    }
}
