package io.stakechain.core.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.BlockCodec;
import io.stakechain.core.protocol.LedgerJson;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.protocol.TransactionCodec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** JSON rendering of a {@link ChainSnapshot} for persistence collaborators. */
public final class ChainExporter {
    private static final ObjectMapper JSON = LedgerJson.mapper();

    private ChainExporter() {}

    public static ObjectNode toNode(ChainSnapshot snapshot) {
        ObjectNode root = JSON.createObjectNode();
        ArrayNode chain = root.putArray("chain");
        for (Block block : snapshot.chain()) {
            chain.add(BlockCodec.toNode(block));
        }
        ArrayNode pending = root.putArray("pendingTransactions");
        for (Transaction tx : snapshot.pendingTransactions()) {
            pending.add(TransactionCodec.toNode(tx));
        }

        SupplyReport supply = snapshot.supply();
        root.put("totalSupply", supply.totalSupply());
        root.put("circulatingSupply", supply.circulating());
        root.put("stakedSupply", supply.staked());
        root.put("reserveSupply", supply.reserve());
        root.put("burnedTokens", supply.burned());

        ArrayNode pools = root.putArray("swapPools");
        for (SwapPool pool : snapshot.swapPools()) {
            ObjectNode p = pools.addObject();
            p.put("key", pool.key());
            p.put("tokenA", pool.tokenA());
            p.put("tokenB", pool.tokenB());
            p.put("reserveA", pool.reserveA());
            p.put("reserveB", pool.reserveB());
            p.put("fee", pool.feeRate());
            p.put("totalLiquidity", pool.totalLiquidity());
        }
        return root;
    }

    public static String toJson(ChainSnapshot snapshot) {
        return toNode(snapshot).toString();
    }

    public static void writeTo(Path path, ChainSnapshot snapshot) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toNode(snapshot));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to export chain to " + path, e);
        }
    }
}
