package io.stakechain.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stakechain.core.ledger.ChainExporter;
import io.stakechain.core.ledger.LedgerConfig;
import io.stakechain.core.ledger.LedgerEngine;
import io.stakechain.core.ledger.NetworkStats;
import io.stakechain.core.ledger.SupplyReport;
import io.stakechain.core.metrics.BlockMetrics;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.LedgerJson;
import io.stakechain.core.protocol.Payload;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.protocol.TransactionType;
import io.stakechain.core.wallet.Wallet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = LedgerJson.mapper();

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        LedgerConfig config = LedgerConfig.defaultLocal()
                .withBlockInterval(options.blockIntervalMillis())
                .withMaxTxPerBlock(options.maxTxPerBlock())
                .withNativeSymbol(options.nativeSymbol())
                .withRequireSignatures(options.requireSignatures());
        if (options.genesisAllocFile() != null) {
            config = config.withGenesisAllocations(loadAllocations(options.genesisAllocFile()));
        }
        LedgerEngine engine = new LedgerEngine(config, Clock.systemUTC());
        LOG.info("Genesis ready: " + engine.getLatestBlock().hash() + " (" + config.nativeSymbol + ")");

        CountDownLatch shutdownLatch = null;
        ScheduledExecutorService timer = null;
        try {
            if (options.keepAlive()) {
                timer = startTimer(engine);
            }

            if (options.demo()) {
                runDemoFlow(engine);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.keepAlive()) {
                shutdownLatch = new CountDownLatch(1);
                CountDownLatch latchRef = shutdownLatch;
                Runtime.getRuntime().addShutdownHook(new Thread(latchRef::countDown, "stakechain-shutdown"));
                LOG.info("Ledger running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else if (options.demoDurationMillis() > 0 && timer != null) {
                try {
                    Thread.sleep(options.demoDurationMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        } finally {
            if (timer != null) {
                timer.shutdownNow();
            }
            if (options.exportPath() != null) {
                ChainExporter.writeTo(options.exportPath(), engine.exportChain());
                LOG.info("Exported chain to " + options.exportPath().toAbsolutePath());
            }
        }
    }

    private static ScheduledExecutorService startTimer(LedgerEngine engine) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stakechain-block-timer");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                engine.tick();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background block timer tick failed", e);
            }
        };
        executor.scheduleAtFixedRate(task, 1, 1, TimeUnit.SECONDS);
        return executor;
    }

    /** Fund a few users, move tokens around, stake, swap, and mine the result. */
    static void runDemoFlow(LedgerEngine engine) {
        String symbol = engine.config().nativeSymbol;
        Wallet v1 = engine.keys().walletFor("genesis_validator_1");
        Wallet v2 = engine.keys().walletFor("genesis_validator_2");
        Wallet v3 = engine.keys().walletFor("genesis_validator_3");
        Wallet alice = engine.keys().walletFor("alice");
        Wallet bob = engine.keys().walletFor("bob");
        Wallet carol = engine.keys().walletFor("carol");

        submit(engine, v1.sign(Transaction.create(v1.getAddress(), alice.getAddress(), 10_000, TransactionType.TRANSFER, null)));
        submit(engine, v2.sign(Transaction.create(v2.getAddress(), bob.getAddress(), 5_000, TransactionType.TRANSFER, null)));
        submit(engine, v3.sign(Transaction.create(v3.getAddress(), carol.getAddress(), 2_500, TransactionType.TRANSFER, null)));
        mine(engine);

        submit(engine, alice.sign(Transaction.create(alice.getAddress(), bob.getAddress(), 250, TransactionType.TRANSFER, null)));
        submit(engine, bob.sign(Transaction.create(bob.getAddress(), "genesis_validator_2", 1_000,
                TransactionType.STAKE, Payload.validator("genesis_validator_2"))));
        submit(engine, carol.sign(Transaction.create(carol.getAddress(), carol.getAddress(), 500,
                TransactionType.STAKE, null)));
        mine(engine);

        engine.createSwapPool(symbol, "USDX", 100_000, 50_000);
        submit(engine, alice.sign(Transaction.create(alice.getAddress(), "swap_router", 1_000, TransactionType.SWAP,
                Payload.swap(symbol, "USDX", 1_000, 400))));
        mine(engine);

        engine.burnTokens(1_000);

        LOG.info("Alice balance=" + engine.getBalance(alice.getAddress())
                + " USDX=" + engine.getTokenBalance(alice.getAddress(), "USDX"));
        LOG.info("Bob   balance=" + engine.getBalance(bob.getAddress()));
        LOG.info("Carol balance=" + engine.getBalance(carol.getAddress()));
        SupplyReport supply = engine.supplyReport();
        NetworkStats stats = engine.networkStats();
        LOG.info("Supply " + supply + " conserved=" + supply.isConserved());
        LOG.info("Network " + stats);
        LOG.info("Chain valid=" + engine.isChainValid());
        LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());
    }

    private static void submit(LedgerEngine engine, Transaction tx) {
        try {
            engine.addTransaction(tx);
        } catch (LedgerException e) {
            LOG.warning("Transaction " + tx.id() + " rejected (" + e.error() + "): " + e.getMessage());
        }
    }

    private static void mine(LedgerEngine engine) {
        Optional<Block> block = engine.mineBlock();
        if (block.isPresent()) {
            LOG.info("Mined block " + block.get().index() + " by " + block.get().producer()
                    + " (" + block.get().transactionCount() + " txs)");
        } else {
            LOG.info("Nothing mined");
        }
    }

    static Map<String, Double> loadAllocations(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Genesis allocations file not found: " + path);
        }
        try {
            return JSON.readValue(path.toFile(), new TypeReference<Map<String, Double>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read genesis allocations from " + path, e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            boolean keepAlive,
            boolean demo,
            long demoDurationMillis,
            long blockIntervalMillis,
            int maxTxPerBlock,
            String nativeSymbol,
            boolean requireSignatures,
            Path genesisAllocFile,
            Path exportPath
    ) {
        static CliOptions parse(String[] args) {
            LedgerConfig defaults = LedgerConfig.defaultLocal();
            boolean keepAlive = "true".equalsIgnoreCase(System.getenv("STAKECHAIN_KEEP_ALIVE"));
            boolean demo = true;
            long demoDurationMillis = 0L;
            long blockIntervalMillis = defaults.blockIntervalMillis;
            int maxTxPerBlock = defaults.maxTxPerBlock;
            String nativeSymbol = envOrDefault("STAKECHAIN_NATIVE_SYMBOL", defaults.nativeSymbol);
            boolean requireSignatures = "true".equalsIgnoreCase(System.getenv("STAKECHAIN_REQUIRE_SIGNATURES"));
            Path genesisAllocFile = envPath("STAKECHAIN_GENESIS_ALLOC", null);
            Path exportPath = envPath("STAKECHAIN_EXPORT_PATH", null);
            boolean showHelp = false;
            String error = null;

            String intervalEnv = System.getenv("STAKECHAIN_BLOCK_INTERVAL_MS");
            if (intervalEnv != null && !intervalEnv.isBlank()) {
                try {
                    blockIntervalMillis = parsePositiveLong(intervalEnv, "STAKECHAIN_BLOCK_INTERVAL_MS");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.startsWith("--demo-duration-ms=")) {
                        try {
                            demoDurationMillis = parsePositiveLong(arg.substring("--demo-duration-ms=".length()), "--demo-duration-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--block-interval-ms=")) {
                        try {
                            blockIntervalMillis = parsePositiveLong(arg.substring("--block-interval-ms=".length()), "--block-interval-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--max-tx-per-block=")) {
                        try {
                            long parsed = parsePositiveLong(arg.substring("--max-tx-per-block=".length()), "--max-tx-per-block");
                            if (parsed == 0 || parsed > Integer.MAX_VALUE) {
                                throw new IllegalArgumentException("Invalid value for --max-tx-per-block: " + parsed);
                            }
                            maxTxPerBlock = (int) parsed;
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--native-symbol=")) {
                        nativeSymbol = arg.substring("--native-symbol=".length()).trim();
                    } else if (arg.equals("--require-signatures")) {
                        requireSignatures = true;
                    } else if (arg.startsWith("--genesis-alloc=")) {
                        genesisAllocFile = Path.of(arg.substring("--genesis-alloc=".length()));
                    } else if (arg.startsWith("--export=")) {
                        exportPath = Path.of(arg.substring("--export=".length()));
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (nativeSymbol == null || nativeSymbol.isBlank()) {
                showHelp = true;
                if (error == null) {
                    error = "Native symbol must not be blank";
                }
                nativeSymbol = defaults.nativeSymbol;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    keepAlive,
                    demo,
                    demoDurationMillis,
                    blockIntervalMillis,
                    maxTxPerBlock,
                    nativeSymbol,
                    requireSignatures,
                    genesisAllocFile,
                    exportPath
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: stakechain [options]

Options:
  --help, -h                 Show this help message and exit
  --keep-alive               Keep the ledger running with the block timer until interrupted
  --demo / --no-demo         Enable (default) or disable the demo transaction flow
  --demo-duration-ms=<ms>    Keep the block timer running this long after the demo (default 0)
  --block-interval-ms=<ms>   Target block interval for auto-mining (default 10000)
  --max-tx-per-block=<n>     Per-block transaction cap (default 1000)
  --native-symbol=<sym>      Native token symbol (default STC)
  --require-signatures       Reject unsigned transactions
  --genesis-alloc=<path>     JSON map of address -> genesis balance
  --export=<path>            Write the chain snapshot as JSON on exit

Environment overrides:
  STAKECHAIN_KEEP_ALIVE          Set to "true" to force keep-alive mode
  STAKECHAIN_BLOCK_INTERVAL_MS   Override the target block interval
  STAKECHAIN_NATIVE_SYMBOL       Override the native token symbol
  STAKECHAIN_REQUIRE_SIGNATURES  Set to "true" to reject unsigned transactions
  STAKECHAIN_GENESIS_ALLOC       Path to the genesis allocations file
  STAKECHAIN_EXPORT_PATH         Path for the JSON export
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
