package io.stakechain.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class BlockMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksProduced = registry.counter("blocks.produced");
    private static final Counter transactionsIncluded = registry.counter("transactions.included");
    private static final Counter transactionsDropped = registry.counter("transactions.dropped");
    private static final Counter mempoolRejected = registry.counter("mempool.rejected");
    private static final Timer productionTime = registry.timer("block.production.time");

    public static <T> T recordProduction(Supplier<T> blockProductionLogic) {
        return productionTime.record(blockProductionLogic);
    }

    public static void blockProduced(int transactionCount) {
        blocksProduced.increment();
        transactionsIncluded.increment(transactionCount);
    }

    public static void transactionDropped() {
        transactionsDropped.increment();
    }

    public static void transactionRejected() {
        mempoolRejected.increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
