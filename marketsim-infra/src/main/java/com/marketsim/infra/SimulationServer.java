package com.marketsim.infra;

import com.marketsim.api.PersistenceSink;
import com.marketsim.infra.config.SimulationConfig;
import com.marketsim.infra.metrics.SimulationMetrics;
import com.marketsim.infra.persistence.ChronicleJournalSink;
import io.prometheus.client.CollectorRegistry;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point: runs a simulation from environment configuration until
 * SIGINT or SIGTERM.
 */
public class SimulationServer {

    private static final Logger log = LoggerFactory.getLogger(SimulationServer.class);

    public static void main(String[] args) {
        Simulation simulation = null;
        try {
            SimulationConfig config = SimulationConfig.fromEnv();
            log.info("Configuration loaded:");
            log.info("  Symbols: {}", config.symbolNames());
            log.info("  Seed: {}", config.seed());
            log.info("  Tick interval: {} ms, latency: {} ms", config.tickIntervalMs(), config.latencyMs());
            log.info("  Agents per symbol: {}", config.agentMix());
            log.info("  Journal: {}", config.persistenceEnabled() ? config.journalPath() : "disabled");

            PersistenceSink sink = config.persistenceEnabled() ? new ChronicleJournalSink(config.journalPath()) : null;
            SimulationMetrics metrics = new SimulationMetrics(CollectorRegistry.defaultRegistry);
            simulation = new Simulation(config, sink, metrics);

            ShutdownSignalBarrier barrier = new ShutdownSignalBarrier();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown hook triggered");
                barrier.signal();
            }));

            simulation.start();
            barrier.await();
        } catch (Exception e) {
            log.error("Fatal error in simulation server", e);
            CloseHelper.close(simulation);
            System.exit(1);
        }

        CloseHelper.close(simulation);
        log.info("Simulation server exited at status {}", simulation.status());
    }
}
