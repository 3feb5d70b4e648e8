/*
 * Copyright 2025 The AegisGRID Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.aegisgrid.pipeline.runner;

import static com.aegisgrid.CommonUtils.checkNotNull;

import java.io.PrintStream;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.aegisgrid.pipeline.CancellationToken;
import com.aegisgrid.pipeline.EventChannel;
import com.aegisgrid.pipeline.PipelineConfig;
import com.aegisgrid.pipeline.PipelineEvent;
import com.aegisgrid.pipeline.PipelineOrchestrator;
import com.aegisgrid.returntypes.AlertRecord;

/**
 * A command-line application that monitors the simulated grid and prints
 * status messages and alert verdicts to STDOUT until interrupted.
 */
public class AegisRunner {

    private static final Logger LOG = LogManager.getLogger(AegisRunner.class);

    static final DateTimeFormatter STATUS_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final PipelineConfig config;
    private final PrintStream out;

    public AegisRunner(PipelineConfig config, PrintStream out) {
        this.config = checkNotNull(config, "config must not be null");
        this.out = checkNotNull(out, "out must not be null");
    }

    public static void main(String... args) {
        ArgumentParser parser = new ArgumentParser(AegisRunner.class.getName(),
                "Monitor simulated SCADA and PMU telemetry and raise fused anomaly alerts.");
        PipelineConfig config = null;
        try {
            parser.parse(args);
            config = parser.toConfig();
        } catch (IllegalArgumentException e) {
            parser.printUsageAndExit("%s", e.getMessage());
        }
        if (parser.isHelpRequested()) {
            parser.printUsage(System.out);
            return;
        }
        System.exit(new AegisRunner(config, System.out).run());
    }

    /**
     * Runs the pipeline on a worker thread and prints its events until it
     * stops.
     *
     * @return 0 if the pipeline stopped normally, 1 if it failed
     */
    public int run() {
        EventChannel channel = new EventChannel();
        CancellationToken token = new CancellationToken();
        PipelineOrchestrator orchestrator = PipelineOrchestrator.fromConfig(config, null);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "aegis-pipeline");
            thread.setDaemon(true);
            return thread;
        });
        CountDownLatch drained = new CountDownLatch(1);
        Thread shutdownHook = new Thread(new ShutdownHook(token, drained, SHUTDOWN_GRACE), "aegis-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            Future<Void> future = orchestrator.start(executor, channel, token, config.getMaxIterations());
            while (!future.isDone() || !channel.isEmpty()) {
                PipelineEvent event = channel.poll(POLL_INTERVAL);
                if (event != null) {
                    out.println(format(event, LocalTime.now()));
                }
            }
            future.get();
            return 0;
        } catch (ExecutionException e) {
            LOG.error("Pipeline failed", e.getCause());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for pipeline events");
            token.cancel();
            return 1;
        } finally {
            drained.countDown();
            executor.shutdownNow();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                LOG.debug("JVM is shutting down, leaving the shutdown hook in place");
            }
        }
    }

    /**
     * Cancels the pipeline and holds JVM exit until the event loop has
     * printed the remaining events, or the grace period runs out.
     */
    static class ShutdownHook implements Runnable {

        private final CancellationToken token;
        private final CountDownLatch drained;
        private final Duration grace;

        ShutdownHook(CancellationToken token, CountDownLatch drained, Duration grace) {
            this.token = checkNotNull(token, "token must not be null");
            this.drained = checkNotNull(drained, "drained must not be null");
            this.grace = checkNotNull(grace, "grace must not be null");
        }

        @Override
        public void run() {
            token.cancel();
            try {
                if (!drained.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Pipeline did not stop within {} ms", grace.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for the pipeline to stop");
            }
        }
    }

    static String format(PipelineEvent event, LocalTime time) {
        if (event.getKind() == PipelineEvent.Kind.STATUS) {
            return String.format("[%s] [SETUP] %s", STATUS_TIME.format(time), event.getMessage());
        }
        return formatAlert(event.getAlert());
    }

    static String formatAlert(AlertRecord alert) {
        String confidence = String.format(Locale.ROOT, "%.0f%%", alert.getCombinedConfidence() * 100);
        if (alert.isAegisAlert()) {
            return String.format("ALERT! @ %s | Confidence: %s", alert.getLocation(), confidence);
        }
        return "System Nominal | Confidence: " + confidence;
    }
}
