package io.streamkit.demo;

import com.codahale.metrics.ConsoleReporter;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.streamkit.config.StreamkitConfig;
import io.streamkit.core.CancellationToken;
import io.streamkit.core.Schedulers;
import io.streamkit.workers.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the demo flow end to end and prints the pool metrics.
 */
@CommandLine.Command(name = "streamkit-demo", mixinStandardHelpOptions = true,
        description = "Pushes an interval sequence through a rate limiter and a worker pool, printing batches")
public final class DemoMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DemoMain.class);

    @CommandLine.Option(names = {"-n", "--count"}, description = "Values to emit", defaultValue = "100")
    long count;

    @CommandLine.Option(names = {"-i", "--interval-ms"}, description = "Delay between values", defaultValue = "5")
    long intervalMs;

    @CommandLine.Option(names = {"--deadline-ms"}, description = "Cancel the run after this long; 0 runs to completion", defaultValue = "0")
    long deadlineMs;

    @CommandLine.Option(names = {"--metrics"}, description = "Print metrics when done", defaultValue = "true")
    boolean printMetrics;

    public static void main(String[] args) {
        int code = new CommandLine(new DemoMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        if (count < 0 || intervalMs < 0 || deadlineMs < 0) {
            System.err.println("count, interval-ms and deadline-ms must not be negative");
            return 2;
        }
        StreamkitConfig config = StreamkitConfig.fromEnv();
        Injector injector = Guice.createInjector(new StreamkitModule(config));
        WorkerPool<Long, Long> pool = injector.getInstance(Key.get(new TypeLiteral<WorkerPool<Long, Long>>() {}));
        CancellationToken token = new CancellationToken();
        if (deadlineMs > 0) {
            Schedulers.timer().schedule(token::cancel, deadlineMs, TimeUnit.MILLISECONDS);
        }

        AtomicLong batches = new AtomicLong();
        try {
            injector.getInstance(DemoPipeline.class).build(count, intervalMs, token).forEach((List<Long> batch) -> {
                batches.incrementAndGet();
                System.out.println("batch " + batches.get() + ": " + batch);
            });
        } catch (RuntimeException e) {
            log.warn("Run stopped: {}", e.toString());
            return 1;
        } finally {
            pool.terminate(false).get(5, TimeUnit.SECONDS);
            if (printMetrics) report(injector.getInstance(MetricRegistry.class));
        }
        log.info("Processed {} values in {} batches", count, batches.get());
        return 0;
    }

    private static void report(MetricRegistry registry) {
        ConsoleReporter.forRegistry(registry)
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build()
                .report();
    }
}
