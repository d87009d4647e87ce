package com.libragraph.drivereport.core.batch;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class ExtractionExecutorProducer {

    private static final Logger log = Logger.getLogger(ExtractionExecutorProducer.class);

    @ConfigProperty(name = "drivereport.extraction.worker-count")
    Optional<Integer> workerCount;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("extractionExecutor")
    public ExecutorService extractionExecutor() {
        int workers = workerCount.filter(n -> n > 0).orElse(Runtime.getRuntime().availableProcessors());
        executor = Executors.newFixedThreadPool(workers, new ExtractionThreadFactory());
        log.infof("Extraction pool started with %d workers", workers);
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }

    private static final class ExtractionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "extraction-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
