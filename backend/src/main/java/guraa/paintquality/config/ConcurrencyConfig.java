package guraa.paintquality.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool for per-cell analysis work.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    @Value("${app.concurrency.analysis-threads:4}")
    @Getter @Setter
    private int analysisThreads = 4;

    /**
     * Executor shared by the color, coverage and texture analyzers.
     * Batches never block on each other, so any pool size is safe.
     */
    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public ExecutorService analysisExecutor() {
        int threads = Math.max(1, analysisThreads);
        log.info("Creating analysis executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, new AnalysisThreadFactory("cell-analysis"));
    }

    /**
     * Daemon workers named {@code <pool>-<n>}; a failure that escapes a batch is logged
     * against the worker that ran it.
     */
    static class AnalysisThreadFactory implements ThreadFactory {

        private final String pool;
        private final AtomicInteger created = new AtomicInteger();

        AnalysisThreadFactory(String pool) {
            this.pool = pool;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread worker = new Thread(task, pool + "-" + created.incrementAndGet());
            worker.setDaemon(true);
            worker.setUncaughtExceptionHandler(AnalysisThreadFactory::logEscapedFailure);
            return worker;
        }

        int createdCount() {
            return created.get();
        }

        private static void logEscapedFailure(Thread worker, Throwable failure) {
            log.error("Cell batch on {} failed outside the analyzer guard", worker.getName(), failure);
        }
    }
}
