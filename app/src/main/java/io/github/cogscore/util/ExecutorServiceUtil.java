package io.github.cogscore.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /** Fixed pool of daemon threads named {@code threadPrefix1}, {@code threadPrefix2}, ... */
    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        }
        var factory = new ThreadFactory() {
            private final ThreadFactory delegate = Executors.defaultThreadFactory();
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                var t = delegate.newThread(r);
                t.setName(threadPrefix + ++count);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler(
                        (thr, ex) -> logger.error("Uncaught exception in thread {}", thr.getName(), ex));
                return t;
            }
        };
        return Executors.newFixedThreadPool(parallelism, factory);
    }
}
