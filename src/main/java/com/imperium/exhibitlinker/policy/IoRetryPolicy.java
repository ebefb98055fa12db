package com.imperium.exhibitlinker.policy;

import com.imperium.exhibitlinker.exception.TransientIoException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.FileSystemException;

/**
 * 文件 I/O 的有界重试：被占用或暂时不可用的文件按指数退避重试若干次，
 * 用尽后抛 {@link TransientIoException}，由调用方归入各自的非致命类别。
 * 损坏文件等其他 IOException 不重试。
 */
public final class IoRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(IoRetryPolicy.class);

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final Retry retry;
    private final int maxAttempts;

    /**
     * @param maxRetries    首次失败后的重试次数（0 表示不重试）
     * @param backoffMillis 首次重试前的等待，之后每次翻倍
     */
    public IoRetryPolicy(int maxRetries, long backoffMillis) {
        this.maxAttempts = Math.max(0, maxRetries) + 1;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Math.max(1L, backoffMillis), BACKOFF_MULTIPLIER))
                .retryOnException(IoRetryPolicy::isTransient)
                .build();
        this.retry = Retry.of("exhibit-io", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying {} (attempt {}): {}", event.getName(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : ""));
    }

    public static IoRetryPolicy noRetry() {
        return new IoRetryPolicy(0, 1);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static boolean isTransient(Throwable t) {
        return t instanceof FileSystemException || t instanceof FileNotFoundException;
    }

    public <T> T call(String operation, IoSupplier<T> supplier) throws IOException {
        try {
            return retry.executeCheckedSupplier(supplier::get);
        } catch (IOException e) {
            if (isTransient(e)) {
                log.warn("{} still failing after {} attempt(s): {}", operation, maxAttempts, e.getMessage());
                throw new TransientIoException(operation, maxAttempts, e);
            }
            throw e;
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IOException(operation + " failed: " + t.getMessage(), t);
        }
    }

    public void run(String operation, IoRunnable runnable) throws IOException {
        call(operation, () -> {
            runnable.run();
            return null;
        });
    }

    @FunctionalInterface
    public interface IoSupplier<T> {
        T get() throws IOException;
    }

    @FunctionalInterface
    public interface IoRunnable {
        void run() throws IOException;
    }
}
