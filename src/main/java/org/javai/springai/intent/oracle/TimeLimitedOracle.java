package org.javai.springai.intent.oracle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds every call to a delegate oracle by a timeout.
 *
 * <p>Calls run on a private executor. When the timeout elapses the call is
 * cancelled and an {@link OracleUnavailableException} is thrown with
 * {@code timedOut} set. Oracle exceptions raised by the delegate pass through
 * unchanged; anything else becomes {@link OracleUnavailableException}.</p>
 */
public class TimeLimitedOracle implements LanguageOracle, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(TimeLimitedOracle.class);

	private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

	private final LanguageOracle delegate;
	private final Duration timeout;
	private final ExecutorService executor;

	public TimeLimitedOracle(LanguageOracle delegate, Duration timeout) {
		this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
		Objects.requireNonNull(timeout, "timeout must not be null");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		this.timeout = timeout;
		this.executor = Executors.newCachedThreadPool(runnable -> {
			Thread thread = new Thread(runnable, "oracle-call-" + THREAD_COUNTER.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	@Override
	public OracleResponse complete(OracleRequest request) {
		Future<OracleResponse> future;
		try {
			future = executor.submit(() -> delegate.complete(request));
		} catch (RuntimeException e) {
			throw new OracleUnavailableException("Oracle executor rejected the call", e);
		}
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			logger.warn("Oracle call timed out after {} ms", timeout.toMillis());
			throw new OracleUnavailableException("Oracle call timed out after " + timeout.toMillis() + " ms", true, e);
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new OracleUnavailableException("Interrupted while waiting for the oracle", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof OracleException oracleException) {
				throw oracleException;
			}
			throw new OracleUnavailableException("Oracle call failed: " + (cause != null ? cause.getMessage() : e.getMessage()),
					cause != null ? cause : e);
		}
	}

	public Duration timeout() {
		return timeout;
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}
}
