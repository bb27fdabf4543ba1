package org.javai.springai.intent.store;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionLocks")
class SessionLocksTest {

	private final SessionLocks locks = new SessionLocks();

	@Test
	@DisplayName("keeps an entry only while the lock is held")
	void dropsEntryOnRelease() {
		ReentrantLock lock = locks.lock("s1");

		assertThat(lock.isHeldByCurrentThread()).isTrue();
		assertThat(locks.size()).isEqualTo(1);

		locks.unlock("s1", lock);

		assertThat(lock.isHeldByCurrentThread()).isFalse();
		assertThat(locks.size()).isZero();
	}

	@Test
	@DisplayName("does not accumulate entries for many short-lived sessions")
	void doesNotAccumulate() {
		for (int i = 0; i < 1_000; i++) {
			String sessionId = "session-" + i;
			locks.unlock(sessionId, locks.lock(sessionId));
		}

		assertThat(locks.size()).isZero();
	}

	@Test
	@DisplayName("keeps the entry when the owner re-enters")
	void keepsEntryForReentrantOwner() {
		ReentrantLock outer = locks.lock("s1");
		ReentrantLock inner = locks.lock("s1");

		locks.unlock("s1", inner);
		assertThat(locks.size()).isEqualTo(1);

		locks.unlock("s1", outer);
		assertThat(locks.size()).isZero();
	}

	@Test
	@DisplayName("excludes concurrent holders of one session while entries come and go")
	void excludesConcurrentHolders() throws Exception {
		int threads = 8;
		int rounds = 500;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		AtomicInteger inside = new AtomicInteger();
		AtomicInteger overlaps = new AtomicInteger();
		CountDownLatch start = new CountDownLatch(1);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int t = 0; t < threads; t++) {
				futures.add(executor.submit(() -> {
					start.await();
					for (int i = 0; i < rounds; i++) {
						ReentrantLock lock = locks.lock("shared");
						try {
							if (inside.incrementAndGet() != 1) {
								overlaps.incrementAndGet();
							}
							inside.decrementAndGet();
						} finally {
							locks.unlock("shared", lock);
						}
					}
					return null;
				}));
			}
			start.countDown();
			for (Future<?> future : futures) {
				future.get(60, TimeUnit.SECONDS);
			}
		} finally {
			executor.shutdownNow();
		}

		assertThat(overlaps.get()).isZero();
		assertThat(locks.size()).isZero();
	}
}
