package org.javai.springai.intent.store;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One {@link ReentrantLock} per session id, held only while some thread owns or awaits it.
 *
 * <p>An entry is removed when its owner releases it with no other thread queued. A thread
 * that acquired a lock which has meanwhile been removed releases it and retries, so two
 * threads never hold different locks for the same session.</p>
 */
public class SessionLocks {

	private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

	/**
	 * Blocks until the calling thread holds the lock for {@code sessionId}.
	 *
	 * @return the held lock, to be passed to {@link #unlock(String, ReentrantLock)}
	 */
	public ReentrantLock lock(String sessionId) {
		while (true) {
			ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
			lock.lock();
			if (locks.get(sessionId) == lock) {
				return lock;
			}
			lock.unlock();
		}
	}

	public void unlock(String sessionId, ReentrantLock lock) {
		if (lock.getHoldCount() == 1 && !lock.hasQueuedThreads()) {
			locks.remove(sessionId, lock);
		}
		lock.unlock();
	}

	/**
	 * Number of sessions that currently have a lock entry.
	 */
	public int size() {
		return locks.size();
	}
}
