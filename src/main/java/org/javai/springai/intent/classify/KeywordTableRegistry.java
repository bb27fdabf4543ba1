package org.javai.springai.intent.classify;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the keyword table currently in force.
 *
 * <p>Readers take a snapshot with {@link #current()} and classify against it;
 * a concurrent {@link #swap(long, KeywordTable)} never changes a snapshot
 * already taken.</p>
 */
public class KeywordTableRegistry {

	private static final Logger logger = LoggerFactory.getLogger(KeywordTableRegistry.class);

	private final AtomicReference<KeywordTable> current;

	public KeywordTableRegistry(KeywordTable initial) {
		this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial table must not be null"));
	}

	public static KeywordTableRegistry withDefaults() {
		return new KeywordTableRegistry(KeywordTable.defaults());
	}

	public KeywordTable current() {
		return current.get();
	}

	/**
	 * Replaces the table if {@code expectedVersion} is still current and the
	 * replacement carries a higher version.
	 *
	 * @return true if the replacement was installed
	 * @throws IllegalArgumentException if the replacement version is not higher than the expected one
	 */
	public boolean swap(long expectedVersion, KeywordTable replacement) {
		Objects.requireNonNull(replacement, "replacement must not be null");
		if (replacement.version() <= expectedVersion) {
			throw new IllegalArgumentException("replacement version " + replacement.version()
					+ " must be greater than " + expectedVersion);
		}
		KeywordTable snapshot = current.get();
		if (snapshot.version() != expectedVersion) {
			logger.debug("Keyword table swap rejected: expected version {}, current is {}",
					expectedVersion, snapshot.version());
			return false;
		}
		boolean swapped = current.compareAndSet(snapshot, replacement);
		if (swapped) {
			logger.info("Keyword table updated from version {} to {}", expectedVersion, replacement.version());
		}
		return swapped;
	}
}
