package org.scriptonbasestar.contentcache.core.util;

/**
 * Monotonic time source in nanoseconds.
 * <p>
 * Readings are only meaningful relative to each other. Tests substitute a manual ticker to
 * control idle time and age without sleeping.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
@FunctionalInterface
public interface Ticker {

	/**
	 * @return current reading in nanoseconds
	 */
	long read();

	/**
	 * Ticker backed by {@link System#nanoTime()}.
	 *
	 * @return system ticker
	 */
	static Ticker systemTicker() {
		return System::nanoTime;
	}
}
