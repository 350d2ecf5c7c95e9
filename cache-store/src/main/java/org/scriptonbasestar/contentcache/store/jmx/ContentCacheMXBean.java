package org.scriptonbasestar.contentcache.store.jmx;

/**
 * JMX MBean interface for content cache monitoring.
 * <p>
 * Exposes counters, byte-size accounting and memory pressure of one
 * {@link org.scriptonbasestar.contentcache.store.cache.SBContentCache}, plus the maintenance
 * operations an operator may want to trigger from JConsole or VisualVM.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * SBContentCache cache = SBContentCache.builder()
 *     .maxSize(64 * 1024 * 1024)
 *     .enableJmx("textures")
 *     .build();
 *
 * // MBeans -> org.scriptonbasestar.contentcache -> SBContentCache -> textures
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public interface ContentCacheMXBean {

	/**
	 * @return cache name
	 */
	String getCacheName();

	/**
	 * Gets the total number of lookups (hits + misses).
	 *
	 * @return request count
	 */
	long getRequestCount();

	long getHitCount();

	long getMissCount();

	/**
	 * Gets the hit rate as a percentage (0-100).
	 *
	 * @return hit rate percentage
	 */
	double getHitRatePercent();

	/**
	 * Gets the miss rate as a percentage (0-100).
	 *
	 * @return miss rate percentage
	 */
	double getMissRatePercent();

	long getInsertionCount();

	/**
	 * Gets the number of removed entries (explicit removals, pressure evictions and expiry).
	 *
	 * @return eviction count
	 */
	long getEvictionCount();

	/**
	 * @return sum of entry sizes in bytes
	 */
	long getCurrentSizeBytes();

	/**
	 * @return capacity in bytes
	 */
	long getMaxSizeBytes();

	int getEntryCount();

	/**
	 * Gets the byte utilisation as a percentage (0-100). May exceed 100 transiently.
	 *
	 * @return utilisation percentage
	 */
	double getUtilizationPercent();

	/**
	 * @return last reported memory pressure in [0, 1]
	 */
	double getMemoryPressure();

	// Operations

	/**
	 * Reports external memory pressure. Values above 0.8 trigger space reclamation,
	 * values above 0.6 trigger an idle-expiry sweep.
	 *
	 * @param pressure pressure in [0, 1], clamped
	 */
	void setMemoryPressure(double pressure);

	/**
	 * Runs the idle-expiry sweep, subject to the cleanup interval.
	 *
	 * @return number of removed entries
	 */
	int cleanupExpired();

	/**
	 * Reorders the recency list by access frequency.
	 */
	void optimize();

	/**
	 * Resets all counters to zero. Cached data is kept.
	 */
	void resetStatistics();

	/**
	 * @return statistics summary
	 */
	String getStatisticsSummary();

	/**
	 * @return full text report including hot entries
	 */
	String exportReport();
}
