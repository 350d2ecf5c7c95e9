package org.scriptonbasestar.contentcache.store.jmx;

import org.scriptonbasestar.contentcache.store.cache.SBContentCache;
import org.scriptonbasestar.contentcache.store.metrics.CacheMetrics;

import java.util.Locale;

/**
 * Default implementation of {@link ContentCacheMXBean}.
 * <p>
 * Delegates counters to the cache's {@link CacheMetrics} and size information to the cache
 * itself, so attributes are always current without explicit updates.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public class ContentCacheStatistics implements ContentCacheMXBean {

	private final SBContentCache cache;
	private final String cacheName;

	/**
	 * @param cache      the cache to expose
	 * @param cacheName  the cache name for identification
	 * @throws IllegalArgumentException if cache or cacheName is null/empty
	 */
	public ContentCacheStatistics(SBContentCache cache, String cacheName) {
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("cacheName must not be null or empty");
		}
		this.cache = cache;
		this.cacheName = cacheName;
	}

	@Override
	public String getCacheName() {
		return cacheName;
	}

	@Override
	public long getRequestCount() {
		return metrics().requestCount();
	}

	@Override
	public long getHitCount() {
		return metrics().hitCount();
	}

	@Override
	public long getMissCount() {
		return metrics().missCount();
	}

	@Override
	public double getHitRatePercent() {
		return metrics().hitRate() * 100.0;
	}

	@Override
	public double getMissRatePercent() {
		return metrics().missRate() * 100.0;
	}

	@Override
	public long getInsertionCount() {
		return metrics().insertionCount();
	}

	@Override
	public long getEvictionCount() {
		return metrics().evictionCount();
	}

	@Override
	public long getCurrentSizeBytes() {
		return cache.getMemoryUsage();
	}

	@Override
	public long getMaxSizeBytes() {
		return cache.getMaxSize();
	}

	@Override
	public int getEntryCount() {
		return cache.size();
	}

	@Override
	public double getUtilizationPercent() {
		return cache.utilization() * 100.0;
	}

	@Override
	public double getMemoryPressure() {
		return cache.getMemoryPressure();
	}

	@Override
	public void setMemoryPressure(double pressure) {
		cache.setMemoryPressure(pressure);
	}

	@Override
	public int cleanupExpired() {
		return cache.cleanupExpired();
	}

	@Override
	public void optimize() {
		cache.optimize();
	}

	@Override
	public void resetStatistics() {
		cache.resetStatistics();
	}

	@Override
	public String getStatisticsSummary() {
		StringBuilder sb = new StringBuilder();
		sb.append("Cache Statistics for '").append(cacheName).append("':\n");
		sb.append("  Requests: ").append(getRequestCount()).append("\n");
		sb.append("  Hits: ").append(getHitCount()).append(" (").append(percent(getHitRatePercent())).append("%)\n");
		sb.append("  Misses: ").append(getMissCount()).append(" (").append(percent(getMissRatePercent())).append("%)\n");
		sb.append("  Insertions: ").append(getInsertionCount()).append("\n");
		sb.append("  Evictions: ").append(getEvictionCount()).append("\n");
		sb.append("  Entries: ").append(getEntryCount()).append("\n");
		sb.append("  Memory: ").append(getCurrentSizeBytes()).append(" / ").append(getMaxSizeBytes())
			.append(" bytes (").append(String.format(Locale.ROOT, "%.1f", getUtilizationPercent())).append("%)\n");
		sb.append("  Memory Pressure: ").append(String.format(Locale.ROOT, "%.2f", getMemoryPressure())).append("\n");
		return sb.toString();
	}

	@Override
	public String exportReport() {
		return cache.exportReport();
	}

	private CacheMetrics metrics() {
		return cache.metrics();
	}

	private static String percent(double value) {
		return String.format(Locale.ROOT, "%.2f", value);
	}

	@Override
	public String toString() {
		return "ContentCacheStatistics{" +
			"cacheName='" + cacheName + '\'' +
			", requests=" + getRequestCount() +
			", hitRate=" + percent(getHitRatePercent()) + "%" +
			", currentSizeBytes=" + getCurrentSizeBytes() +
			", maxSizeBytes=" + getMaxSizeBytes() +
			'}';
	}
}
