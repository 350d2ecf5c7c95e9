package org.scriptonbasestar.contentcache.spring.actuator;

import org.scriptonbasestar.contentcache.store.cache.SBContentCache;
import org.scriptonbasestar.contentcache.store.metrics.CacheHealthCheck;
import org.scriptonbasestar.contentcache.store.metrics.CacheStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Locale;

/**
 * Spring Boot Actuator HealthIndicator for the content cache.
 * <p>
 * Reports DOWN when memory pressure is above the configured threshold; low hit rate and high
 * utilisation are reported as warnings while staying UP.
 * </p>
 *
 * <h3>Response Format:</h3>
 * <pre>{@code
 * {
 *   "status": "UP",
 *   "details": {
 *     "cacheName": "assets",
 *     "requestCount": 1000,
 *     "hitRate": "85.00%",
 *     "entryCount": 412,
 *     "memoryUsed": 52428800,
 *     "maxSize": 134217728,
 *     "utilization": "39.06%",
 *     "memoryPressure": 0.12
 *   }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class ContentCacheHealthIndicator implements HealthIndicator {

	private final SBContentCache cache;
	private final CacheHealthCheck.HealthThresholds thresholds;

	public ContentCacheHealthIndicator(SBContentCache cache) {
		this(cache, CacheHealthCheck.HealthThresholds.DEFAULT);
	}

	/**
	 * @param cache      the cache to monitor
	 * @param thresholds custom health thresholds
	 */
	public ContentCacheHealthIndicator(SBContentCache cache, CacheHealthCheck.HealthThresholds thresholds) {
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		if (thresholds == null) {
			throw new IllegalArgumentException("thresholds must not be null");
		}
		this.cache = cache;
		this.thresholds = thresholds;
	}

	@Override
	public Health health() {
		CacheStats stats = cache.getStats();
		CacheHealthCheck.HealthStatus status = CacheHealthCheck.evaluate(stats, thresholds);

		Health.Builder builder = status.isHealthy() ? Health.up() : Health.down();

		builder.withDetail("cacheName", cache.getName());
		builder.withDetail("requestCount", stats.totalRequests());
		builder.withDetail("hitCount", stats.hits());
		builder.withDetail("missCount", stats.misses());
		builder.withDetail("hitRate", String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100));
		builder.withDetail("evictionCount", stats.evictions());
		builder.withDetail("entryCount", stats.entryCount());
		builder.withDetail("memoryUsed", stats.currentSize());
		builder.withDetail("maxSize", stats.maxSize());
		builder.withDetail("utilization", String.format(Locale.ROOT, "%.2f%%", stats.utilization() * 100));
		builder.withDetail("memoryPressure", stats.memoryPressure());

		// 경고 및 에러 정보
		if (status.warnings().length > 0) {
			builder.withDetail("warnings", status.warnings());
		}
		if (status.errors().length > 0) {
			builder.withDetail("errors", status.errors());
		}
		if (status.info().length > 0) {
			builder.withDetail("info", status.info());
		}

		return builder.build();
	}

	public SBContentCache getCache() {
		return cache;
	}
}
