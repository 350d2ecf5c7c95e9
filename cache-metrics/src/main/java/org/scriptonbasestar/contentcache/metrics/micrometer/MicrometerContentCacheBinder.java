package org.scriptonbasestar.contentcache.metrics.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.BaseUnits;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.scriptonbasestar.contentcache.store.cache.SBContentCache;
import org.scriptonbasestar.contentcache.store.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SBContentCache를 Micrometer MeterRegistry에 바인딩합니다.
 *
 * 카운터는 캐시의 {@link CacheMetrics}를 직접 읽는 FunctionCounter이므로 별도 동기화가 필요 없습니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * new MicrometerContentCacheBinder(cache).bindTo(registry);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class MicrometerContentCacheBinder implements MeterBinder {

	private static final Logger log = LoggerFactory.getLogger(MicrometerContentCacheBinder.class);

	private final SBContentCache cache;
	private final String cacheName;
	private final Iterable<Tag> tags;

	/**
	 * 캐시 이름을 태그로 사용합니다.
	 *
	 * @param cache 대상 캐시
	 */
	public MicrometerContentCacheBinder(SBContentCache cache) {
		this(cache, cache == null ? null : cache.getName(), Tags.empty());
	}

	/**
	 * @param cache 대상 캐시
	 * @param cacheName 캐시 이름 (태그로 사용)
	 * @param extraTags 추가 태그
	 */
	public MicrometerContentCacheBinder(SBContentCache cache, String cacheName, Iterable<Tag> extraTags) {
		if (cache == null) {
			throw new IllegalArgumentException("Cache must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}
		this.cache = cache;
		this.cacheName = cacheName;
		this.tags = Tags.concat(extraTags, "cache", cacheName);
	}

	@Override
	public void bindTo(MeterRegistry registry) {
		CacheMetrics metrics = cache.metrics();

		FunctionCounter.builder("cache.hits", metrics, CacheMetrics::hitCount)
			.tags(tags)
			.description("Cache hit count")
			.register(registry);

		FunctionCounter.builder("cache.misses", metrics, CacheMetrics::missCount)
			.tags(tags)
			.description("Cache miss count")
			.register(registry);

		FunctionCounter.builder("cache.puts", metrics, CacheMetrics::insertionCount)
			.tags(tags)
			.description("Entries inserted or replaced")
			.register(registry);

		FunctionCounter.builder("cache.evictions", metrics, CacheMetrics::evictionCount)
			.tags(tags)
			.description("Entries removed by eviction, expiry or explicit removal")
			.register(registry);

		Gauge.builder("cache.size", cache, SBContentCache::size)
			.tags(tags)
			.description("Number of cached entries")
			.strongReference(true)
			.register(registry);

		Gauge.builder("cache.memory.used", cache, SBContentCache::getMemoryUsage)
			.tags(tags)
			.baseUnit(BaseUnits.BYTES)
			.description("Sum of cached entry sizes")
			.strongReference(true)
			.register(registry);

		Gauge.builder("cache.memory.max", cache, SBContentCache::getMaxSize)
			.tags(tags)
			.baseUnit(BaseUnits.BYTES)
			.description("Cache capacity")
			.strongReference(true)
			.register(registry);

		Gauge.builder("cache.utilization", cache, SBContentCache::utilization)
			.tags(tags)
			.description("Memory used / capacity")
			.strongReference(true)
			.register(registry);

		Gauge.builder("cache.memory.pressure", cache, SBContentCache::getMemoryPressure)
			.tags(tags)
			.description("Last reported memory pressure")
			.strongReference(true)
			.register(registry);

		Gauge.builder("cache.hit.rate", metrics, CacheMetrics::hitRate)
			.tags(tags)
			.description("Hits / requests")
			.strongReference(true)
			.register(registry);

		log.debug("Bound cache '{}' to meter registry {}", cacheName, registry.getClass().getSimpleName());
	}

	public String getCacheName() {
		return cacheName;
	}

	public SBContentCache getCache() {
		return cache;
	}
}
