package org.scriptonbasestar.contentcache.spring.boot;

import org.scriptonbasestar.contentcache.store.cache.SBContentCache;
import org.scriptonbasestar.contentcache.store.pressure.HeapMemoryPressureMonitor;
import org.scriptonbasestar.contentcache.spring.actuator.ContentCacheHealthIndicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot Auto-Configuration for the content cache.
 * <p>
 * This auto-configuration will be triggered when:
 * <ul>
 *   <li>SBContentCache class is on the classpath</li>
 *   <li>No SBContentCache bean is already defined</li>
 * </ul>
 * The cache is an injected bean, closed when the context shuts down.
 * </p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * @Service
 * public class TextureService {
 *     private final SBContentCache cache;
 *
 *     public TextureService(SBContentCache cache) {
 *         this.cache = cache;
 *     }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(SBContentCache.class)
@EnableConfigurationProperties(ContentCacheProperties.class)
public class ContentCacheAutoConfiguration {

	private static final Logger log = LoggerFactory.getLogger(ContentCacheAutoConfiguration.class);

	/**
	 * Creates the cache from {@code sb-content-cache.*} properties if none is already defined.
	 *
	 * @param properties bound properties
	 * @return configured cache
	 */
	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	public SBContentCache sbContentCache(ContentCacheProperties properties) {
		SBContentCache.Builder builder = SBContentCache.builder()
			.name(properties.getName())
			.maxSize(properties.getMaxSize().toBytes())
			.cleanupThreshold(properties.getCleanupThreshold())
			.cleanupTarget(properties.getCleanupTarget())
			.minIdleTime(properties.getMinIdleTime())
			.maxAge(properties.getMaxAge())
			.cleanupInterval(properties.getCleanupInterval());

		if (properties.getMaxEntries() != null) {
			builder.maxEntries(properties.getMaxEntries());
		}
		if (properties.getAutoCleanup().isEnabled()) {
			builder.enableAutoCleanup(properties.getAutoCleanup().getInterval());
		}
		if (properties.isEnableJmx()) {
			builder.enableJmx(properties.getName());
		}

		SBContentCache cache = builder.build();
		log.info("Configured content cache '{}' with max size {}", cache.getName(), properties.getMaxSize());
		return cache;
	}

	/**
	 * Feeds JVM heap pressure into the cache.
	 *
	 * @param cache the cache
	 * @param properties bound properties
	 * @return started monitor
	 */
	@Bean(initMethod = "start", destroyMethod = "close")
	@ConditionalOnMissingBean
	@ConditionalOnProperty(prefix = "sb-content-cache.memory-pressure-monitor", name = "enabled", havingValue = "true")
	public HeapMemoryPressureMonitor heapMemoryPressureMonitor(SBContentCache cache, ContentCacheProperties properties) {
		return new HeapMemoryPressureMonitor(cache, properties.getMemoryPressureMonitor().getInterval());
	}

	/**
	 * Only activated when Spring Boot Actuator is on the classpath.
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
	static class ContentCacheHealthConfiguration {

		@Bean
		@ConditionalOnMissingBean(name = "sbContentCacheHealthIndicator")
		public ContentCacheHealthIndicator sbContentCacheHealthIndicator(SBContentCache cache) {
			return new ContentCacheHealthIndicator(cache);
		}
	}
}
