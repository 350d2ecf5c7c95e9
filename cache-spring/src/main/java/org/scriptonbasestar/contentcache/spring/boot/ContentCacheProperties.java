package org.scriptonbasestar.contentcache.spring.boot;

import org.scriptonbasestar.contentcache.store.cache.SBContentCache;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Configuration properties for the content cache.
 * <p>
 * Bind to {@code sb-content-cache.*} properties in application.yml/properties.
 * </p>
 *
 * <h3>Example Configuration:</h3>
 * <pre>{@code
 * # application.yml
 * sb-content-cache:
 *   name: assets
 *   max-size: 256MB
 *   cleanup-threshold: 0.8
 *   cleanup-target: 0.6
 *   min-idle-time: 5m
 *   max-age: 1h
 *   cleanup-interval: 60s
 *   enable-jmx: true
 *   auto-cleanup:
 *     enabled: true
 *     interval: 1m
 *   memory-pressure-monitor:
 *     enabled: true
 *     interval: 10s
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@ConfigurationProperties(prefix = "sb-content-cache")
public class ContentCacheProperties {

	/**
	 * Cache name, used for JMX, metrics tags and logging.
	 */
	private String name = SBContentCache.DEFAULT_NAME;

	/**
	 * Capacity.
	 */
	private DataSize maxSize = DataSize.ofBytes(SBContentCache.DEFAULT_MAX_SIZE);

	/**
	 * Entry count hint (null = max-size / 1KB, 0 = disabled).
	 */
	private Integer maxEntries;

	/**
	 * Utilisation above which inserts reclaim space.
	 */
	private double cleanupThreshold = 0.8;

	/**
	 * Utilisation that space reclamation aims for.
	 */
	private double cleanupTarget = 0.6;

	/**
	 * Idle time a NORMAL entry needs before it can be evicted for space.
	 */
	private Duration minIdleTime = Duration.ofMinutes(5);

	/**
	 * Absolute entry lifetime.
	 */
	private Duration maxAge = Duration.ofHours(1);

	/**
	 * Minimum spacing between idle-expiry sweeps.
	 */
	private Duration cleanupInterval = Duration.ofSeconds(60);

	/**
	 * Enable JMX monitoring.
	 */
	private boolean enableJmx = false;

	private AutoCleanup autoCleanup = new AutoCleanup();

	private MemoryPressureMonitor memoryPressureMonitor = new MemoryPressureMonitor();

	// Getters and Setters

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public DataSize getMaxSize() {
		return maxSize;
	}

	public void setMaxSize(DataSize maxSize) {
		this.maxSize = maxSize;
	}

	public Integer getMaxEntries() {
		return maxEntries;
	}

	public void setMaxEntries(Integer maxEntries) {
		this.maxEntries = maxEntries;
	}

	public double getCleanupThreshold() {
		return cleanupThreshold;
	}

	public void setCleanupThreshold(double cleanupThreshold) {
		this.cleanupThreshold = cleanupThreshold;
	}

	public double getCleanupTarget() {
		return cleanupTarget;
	}

	public void setCleanupTarget(double cleanupTarget) {
		this.cleanupTarget = cleanupTarget;
	}

	public Duration getMinIdleTime() {
		return minIdleTime;
	}

	public void setMinIdleTime(Duration minIdleTime) {
		this.minIdleTime = minIdleTime;
	}

	public Duration getMaxAge() {
		return maxAge;
	}

	public void setMaxAge(Duration maxAge) {
		this.maxAge = maxAge;
	}

	public Duration getCleanupInterval() {
		return cleanupInterval;
	}

	public void setCleanupInterval(Duration cleanupInterval) {
		this.cleanupInterval = cleanupInterval;
	}

	public boolean isEnableJmx() {
		return enableJmx;
	}

	public void setEnableJmx(boolean enableJmx) {
		this.enableJmx = enableJmx;
	}

	public AutoCleanup getAutoCleanup() {
		return autoCleanup;
	}

	public void setAutoCleanup(AutoCleanup autoCleanup) {
		this.autoCleanup = autoCleanup;
	}

	public MemoryPressureMonitor getMemoryPressureMonitor() {
		return memoryPressureMonitor;
	}

	public void setMemoryPressureMonitor(MemoryPressureMonitor memoryPressureMonitor) {
		this.memoryPressureMonitor = memoryPressureMonitor;
	}

	/**
	 * Auto cleanup configuration.
	 */
	public static class AutoCleanup {

		/**
		 * Run cleanupExpired() on a background thread.
		 */
		private boolean enabled = false;

		private Duration interval = Duration.ofMinutes(1);

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public Duration getInterval() {
			return interval;
		}

		public void setInterval(Duration interval) {
			this.interval = interval;
		}
	}

	/**
	 * JVM heap pressure sampling.
	 */
	public static class MemoryPressureMonitor {

		private boolean enabled = false;

		private Duration interval = Duration.ofSeconds(10);

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public Duration getInterval() {
			return interval;
		}

		public void setInterval(Duration interval) {
			this.interval = interval;
		}
	}
}
