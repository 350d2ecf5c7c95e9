package org.scriptonbasestar.contentcache.store.report;

import org.scriptonbasestar.contentcache.core.entry.CacheEntry;

import java.time.Duration;

/**
 * Read-only view of one entry, taken while the cache lock is held.
 *
 * @author archmagece
 * @since 2025-02
 */
public class HotEntry {

	private final String key;
	private final long accessCount;
	private final double accessFrequency;
	private final int size;
	private final Duration idleTime;

	public HotEntry(String key, long accessCount, double accessFrequency, int size, Duration idleTime) {
		this.key = key;
		this.accessCount = accessCount;
		this.accessFrequency = accessFrequency;
		this.size = size;
		this.idleTime = idleTime;
	}

	public static HotEntry of(CacheEntry entry, long nowNanos) {
		return new HotEntry(
			entry.getKey(),
			entry.getAccessCount(),
			entry.accessFrequency(nowNanos),
			entry.getSize(),
			entry.idleTime(nowNanos)
		);
	}

	public String getKey() {
		return key;
	}

	public long getAccessCount() {
		return accessCount;
	}

	/**
	 * @return accesses per second
	 */
	public double getAccessFrequency() {
		return accessFrequency;
	}

	public int getSize() {
		return size;
	}

	public Duration getIdleTime() {
		return idleTime;
	}

	@Override
	public String toString() {
		return "HotEntry{key='" + key + "', accessCount=" + accessCount + ", size=" + size + "}";
	}
}
