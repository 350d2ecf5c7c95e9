package org.scriptonbasestar.contentcache.core.entry;

import org.scriptonbasestar.contentcache.core.strategy.CachePriority;
import org.scriptonbasestar.contentcache.core.util.TimeCheckerUtil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A cached byte blob with its bookkeeping.
 * <p>
 * Key, payload, priority, tags and creation time are fixed at construction. Only
 * {@link #access(long)} mutates the entry (last access time and access count), and only the
 * owning cache calls it, under the cache lock. Replacing a key replaces the whole entry.
 * </p>
 * <p>
 * The payload array is held as given. Callers that keep a reference to it must not modify it;
 * the cache copies caller arrays before building entries.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public class CacheEntry {

	private static final double NANOS_PER_SECOND = 1_000_000_000.0;

	private final String key;
	private final byte[] data;
	private final int size;
	private final long createdAt;
	private long lastAccessed;
	private long accessCount;
	private final CachePriority priority;
	private final List<String> tags;

	public CacheEntry(String key, byte[] data, CachePriority priority, long nowNanos) {
		this(key, data, priority, Collections.emptyList(), nowNanos);
	}

	public CacheEntry(String key, byte[] data, CachePriority priority, Collection<String> tags, long nowNanos) {
		if (key == null || key.isEmpty()) {
			throw new IllegalArgumentException("key must not be null or empty");
		}
		if (data == null) {
			throw new IllegalArgumentException("data must not be null");
		}
		this.key = key;
		this.data = data;
		this.size = data.length;
		this.createdAt = nowNanos;
		this.lastAccessed = nowNanos;
		// 삽입 자체를 첫 번째 접근으로 센다
		this.accessCount = 1;
		this.priority = priority != null ? priority : CachePriority.NORMAL;
		this.tags = tags == null || tags.isEmpty()
			? Collections.emptyList()
			: Collections.unmodifiableList(new ArrayList<>(tags));
	}

	/**
	 * Records a successful read.
	 *
	 * @param nowNanos current ticker reading
	 * @return the payload (not a copy)
	 */
	public byte[] access(long nowNanos) {
		if (nowNanos > lastAccessed) {
			lastAccessed = nowNanos;
		}
		accessCount++;
		return data;
	}

	public Duration age(long nowNanos) {
		return TimeCheckerUtil.elapsed(createdAt, nowNanos);
	}

	public Duration idleTime(long nowNanos) {
		return TimeCheckerUtil.elapsed(lastAccessed, nowNanos);
	}

	/**
	 * Accesses per second since creation. Ages under one second count as one second so a
	 * freshly inserted entry does not look infinitely hot.
	 *
	 * @param nowNanos current ticker reading
	 * @return access frequency in Hz
	 */
	public double accessFrequency(long nowNanos) {
		double ageSeconds = Math.max(1.0, age(nowNanos).toNanos() / NANOS_PER_SECOND);
		return accessCount / ageSeconds;
	}

	public String getKey() {
		return key;
	}

	public byte[] getData() {
		return data;
	}

	public int getSize() {
		return size;
	}

	public long getCreatedAt() {
		return createdAt;
	}

	public long getLastAccessed() {
		return lastAccessed;
	}

	public long getAccessCount() {
		return accessCount;
	}

	public CachePriority getPriority() {
		return priority;
	}

	public List<String> getTags() {
		return tags;
	}

	@Override
	public String toString() {
		return "CacheEntry{key=" + key
			+ ", size=" + size
			+ ", priority=" + priority
			+ ", accessCount=" + accessCount
			+ ", tags=" + tags + "}";
	}
}
