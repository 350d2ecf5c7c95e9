package org.scriptonbasestar.contentcache.core.entry;

import org.scriptonbasestar.contentcache.core.strategy.CachePriority;

/**
 * An item to preload into the cache before traffic starts.
 *
 * @author archmagece
 * @since 2025-02
 */
public class WarmupEntry {

	private final String key;
	private final byte[] data;
	private final CachePriority priority;

	public WarmupEntry(String key, byte[] data) {
		this(key, data, CachePriority.NORMAL);
	}

	public WarmupEntry(String key, byte[] data, CachePriority priority) {
		if (key == null || key.isEmpty()) {
			throw new IllegalArgumentException("key must not be null or empty");
		}
		if (data == null) {
			throw new IllegalArgumentException("data must not be null");
		}
		this.key = key;
		this.data = data;
		this.priority = priority != null ? priority : CachePriority.NORMAL;
	}

	public String getKey() {
		return key;
	}

	public byte[] getData() {
		return data;
	}

	public CachePriority getPriority() {
		return priority;
	}
}
