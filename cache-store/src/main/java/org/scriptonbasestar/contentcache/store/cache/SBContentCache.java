package org.scriptonbasestar.contentcache.store.cache;

import org.scriptonbasestar.contentcache.core.entry.CacheEntry;
import org.scriptonbasestar.contentcache.core.entry.WarmupEntry;
import org.scriptonbasestar.contentcache.core.strategy.CachePriority;
import org.scriptonbasestar.contentcache.core.strategy.EvictionPolicy;
import org.scriptonbasestar.contentcache.core.util.Ticker;
import org.scriptonbasestar.contentcache.core.util.TimeCheckerUtil;
import org.scriptonbasestar.contentcache.store.eviction.PriorityIdleEvictionPolicy;
import org.scriptonbasestar.contentcache.store.jmx.ContentCacheStatistics;
import org.scriptonbasestar.contentcache.store.jmx.JmxHelper;
import org.scriptonbasestar.contentcache.store.metrics.CacheMetrics;
import org.scriptonbasestar.contentcache.store.metrics.CacheStats;
import org.scriptonbasestar.contentcache.store.recency.RecencyIndex;
import org.scriptonbasestar.contentcache.store.report.CacheReportExporter;
import org.scriptonbasestar.contentcache.store.report.HotEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, priority-aware cache of byte blobs.
 *
 * <pre>{@code
 * SBContentCache cache = SBContentCache.builder()
 *     .maxSize(64 * 1024 * 1024)
 *     .minIdleTime(Duration.ofMinutes(5))
 *     .enableAutoCleanup(Duration.ofMinutes(1))
 *     .build();
 *
 * cache.insert("textures/grass.png", bytes, CachePriority.HIGH);
 * Optional<byte[]> hit = cache.get("textures/grass.png");
 * }</pre>
 *
 * Features:
 * - Byte accounting: 항목 크기의 합을 maxSize 기준으로 관리
 * - LRU recency: get/insert 시 head로 이동, 축출은 tail부터
 * - Priority retention: 우선순위가 높을수록 더 오래 idle 상태여야 축출 대상
 * - Idle expiry: cleanupInterval마다 maxAge 초과 항목과 오래 쓰지 않은 LOW 항목 제거
 * - Memory pressure: 외부 압력 값에 따라 공간 회수 또는 만료 정리
 * - Metrics / report / JMX: 히트율, 사용량, 핫 항목 보고서
 *
 * The entry map, the recency index and the byte total are guarded by one read/write lock, so
 * each public call observes and leaves them consistent. Counters live in {@link CacheMetrics}.
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBContentCache implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(SBContentCache.class);

	public static final long DEFAULT_MAX_SIZE = 128L * 1024 * 1024;
	public static final String DEFAULT_NAME = "sb-content-cache";

	static final double HIGH_PRESSURE = 0.8;
	static final double MODERATE_PRESSURE = 0.6;

	private final String name;
	private final long maxSize;
	private final int maxEntries;  // 0이면 비활성화
	private final double cleanupThreshold;
	private final double cleanupTarget;
	private final Duration cleanupInterval;
	private final EvictionPolicy evictionPolicy;
	private final Ticker ticker;
	private final CacheReportExporter reportExporter;
	private final CacheMetrics metrics = new CacheMetrics();

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
	private final Map<String, CacheEntry> entries = new HashMap<>();
	private final RecencyIndex<String> recency = new RecencyIndex<>();
	private long currentSize;
	private long lastCleanup;

	private volatile double memoryPressure;

	private final ScheduledExecutorService cleanupExecutor;  // 자동 정리용
	private final AtomicBoolean closed = new AtomicBoolean(false);
	private volatile ContentCacheStatistics jmxMBean;
	private volatile String jmxCacheName;

	/**
	 * 128 MiB 기본 용량으로 생성합니다.
	 */
	public SBContentCache() {
		this(DEFAULT_MAX_SIZE);
	}

	/**
	 * @param maxSize 최대 용량 (bytes)
	 */
	public SBContentCache(long maxSize) {
		this(new Builder().maxSize(maxSize));
	}

	private SBContentCache(Builder builder) {
		builder.validate();
		this.name = builder.name;
		this.maxSize = builder.maxSize;
		this.maxEntries = builder.maxEntries >= 0
			? builder.maxEntries
			: (int) Math.min(Integer.MAX_VALUE, builder.maxSize / 1024);
		this.cleanupThreshold = builder.cleanupThreshold;
		this.cleanupTarget = builder.cleanupTarget;
		this.cleanupInterval = builder.cleanupInterval;
		this.evictionPolicy = builder.evictionPolicy != null
			? builder.evictionPolicy
			: new PriorityIdleEvictionPolicy(builder.minIdleTime, builder.maxAge);
		this.ticker = builder.ticker;
		this.reportExporter = builder.reportExporter != null ? builder.reportExporter : new CacheReportExporter();
		this.lastCleanup = ticker.read();

		if (builder.autoCleanupInterval != null) {
			this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
				Thread t = new Thread(r, "SBContentCache-Cleanup");
				t.setDaemon(true);
				return t;
			});
			long periodMillis = Math.max(1, builder.autoCleanupInterval.toMillis());
			this.cleanupExecutor.scheduleAtFixedRate(
				this::scheduledCleanup,
				periodMillis,
				periodMillis,
				TimeUnit.MILLISECONDS
			);
			log.debug("Auto cleanup enabled for cache '{}' with interval: {}", name, builder.autoCleanupInterval);
		} else {
			this.cleanupExecutor = null;
		}

		if (builder.enableJmx) {
			registerJmx(name);
		}

		log.debug("Created cache '{}': maxSize={} bytes, maxEntries={}, policy={}",
			name, maxSize, maxEntries, evictionPolicy);
	}

	/**
	 * Builder 패턴을 사용하여 SBContentCache를 생성합니다.
	 *
	 * @return Builder 인스턴스
	 */
	public static Builder builder() {
		return new Builder();
	}

	// ===== Core Operations =====

	/**
	 * NORMAL 우선순위로 저장합니다.
	 *
	 * @see #insert(String, byte[], CachePriority, Collection)
	 */
	public void insert(String key, byte[] data) {
		insert(key, data, CachePriority.NORMAL, Collections.emptyList());
	}

	/**
	 * @see #insert(String, byte[], CachePriority, Collection)
	 */
	public void insert(String key, byte[] data, CachePriority priority) {
		insert(key, data, priority, Collections.emptyList());
	}

	/**
	 * Stores a copy of {@code data} under {@code key}, replacing any previous entry.
	 * <p>
	 * Space is reclaimed first when the projected size would exceed the capacity or when the
	 * cache is already crowded. The key being inserted is never evicted. Insertion always
	 * succeeds, so the byte total may stay above the capacity when nothing is eligible for eviction.
	 * </p>
	 *
	 * @param key non-empty key
	 * @param data payload, copied
	 * @param priority retention priority, null means NORMAL
	 * @param tags free-form labels, not used by eviction
	 * @throws IllegalArgumentException if key is null or empty or data is null
	 */
	public void insert(String key, byte[] data, CachePriority priority, Collection<String> tags) {
		if (key == null || key.isEmpty()) {
			throw new IllegalArgumentException("key must not be null or empty");
		}
		if (data == null) {
			throw new IllegalArgumentException("data must not be null");
		}
		long now = ticker.read();
		CacheEntry entry = new CacheEntry(key, data.clone(), priority, tags, now);
		log.trace("insert - key : {}, size : {}, priority : {}", key, entry.getSize(), entry.getPriority());

		lock.writeLock().lock();
		try {
			if (shouldMakeSpace(entry.getSize())) {
				makeSpaceLocked(entry.getSize(), key, now);
			}
			CacheEntry previous = entries.put(key, entry);
			if (previous != null) {
				currentSize -= previous.getSize();
			}
			currentSize += entry.getSize();
			recency.moveToFront(key);
		} finally {
			lock.writeLock().unlock();
		}
		metrics.recordInsertion();
	}

	/**
	 * Looks up a key, counting the request as a hit or a miss. A hit refreshes the entry's access
	 * time and moves it to the head of the recency order.
	 *
	 * @param key key
	 * @return a copy of the payload, or empty
	 */
	public Optional<byte[]> get(String key) {
		byte[] data;
		lock.writeLock().lock();
		try {
			CacheEntry entry = entries.get(key);
			if (entry == null) {
				data = null;
			} else {
				data = entry.access(ticker.read());
				recency.moveToFront(key);
			}
		} finally {
			lock.writeLock().unlock();
		}

		if (data == null) {
			metrics.recordMiss();
			log.trace("get miss - key : {}", key);
			return Optional.empty();
		}
		metrics.recordHit();
		log.trace("get hit - key : {}", key);
		return Optional.of(data.clone());
	}

	/**
	 * Removes a key. Counted as an eviction.
	 *
	 * @param key key
	 * @return the removed payload, or empty
	 */
	public Optional<byte[]> remove(String key) {
		CacheEntry removed;
		lock.writeLock().lock();
		try {
			removed = removeLocked(key);
		} finally {
			lock.writeLock().unlock();
		}
		if (removed == null) {
			return Optional.empty();
		}
		log.trace("removed - key : {}", key);
		return Optional.of(removed.getData());
	}

	public boolean contains(String key) {
		lock.readLock().lock();
		try {
			return entries.containsKey(key);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Drops every entry. Counters are kept; see {@link #resetStatistics()}.
	 */
	public void clear() {
		int cleared;
		lock.writeLock().lock();
		try {
			cleared = entries.size();
			entries.clear();
			recency.clear();
			currentSize = 0;
		} finally {
			lock.writeLock().unlock();
		}
		log.info("Cleared cache '{}' ({} entries)", name, cleared);
	}

	// ===== Maintenance =====

	/**
	 * Removes expired entries according to the eviction policy. Runs at most once per cleanup
	 * interval; calls inside the interval return 0.
	 *
	 * @return number of removed entries
	 */
	public int cleanupExpired() {
		lock.writeLock().lock();
		try {
			long now = ticker.read();
			if (!TimeCheckerUtil.hasElapsed(lastCleanup, now, cleanupInterval)) {
				return 0;
			}
			List<String> expired = new ArrayList<>();
			for (CacheEntry entry : entries.values()) {
				if (evictionPolicy.isExpired(entry, now)) {
					expired.add(entry.getKey());
				}
			}
			for (String key : expired) {
				removeLocked(key);
				log.trace("Removed expired key: {}", key);
			}
			lastCleanup = now;
			if (!expired.isEmpty()) {
				log.debug("Cleaned up {} expired entries from cache '{}'", expired.size(), name);
			}
			return expired.size();
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Records external memory pressure and reacts to it: above 0.8 space is reclaimed down to the
	 * cleanup target, above 0.6 an idle-expiry sweep runs.
	 *
	 * @param pressure pressure in [0, 1]; out of range values are clamped and NaN counts as 0
	 */
	public void setMemoryPressure(double pressure) {
		double clamped = Double.isNaN(pressure) ? 0.0 : Math.max(0.0, Math.min(1.0, pressure));
		this.memoryPressure = clamped;
		log.trace("Memory pressure for cache '{}' set to {}", name, clamped);

		if (clamped > HIGH_PRESSURE) {
			lock.writeLock().lock();
			try {
				makeSpaceLocked(0, null, ticker.read());
			} finally {
				lock.writeLock().unlock();
			}
		} else if (clamped > MODERATE_PRESSURE) {
			cleanupExpired();
		}
	}

	/**
	 * Reorders the recency index so that the most frequently accessed entries sit nearest the
	 * head. Entries with equal frequency keep their relative order.
	 */
	public void optimize() {
		long started = System.nanoTime();
		int count;
		lock.writeLock().lock();
		try {
			long now = ticker.read();
			List<String> ordered = recency.keysFromHead();
			Map<String, Double> frequencies = new HashMap<>();
			for (String key : ordered) {
				frequencies.put(key, entries.get(key).accessFrequency(now));
			}
			ordered.sort(Comparator.comparing((String key) -> frequencies.get(key), Comparator.reverseOrder()));
			recency.rebuild(ordered);
			count = ordered.size();
		} finally {
			lock.writeLock().unlock();
		}
		log.info("Optimized cache '{}' recency order for {} entries in {} µs",
			name, count, TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - started));
	}

	/**
	 * Bulk insert at start-up.
	 *
	 * @param items entries to insert
	 */
	public void warmUp(Collection<WarmupEntry> items) {
		if (items == null) {
			throw new IllegalArgumentException("items must not be null");
		}
		log.info("Starting warm-up of cache '{}' with {} items", name, items.size());
		long bytes = 0;
		for (WarmupEntry item : items) {
			insert(item.getKey(), item.getData(), item.getPriority());
			bytes += item.getData().length;
		}
		log.info("Cache '{}' warmed up with {} items ({} bytes)", name, items.size(), bytes);
	}

	/**
	 * @param items key to payload
	 * @param priority priority applied to every item
	 */
	public void warmUp(Map<String, byte[]> items, CachePriority priority) {
		if (items == null) {
			throw new IllegalArgumentException("items must not be null");
		}
		List<WarmupEntry> warmup = new ArrayList<>(items.size());
		for (Map.Entry<String, byte[]> item : items.entrySet()) {
			warmup.add(new WarmupEntry(item.getKey(), item.getValue(), priority));
		}
		warmUp(warmup);
	}

	/**
	 * 통계를 초기화합니다. 캐시 데이터는 유지됩니다.
	 */
	public void resetStatistics() {
		metrics.reset();
		log.info("Reset statistics of cache '{}'", name);
	}

	// ===== Stats & Report =====

	public CacheStats getStats() {
		lock.readLock().lock();
		try {
			long now = ticker.read();
			Duration oldest = Duration.ZERO;
			for (CacheEntry entry : entries.values()) {
				Duration age = entry.age(now);
				if (age.compareTo(oldest) > 0) {
					oldest = age;
				}
			}
			return new CacheStats(
				metrics.hitCount(),
				metrics.missCount(),
				metrics.insertionCount(),
				metrics.evictionCount(),
				currentSize,
				maxSize,
				entries.size(),
				oldest,
				memoryPressure
			);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Human-readable report with the ten most accessed entries and a JSON snapshot.
	 *
	 * @return report text
	 * @throws org.scriptonbasestar.contentcache.core.exception.SBCacheReportException if the
	 *         snapshot cannot be serialised
	 */
	public String exportReport() {
		CacheStats stats = getStats();
		List<HotEntry> hot;
		lock.readLock().lock();
		try {
			long now = ticker.read();
			List<CacheEntry> sorted = new ArrayList<>(entries.values());
			sorted.sort(Comparator.comparingLong(CacheEntry::getAccessCount).reversed());
			int limit = Math.min(CacheReportExporter.HOT_ENTRY_LIMIT, sorted.size());
			hot = new ArrayList<>(limit);
			for (int i = 0; i < limit; i++) {
				hot.add(HotEntry.of(sorted.get(i), now));
			}
		} finally {
			lock.readLock().unlock();
		}
		return reportExporter.export(stats, hot);
	}

	/**
	 * @return JSON snapshot of {@link #getStats()}
	 */
	public String exportStatsJson() {
		return reportExporter.toJson(getStats());
	}

	// ===== Accessors =====

	/**
	 * @return sum of entry sizes in bytes
	 */
	public long getMemoryUsage() {
		lock.readLock().lock();
		try {
			return currentSize;
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * @return memory usage / max size, may exceed 1.0 transiently
	 */
	public double utilization() {
		return (double) getMemoryUsage() / maxSize;
	}

	public double getMemoryPressure() {
		return memoryPressure;
	}

	public long getMaxSize() {
		return maxSize;
	}

	public int getMaxEntries() {
		return maxEntries;
	}

	public double getCleanupThreshold() {
		return cleanupThreshold;
	}

	public double getCleanupTarget() {
		return cleanupTarget;
	}

	public Duration getCleanupInterval() {
		return cleanupInterval;
	}

	public EvictionPolicy getEvictionPolicy() {
		return evictionPolicy;
	}

	public String getName() {
		return name;
	}

	public int size() {
		lock.readLock().lock();
		try {
			return entries.size();
		} finally {
			lock.readLock().unlock();
		}
	}

	public Set<String> keySet() {
		lock.readLock().lock();
		try {
			return new HashSet<>(entries.keySet());
		} finally {
			lock.readLock().unlock();
		}
	}

	public CacheMetrics metrics() {
		return metrics;
	}

	public boolean isClosed() {
		return closed.get();
	}

	/**
	 * @return recency order, most recent first
	 */
	List<String> recencyKeys() {
		lock.readLock().lock();
		try {
			return recency.keysFromHead();
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Checks the structural invariants: byte total equals the sum of entry sizes and the
	 * recency index holds exactly the entry keys in one well formed chain.
	 */
	boolean isConsistent() {
		lock.readLock().lock();
		try {
			long sum = 0;
			for (CacheEntry entry : entries.values()) {
				sum += entry.getSize();
			}
			return sum == currentSize
				&& recency.isConsistent()
				&& recency.size() == entries.size()
				&& new HashSet<>(recency.keysFromHead()).equals(entries.keySet());
		} finally {
			lock.readLock().unlock();
		}
	}

	// ===== Internals =====

	private boolean shouldMakeSpace(int neededSize) {
		if (currentSize + neededSize > maxSize) {
			return true;
		}
		if (maxEntries > 0 && entries.size() >= maxEntries) {
			return true;
		}
		return (double) currentSize / maxSize > cleanupThreshold;
	}

	/**
	 * Walks the recency index from the tail and evicts eligible entries until enough bytes are
	 * freed to bring the total down to the cleanup target plus {@code neededSize}.
	 *
	 * @return number of evicted entries
	 */
	private int makeSpaceLocked(long neededSize, String excludedKey, long now) {
		long targetSize = (long) (maxSize * cleanupTarget);
		if (currentSize <= targetSize) {
			return 0;
		}
		long spaceToFree = currentSize - targetSize + neededSize;
		long freedSpace = 0;
		List<String> victims = new ArrayList<>();

		String cursor = recency.tail();
		while (cursor != null && freedSpace < spaceToFree) {
			CacheEntry candidate = entries.get(cursor);
			if (!cursor.equals(excludedKey) && evictionPolicy.isEvictable(candidate, now)) {
				victims.add(cursor);
				freedSpace += candidate.getSize();
			}
			cursor = recency.previous(cursor);
		}

		for (String key : victims) {
			removeLocked(key);
			log.trace("Evicting key due to size pressure: {}", key);
		}
		if (freedSpace < spaceToFree) {
			log.debug("Cache '{}' freed {} of {} requested bytes; remaining entries not yet evictable",
				name, freedSpace, spaceToFree);
		} else {
			log.debug("Cache '{}' freed {} bytes by evicting {} entries", name, freedSpace, victims.size());
		}
		return victims.size();
	}

	private CacheEntry removeLocked(String key) {
		CacheEntry removed = entries.remove(key);
		if (removed == null) {
			return null;
		}
		currentSize -= removed.getSize();
		recency.remove(key);
		metrics.recordEviction(1);
		return removed;
	}

	private void scheduledCleanup() {
		try {
			cleanupExpired();
		} catch (RuntimeException e) {
			log.error("Scheduled cleanup failed for cache '{}'", name, e);
		}
	}

	// ===== JMX =====

	private void registerJmx(String cacheName) {
		try {
			this.jmxMBean = JmxHelper.registerCache(this, cacheName);
			this.jmxCacheName = cacheName;
			log.info("Registered JMX MBean for cache: {}", cacheName);
		} catch (JmxHelper.JmxRegistrationException e) {
			log.error("Failed to register JMX MBean for cache: {}", cacheName, e);
		}
	}

	private void unregisterJmx() {
		String registered = jmxCacheName;
		if (registered != null) {
			JmxHelper.unregisterCache(registered);
			this.jmxMBean = null;
			this.jmxCacheName = null;
			log.info("Unregistered JMX MBean for cache: {}", registered);
		}
	}

	/**
	 * @return registered MBean, or null when JMX is disabled
	 */
	public ContentCacheStatistics getJmxMBean() {
		return jmxMBean;
	}

	@Override
	public void close() {
		if (!closed.compareAndSet(false, true)) {
			return;
		}
		unregisterJmx();

		if (cleanupExecutor != null) {
			log.debug("Shutting down SBContentCache cleanup executor");
			cleanupExecutor.shutdown();
			try {
				if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
					log.warn("Cleanup executor did not terminate in time, forcing shutdown");
					cleanupExecutor.shutdownNow();
				}
			} catch (InterruptedException e) {
				log.warn("Interrupted while waiting for cleanup executor termination", e);
				cleanupExecutor.shutdownNow();
				Thread.currentThread().interrupt();
			}
		}
	}

	@Override
	public String toString() {
		return "SBContentCache{name='" + name + "', entries=" + size() + ", memoryUsage=" + getMemoryUsage()
			+ ", maxSize=" + maxSize + "}";
	}

	/**
	 * SBContentCache Builder 클래스
	 */
	public static class Builder {
		private String name = DEFAULT_NAME;
		private long maxSize = DEFAULT_MAX_SIZE;
		private int maxEntries = -1; // 기본값: maxSize / 1024
		private double cleanupThreshold = 0.8;
		private double cleanupTarget = 0.6;
		private Duration minIdleTime = Duration.ofMinutes(5);
		private Duration maxAge = Duration.ofHours(1);
		private Duration cleanupInterval = Duration.ofSeconds(60);
		private EvictionPolicy evictionPolicy = null; // 기본값: PriorityIdleEvictionPolicy
		private Ticker ticker = Ticker.systemTicker();
		private CacheReportExporter reportExporter = null;
		private Duration autoCleanupInterval = null; // 기본값: 비활성화
		private boolean enableJmx = false;

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		/**
		 * @param maxSize 최대 용량 (bytes)
		 * @return Builder 인스턴스
		 */
		public Builder maxSize(long maxSize) {
			this.maxSize = maxSize;
			return this;
		}

		/**
		 * 항목 수 힌트. 도달하면 공간 회수를 시도하며, 실제 축출 기준은 여전히 바이트 크기입니다.
		 *
		 * @param maxEntries 항목 수 힌트 (0이면 비활성화)
		 * @return Builder 인스턴스
		 */
		public Builder maxEntries(int maxEntries) {
			this.maxEntries = maxEntries;
			return this;
		}

		public Builder cleanupThreshold(double cleanupThreshold) {
			this.cleanupThreshold = cleanupThreshold;
			return this;
		}

		public Builder cleanupTarget(double cleanupTarget) {
			this.cleanupTarget = cleanupTarget;
			return this;
		}

		public Builder minIdleTime(Duration minIdleTime) {
			this.minIdleTime = minIdleTime;
			return this;
		}

		public Builder maxAge(Duration maxAge) {
			this.maxAge = maxAge;
			return this;
		}

		/**
		 * @param cleanupInterval cleanupExpired() 최소 실행 간격
		 * @return Builder 인스턴스
		 */
		public Builder cleanupInterval(Duration cleanupInterval) {
			this.cleanupInterval = cleanupInterval;
			return this;
		}

		/**
		 * 축출 정책을 교체합니다. 지정하면 minIdleTime, maxAge는 사용되지 않습니다.
		 *
		 * @param evictionPolicy 축출 정책
		 * @return Builder 인스턴스
		 */
		public Builder evictionPolicy(EvictionPolicy evictionPolicy) {
			this.evictionPolicy = evictionPolicy;
			return this;
		}

		public Builder ticker(Ticker ticker) {
			this.ticker = ticker;
			return this;
		}

		public Builder reportExporter(CacheReportExporter reportExporter) {
			this.reportExporter = reportExporter;
			return this;
		}

		/**
		 * 백그라운드 스레드에서 주기적으로 cleanupExpired()를 호출합니다.
		 * 실제 정리는 cleanupInterval 제한을 따릅니다.
		 *
		 * @param interval 실행 주기
		 * @return Builder 인스턴스
		 */
		public Builder enableAutoCleanup(Duration interval) {
			this.autoCleanupInterval = interval;
			return this;
		}

		/**
		 * JMX 모니터링을 활성화합니다. 캐시 이름도 함께 설정됩니다.
		 *
		 * @param cacheName JMX ObjectName에 사용될 캐시 이름
		 * @return Builder 인스턴스
		 */
		public Builder enableJmx(String cacheName) {
			this.enableJmx = true;
			this.name = cacheName;
			return this;
		}

		public SBContentCache build() {
			return new SBContentCache(this);
		}

		private void validate() {
			if (name == null || name.trim().isEmpty()) {
				throw new IllegalArgumentException("name must not be null or empty");
			}
			if (maxSize <= 0) {
				throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
			}
			if (cleanupThreshold <= 0.0 || cleanupThreshold > 1.0) {
				throw new IllegalArgumentException("cleanupThreshold must be in (0, 1]: " + cleanupThreshold);
			}
			if (cleanupTarget < 0.0 || cleanupTarget > cleanupThreshold) {
				throw new IllegalArgumentException(
					"cleanupTarget must be in [0, cleanupThreshold]: " + cleanupTarget);
			}
			if (evictionPolicy == null) {
				requireNonNegative(minIdleTime, "minIdleTime");
				requireNonNegative(maxAge, "maxAge");
			}
			requireNonNegative(cleanupInterval, "cleanupInterval");
			if (ticker == null) {
				throw new IllegalArgumentException("ticker must not be null");
			}
			if (autoCleanupInterval != null && (autoCleanupInterval.isZero() || autoCleanupInterval.isNegative())) {
				throw new IllegalArgumentException("autoCleanup interval must be positive: " + autoCleanupInterval);
			}
		}

		private static void requireNonNegative(Duration value, String field) {
			if (value == null || value.isNegative()) {
				throw new IllegalArgumentException(field + " must not be null or negative");
			}
		}
	}
}
