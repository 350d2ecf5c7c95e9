package org.scriptonbasestar.contentcache.store.jmx;

import org.scriptonbasestar.contentcache.store.cache.SBContentCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;

/**
 * Helper class for JMX MBean registration and management.
 *
 * <h3>ObjectName Pattern:</h3>
 * <pre>
 * org.scriptonbasestar.contentcache:type=SBContentCache,name={cacheName}
 * </pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public final class JmxHelper {

	private static final Logger log = LoggerFactory.getLogger(JmxHelper.class);

	private static final String DOMAIN = "org.scriptonbasestar.contentcache";
	private static final String TYPE = "SBContentCache";

	private JmxHelper() {
		// Utility class
	}

	/**
	 * Registers a cache with the platform MBeanServer. An existing registration under the same
	 * name is replaced.
	 *
	 * @param cache      the cache to expose
	 * @param cacheName  the cache name (used in ObjectName)
	 * @return the registered MBean
	 * @throws IllegalArgumentException if cache or cacheName is null/empty
	 * @throws JmxRegistrationException if registration fails
	 */
	public static ContentCacheStatistics registerCache(SBContentCache cache, String cacheName) {
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("cacheName must not be null or empty");
		}

		ContentCacheStatistics mbean = new ContentCacheStatistics(cache, cacheName);

		try {
			MBeanServer mbs = ManagementFactory.getPlatformMBeanServer();
			ObjectName objectName = createObjectName(cacheName);

			if (mbs.isRegistered(objectName)) {
				log.debug("Replacing existing JMX registration: {}", objectName);
				mbs.unregisterMBean(objectName);
			}

			mbs.registerMBean(mbean, objectName);
			return mbean;

		} catch (JMException e) {
			throw new JmxRegistrationException("Failed to register JMX MBean for cache: " + cacheName, e);
		}
	}

	/**
	 * Unregisters a cache from JMX. Safe to call when the cache is not registered; failures are
	 * logged.
	 *
	 * @param cacheName the cache name to unregister
	 */
	public static void unregisterCache(String cacheName) {
		if (cacheName == null || cacheName.trim().isEmpty()) {
			return;
		}

		try {
			MBeanServer mbs = ManagementFactory.getPlatformMBeanServer();
			ObjectName objectName = createObjectName(cacheName);

			if (mbs.isRegistered(objectName)) {
				mbs.unregisterMBean(objectName);
			}
		} catch (JMException e) {
			log.warn("Failed to unregister JMX MBean for cache: {}", cacheName, e);
		}
	}

	/**
	 * @param cacheName the cache name to check
	 * @return true if registered, false otherwise
	 */
	public static boolean isRegistered(String cacheName) {
		if (cacheName == null || cacheName.trim().isEmpty()) {
			return false;
		}

		try {
			return ManagementFactory.getPlatformMBeanServer().isRegistered(createObjectName(cacheName));
		} catch (MalformedObjectNameException e) {
			log.debug("Invalid JMX name for cache: {}", cacheName, e);
			return false;
		}
	}

	/**
	 * Creates a standardized ObjectName for a cache.
	 *
	 * @param cacheName the cache name
	 * @return the ObjectName
	 * @throws MalformedObjectNameException if the name is invalid
	 */
	public static ObjectName createObjectName(String cacheName) throws MalformedObjectNameException {
		// ObjectName 예약 문자 치환
		String safeName = cacheName.replaceAll("[,=:\"\\*\\?\\n]", "_");
		return new ObjectName(DOMAIN + ":type=" + TYPE + ",name=" + safeName);
	}

	/**
	 * Exception thrown when JMX registration fails.
	 */
	public static class JmxRegistrationException extends RuntimeException {
		public JmxRegistrationException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
