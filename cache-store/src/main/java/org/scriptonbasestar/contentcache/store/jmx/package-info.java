/**
 * JMX monitoring support for the content cache.
 *
 * <h2>Key Components:</h2>
 * <ul>
 *   <li>{@link org.scriptonbasestar.contentcache.store.jmx.ContentCacheMXBean} - JMX MBean interface</li>
 *   <li>{@link org.scriptonbasestar.contentcache.store.jmx.ContentCacheStatistics} - Default MBean implementation</li>
 *   <li>{@link org.scriptonbasestar.contentcache.store.jmx.JmxHelper} - Registration utility</li>
 * </ul>
 *
 * <h2>JConsole/VisualVM Monitoring:</h2>
 * <ol>
 *   <li>Connect to your Java process</li>
 *   <li>Navigate to MBeans tab</li>
 *   <li>Expand: org.scriptonbasestar.contentcache → SBContentCache → [your cache name]</li>
 *   <li>Attributes: HitRatePercent, CurrentSizeBytes, UtilizationPercent, MemoryPressure</li>
 *   <li>Operations: cleanupExpired(), optimize(), resetStatistics(), exportReport()</li>
 * </ol>
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.contentcache.store.jmx;
