/**
 * Micrometer 기반 콘텐츠 캐시 메트릭 통합
 *
 * <h3>지원 메트릭 (모두 cache=&lt;name&gt; 태그)</h3>
 * <ul>
 *   <li>cache.hits, cache.misses - 조회 결과 (FunctionCounter)</li>
 *   <li>cache.puts - 삽입 횟수 (FunctionCounter)</li>
 *   <li>cache.evictions - 제거 횟수 (FunctionCounter)</li>
 *   <li>cache.size - 항목 수 (Gauge)</li>
 *   <li>cache.memory.used, cache.memory.max - 바이트 사용량과 용량 (Gauge)</li>
 *   <li>cache.utilization, cache.memory.pressure, cache.hit.rate (Gauge)</li>
 * </ul>
 *
 * <h3>Prometheus 메트릭 예시</h3>
 * <pre>
 * # HELP cache_hits_total Cache hit count
 * # TYPE cache_hits_total counter
 * cache_hits_total{cache="textures",} 15234.0
 *
 * # HELP cache_memory_used_bytes Sum of cached entry sizes
 * # TYPE cache_memory_used_bytes gauge
 * cache_memory_used_bytes{cache="textures",} 5.24288E7
 * </pre>
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.contentcache.metrics.micrometer;
