/**
 * 캐시 보존 정책
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.contentcache.core.strategy.CachePriority} - 항목 우선순위와 보존 배수</li>
 *   <li>{@link org.scriptonbasestar.contentcache.core.strategy.EvictionPolicy} - 축출/만료 판단 인터페이스</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.contentcache.core.strategy;
