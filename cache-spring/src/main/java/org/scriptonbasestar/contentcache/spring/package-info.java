/**
 * Spring Boot integration for the content cache.
 *
 * <ul>
 *   <li>{@code boot} - auto-configuration, {@code sb-content-cache.*} properties, {@code @EnableContentCache}</li>
 *   <li>{@code actuator} - health indicator (requires spring-boot-actuator)</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.contentcache.spring;
