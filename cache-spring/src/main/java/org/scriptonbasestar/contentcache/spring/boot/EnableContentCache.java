package org.scriptonbasestar.contentcache.spring.boot;

import org.springframework.context.annotation.Import;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Imports {@link ContentCacheAutoConfiguration} explicitly, for applications that do not use
 * auto-configuration.
 *
 * <pre>{@code
 * @Configuration
 * @EnableContentCache
 * public class AssetConfig {
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 * @see ContentCacheAutoConfiguration
 * @see ContentCacheProperties
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ContentCacheAutoConfiguration.class)
public @interface EnableContentCache {
}
