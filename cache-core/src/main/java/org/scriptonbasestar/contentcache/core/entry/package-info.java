/**
 * Cache entry model.
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.contentcache.core.entry;
