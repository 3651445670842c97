/**
 * YAML detector catalogue: {@link com.watchtower.core.config.DetectorsConfig}
 * and its loader.
 *
 * @since 1.0.0
 */
package com.watchtower.core.config;
