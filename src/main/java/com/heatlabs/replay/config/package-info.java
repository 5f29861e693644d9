/**
 * Configuration sources (defaults, YAML, CLI), typed per-command settings, and the composition root.
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.config;
