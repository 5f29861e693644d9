/**
 * Minimal immutable JSON tree used for extracted match details, backed by Jackson streaming.
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.domain.json;
