/**
 * Adapters implementing the application ports: filesystem, JSON, metrics, executors, rendering.
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.infrastructure;
