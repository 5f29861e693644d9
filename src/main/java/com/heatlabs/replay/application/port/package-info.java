/**
 * <strong>Purpose:</strong> Ports between the replay pipelines and their adapters.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> {@link com.heatlabs.replay.application.port.ReplayExtractor} implementations are
 * called from worker threads; corpus stores are driven from one thread.</p>
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.application.port;
