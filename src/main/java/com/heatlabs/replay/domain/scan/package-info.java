/**
 * <strong>Purpose:</strong> Byte-level heuristics that recover structure from opaque replay files.
 * <p><strong>Concurrency:</strong> Scanners are stateless and safe to share across worker threads.</p>
 * <p><strong>Performance:</strong> Work is proportional to the buffer length times the candidate window;
 * windows are bounded so a single replay cannot stall a worker indefinitely.</p>
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.domain.scan;
