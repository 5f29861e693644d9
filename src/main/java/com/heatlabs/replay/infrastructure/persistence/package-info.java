/**
 * <strong>Purpose:</strong> JSON corpus persistence.
 * <p><strong>Durability:</strong> Every write goes to a temporary sibling that is forced and atomically moved over
 * the target, so readers only ever observe complete documents.</p>
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.infrastructure.persistence;
