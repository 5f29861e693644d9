/**
 * Replay-level domain model: match records, the corpus, filename metadata.
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.domain.replay;
