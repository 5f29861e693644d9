/** Replay discovery on the local filesystem. */
package com.heatlabs.replay.infrastructure.source;
