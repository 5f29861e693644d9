/** Replay extractor built on the byte-level scanners. */
package com.heatlabs.replay.infrastructure.replay;
