/** Immutable value types making up a statistics report. */
package com.heatlabs.replay.domain.stats;
