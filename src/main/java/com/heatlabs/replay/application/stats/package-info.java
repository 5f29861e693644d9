/** Corpus statistics. */
package com.heatlabs.replay.application.stats;
