/**
 * Use cases that build a corpus from replay files and render reports over it.
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.application.pipeline;
