/** Logging helpers on top of SLF4J and Logback. */
package com.heatlabs.replay.logging;
