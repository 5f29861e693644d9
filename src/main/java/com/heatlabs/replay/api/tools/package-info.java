/** Diagnostic command-line utilities. */
package com.heatlabs.replay.api.tools;
