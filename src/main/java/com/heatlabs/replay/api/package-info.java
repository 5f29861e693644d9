/**
 * CLI entry points for the {@code replay scan}, {@code report} and {@code inspect} commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes use cases.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded during setup; the scan pipeline spawns its own workers.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths before any file is read or written.</p>
 */
package com.heatlabs.replay.api;
