/** Thread pool factories for extraction workers. */
package com.heatlabs.replay.infrastructure.exec;
