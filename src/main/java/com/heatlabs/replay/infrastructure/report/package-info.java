/** Text and JSON report renderers. */
package com.heatlabs.replay.infrastructure.report;
