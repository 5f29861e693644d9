/**
 * Input validation shared by configuration records and CLIs; failures raise
 * {@link java.lang.IllegalArgumentException} naming the offending key.
 */
package com.heatlabs.replay.validation;
