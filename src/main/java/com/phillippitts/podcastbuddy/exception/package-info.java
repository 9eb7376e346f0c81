/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.podcastbuddy.exception.PodcastBuddyException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.podcastbuddy.exception.ModelUnavailableException} - Model server
 *       unreachable or the token stream broke</li>
 *   <li>{@link com.phillippitts.podcastbuddy.exception.ModelTimeoutException} - No model output
 *       within the configured timeout</li>
 *   <li>{@link com.phillippitts.podcastbuddy.exception.SynthesisException} - Synthesis engine
 *       failed for one piece of text</li>
 *   <li>{@link com.phillippitts.podcastbuddy.exception.PlaybackException} - Audio device failed
 *       to play a buffer</li>
 *   <li>{@link com.phillippitts.podcastbuddy.exception.TurnRejectedException} - A turn was
 *       requested while another one is in flight</li>
 * </ul>
 *
 * <p>None of these is fatal to the process: the orchestrator converts model failures into a
 * spoken apology, synthesis failures drop a single sentence and playback failures fall back
 * to an alternate device.
 *
 * @since 1.0
 */
package com.phillippitts.podcastbuddy.exception;
