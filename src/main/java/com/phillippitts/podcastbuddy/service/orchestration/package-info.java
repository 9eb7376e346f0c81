/**
 * Turn orchestration: one spoken turn from user input to the last played sentence.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.podcastbuddy.service.orchestration.TurnOrchestrator} - streams the
 *       model reply through segmentation, synthesis and ordered playback, with timeout,
 *       cancellation and apology handling</li>
 *   <li>{@link com.phillippitts.podcastbuddy.service.orchestration.ConversationSession} - topic
 *       start, stop phrases and disconnect for one listener</li>
 *   <li>{@link com.phillippitts.podcastbuddy.service.orchestration.TurnGate} - one turn per
 *       session</li>
 * </ul>
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Producer/Consumer:</b> a reader task on the LLM executor feeds fragments into a queue
 *       drained by the turn thread</li>
 *   <li><b>Pipelining:</b> synthesis of sentence i+1 overlaps playback of sentence i</li>
 *   <li><b>Event-Driven:</b> {@code TurnCompletedEvent} published for listeners and metrics</li>
 * </ul>
 *
 * @see com.phillippitts.podcastbuddy.service.playback.PlaybackSequencer
 * @since 1.0
 */
package com.phillippitts.podcastbuddy.service.orchestration;
