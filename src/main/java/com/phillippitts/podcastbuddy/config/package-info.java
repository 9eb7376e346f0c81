/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.podcastbuddy.config.PipelineConfig} - shared model client, memory
 *       store, synthesis worker and playback device</li>
 *   <li>{@link com.phillippitts.podcastbuddy.config.ThreadPoolConfig} - LLM reader and playback
 *       executors with ThreadContext propagation</li>
 * </ul>
 *
 * <p>Typed {@code podcast.*} and {@code threadpool.*} properties live in {@code config.properties}.
 *
 * @since 1.0
 */
package com.phillippitts.podcastbuddy.config;
