/**
 * Domain types of the turn pipeline: conversation states, chat messages, sentence units,
 * audio buffers and turn outcomes.
 */
package com.phillippitts.podcastbuddy.domain;
