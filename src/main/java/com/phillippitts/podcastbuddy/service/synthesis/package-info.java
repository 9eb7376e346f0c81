/**
 * Text-to-speech: engine contract, the Piper adapter, text cleanup and the process-wide
 * synthesis guard.
 */
package com.phillippitts.podcastbuddy.service.synthesis;
