/**
 * Streaming transcription: a {@link com.phillippitts.classmate.service.channel.TranscriptionBackend}
 * pushes raw results into the inbox of a
 * {@link com.phillippitts.classmate.service.channel.TranscriptionChannel}, whose receiver thread
 * normalizes them into transcript segments and publishes them on the event bus.
 */
package com.phillippitts.classmate.service.channel;
