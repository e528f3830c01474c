/**
 * Immutable domain values flowing through the pipeline: audio frames, transcript segments,
 * analysis artifacts and the session value itself.
 */
package com.phillippitts.classmate.domain;
