/**
 * Audio input: fixed-size PCM16LE mono 16 kHz frames pulled by the session's audio pump.
 */
package com.phillippitts.classmate.service.audio;
