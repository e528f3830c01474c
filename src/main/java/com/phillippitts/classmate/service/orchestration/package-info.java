/**
 * Session lifecycle: the state machine, the audio pump and the orchestrator that wires the
 * pipeline for one session at a time.
 */
package com.phillippitts.classmate.service.orchestration;
