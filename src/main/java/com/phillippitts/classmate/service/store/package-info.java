/**
 * Durable session records: one directory per session, append-only JSONL for the transcript and
 * events, atomically rewritten JSON for analysis collections and metadata.
 */
package com.phillippitts.classmate.service.store;
