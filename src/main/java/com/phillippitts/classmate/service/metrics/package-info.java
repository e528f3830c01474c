/**
 * Micrometer instrumentation for the pipeline.
 */
package com.phillippitts.classmate.service.metrics;
