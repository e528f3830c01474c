/**
 * Actuator health reporting for the pipeline.
 */
package com.phillippitts.classmate.service.health;
