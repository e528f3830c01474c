/**
 * Lecture materials loading for prompt context.
 */
package com.phillippitts.classmate.service.materials;
