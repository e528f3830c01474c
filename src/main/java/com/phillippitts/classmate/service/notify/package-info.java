/**
 * User-facing alerts rendered from pipeline events. Sinks are chosen by
 * {@code classmate.notify.sinks}.
 */
package com.phillippitts.classmate.service.notify;
