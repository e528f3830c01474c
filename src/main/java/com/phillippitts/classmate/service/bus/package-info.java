/**
 * Typed in-process event bus. Producers publish to a {@link com.phillippitts.classmate.service.bus.Topic};
 * each subscription drains its own bounded mailbox on the {@code eventExecutor} pool.
 */
package com.phillippitts.classmate.service.bus;
