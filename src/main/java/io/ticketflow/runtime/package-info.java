/**
 * Work loop.
 *
 * <p>{@link io.ticketflow.runtime.WorkScheduler} owns ticket execution: dependency waves,
 * bounded parallelism, cooperative cancellation and the iteration cap.
 */
package io.ticketflow.runtime;
