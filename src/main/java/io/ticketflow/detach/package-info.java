/**
 * Background work runs and the pid file that guards the store while one is alive.
 */
package io.ticketflow.detach;
