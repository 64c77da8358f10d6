/**
 * Agent contract and the built-in implementations.
 */
package io.ticketflow.agent;
