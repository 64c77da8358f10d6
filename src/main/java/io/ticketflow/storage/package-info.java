/**
 * Status-partitioned JSON file store for tickets.
 */
package io.ticketflow.storage;
