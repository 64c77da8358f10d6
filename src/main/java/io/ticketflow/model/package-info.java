/**
 * Ticket data model.
 *
 * <p>{@link io.ticketflow.model.Ticket} is the unit of work; its status lifecycle is encoded in
 * {@link io.ticketflow.model.TicketStatus#canTransitionTo(io.ticketflow.model.TicketStatus)}.
 */
package io.ticketflow.model;
