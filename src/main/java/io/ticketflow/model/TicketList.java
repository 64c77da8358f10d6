package io.ticketflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON envelope ({@code {"tickets": [...]}}) used for bulk import and export.
 */
public record TicketList(@JsonProperty("tickets") List<Ticket> tickets) {
    public TicketList {
        tickets = tickets == null ? new ArrayList<>() : new ArrayList<>(tickets);
    }
}
