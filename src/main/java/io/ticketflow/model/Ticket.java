package io.ticketflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.ticketflow.error.IllegalTicketTransitionException;
import io.ticketflow.error.TicketValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A unit of work with a stable identity, a status driven by {@link TicketStatus}, and an
 * ordered list of prerequisite ticket ids.
 *
 * <p>Status only moves through the transition methods; {@link #forceStatus(TicketStatus)} is
 * reserved for administrative edits of the store.
 */
@JsonPropertyOrder({
        "id", "title", "description", "type", "priority", "status", "estimated_complexity",
        "dependencies", "acceptance_criteria", "files_to_create", "files_to_modify",
        "created_at", "completed_at", "agent_output", "error", "error_log"
})
public final class Ticket {
    public static final int DEFAULT_PRIORITY = 5;
    public static final String DEFAULT_COMPLEXITY = "medium";

    @JsonProperty("id")
    private String id;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("type")
    private TicketType type;

    @JsonProperty("priority")
    private int priority;

    @JsonProperty("status")
    private TicketStatus status;

    @JsonProperty("estimated_complexity")
    private String estimatedComplexity;

    @JsonProperty("dependencies")
    private List<String> dependencies;

    @JsonProperty("acceptance_criteria")
    private List<String> acceptanceCriteria;

    @JsonProperty("files_to_create")
    private List<String> filesToCreate;

    @JsonProperty("files_to_modify")
    private List<String> filesToModify;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("completed_at")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Instant completedAt;

    @JsonProperty("agent_output")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String agentOutput;

    @JsonProperty("error")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String error;

    @JsonProperty("error_log")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String errorLog;

    Ticket() {
        this.type = TicketType.FEATURE;
        this.priority = DEFAULT_PRIORITY;
        this.estimatedComplexity = DEFAULT_COMPLEXITY;
        this.dependencies = new ArrayList<>();
        this.acceptanceCriteria = new ArrayList<>();
        this.filesToCreate = new ArrayList<>();
        this.filesToModify = new ArrayList<>();
    }

    public static Ticket create(String id, String title, String description) {
        Ticket ticket = new Ticket();
        ticket.id = id;
        ticket.title = title;
        ticket.description = description == null ? "" : description;
        ticket.status = TicketStatus.PENDING;
        ticket.createdAt = Instant.now();
        return ticket;
    }

    /**
     * Records from a generated ticket list may omit the lifecycle fields; they start pending.
     */
    public void applyImportDefaults() {
        if (status == null) {
            status = TicketStatus.PENDING;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new TicketValidationException("ticket ID is required");
        }
        if (title == null || title.isBlank()) {
            throw new TicketValidationException("ticket title is required: " + id);
        }
        if (status == null) {
            throw new TicketValidationException("invalid ticket status for " + id);
        }
    }

    public void markInProgress() {
        transition(TicketStatus.IN_PROGRESS);
    }

    public void markCompleted(String output) {
        transition(TicketStatus.COMPLETED);
        this.completedAt = Instant.now();
        this.agentOutput = output == null ? "" : output;
    }

    public void markFailed(String errorText, String errorLogPath) {
        transition(TicketStatus.FAILED);
        this.completedAt = Instant.now();
        this.error = errorText == null || errorText.isBlank() ? "execution failed" : errorText;
        this.errorLog = errorLogPath == null ? "" : errorLogPath;
    }

    /**
     * Retry path: failed back to pending with the failure details cleared.
     */
    public void resetToPending() {
        transition(TicketStatus.PENDING);
        this.error = "";
        this.errorLog = "";
        this.completedAt = null;
    }

    public void forceStatus(TicketStatus target) {
        this.status = Objects.requireNonNull(target, "status");
    }

    private void transition(TicketStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new IllegalTicketTransitionException(id, status, target);
        }
        this.status = target;
    }

    @JsonIgnore
    public String summary() {
        return "[" + id + "] " + title + " - " + status;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TicketType type() {
        return type;
    }

    public void setType(TicketType type) {
        this.type = type == null ? TicketType.FEATURE : type;
    }

    public int priority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public TicketStatus status() {
        return status;
    }

    public String estimatedComplexity() {
        return estimatedComplexity;
    }

    public void setEstimatedComplexity(String estimatedComplexity) {
        this.estimatedComplexity = estimatedComplexity;
    }

    public List<String> dependencies() {
        return dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies == null ? new ArrayList<>() : new ArrayList<>(dependencies);
    }

    public List<String> acceptanceCriteria() {
        return acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
    }

    public void setAcceptanceCriteria(List<String> acceptanceCriteria) {
        this.acceptanceCriteria = acceptanceCriteria == null ? new ArrayList<>() : new ArrayList<>(acceptanceCriteria);
    }

    public List<String> filesToCreate() {
        return filesToCreate == null ? List.of() : List.copyOf(filesToCreate);
    }

    public void setFilesToCreate(List<String> filesToCreate) {
        this.filesToCreate = filesToCreate == null ? new ArrayList<>() : new ArrayList<>(filesToCreate);
    }

    public List<String> filesToModify() {
        return filesToModify == null ? List.of() : List.copyOf(filesToModify);
    }

    public void setFilesToModify(List<String> filesToModify) {
        this.filesToModify = filesToModify == null ? new ArrayList<>() : new ArrayList<>(filesToModify);
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public String agentOutput() {
        return agentOutput == null ? "" : agentOutput;
    }

    public String error() {
        return error == null ? "" : error;
    }

    public String errorLog() {
        return errorLog == null ? "" : errorLog;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ticket other)) {
            return false;
        }
        return priority == other.priority
                && Objects.equals(id, other.id)
                && Objects.equals(title, other.title)
                && Objects.equals(description, other.description)
                && type == other.type
                && status == other.status
                && Objects.equals(estimatedComplexity, other.estimatedComplexity)
                && Objects.equals(dependencies(), other.dependencies())
                && Objects.equals(acceptanceCriteria(), other.acceptanceCriteria())
                && Objects.equals(filesToCreate(), other.filesToCreate())
                && Objects.equals(filesToModify(), other.filesToModify())
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(completedAt, other.completedAt)
                && Objects.equals(agentOutput(), other.agentOutput())
                && Objects.equals(error(), other.error())
                && Objects.equals(errorLog(), other.errorLog());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, createdAt);
    }

    @Override
    public String toString() {
        return summary();
    }
}
