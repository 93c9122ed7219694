package com.openrangelabs.donpetre.mobility.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.SchemaType;
import com.openrangelabs.donpetre.mobility.model.SyncSelection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for starting a sync run
 */
public class TriggerRunRequest {

    @Size(max = 100, message = "Run id must be at most 100 characters")
    @Pattern(regexp = "^[A-Za-z0-9._-]*$", message = "Run id may only contain letters, digits, '.', '_' and '-'")
    private String runId;

    @NotNull(message = "From date is required")
    private LocalDate fromDate;

    @NotNull(message = "To date is required")
    private LocalDate toDate;

    @NotEmpty(message = "At least one selection is required")
    @Valid
    private List<Selection> selections = new ArrayList<>();

    // Constructors
    public TriggerRunRequest() {}

    public TriggerRunRequest(String runId, LocalDate fromDate, LocalDate toDate, List<Selection> selections) {
        this.runId = runId;
        this.fromDate = fromDate;
        this.toDate = toDate;
        this.selections = selections;
    }

    @JsonIgnore
    @AssertTrue(message = "From date must not be after to date")
    public boolean isDateRangeOrdered() {
        return fromDate == null || toDate == null || !toDate.isBefore(fromDate);
    }

    public DateWindow toDateWindow() {
        return DateWindow.of(fromDate, toDate);
    }

    public List<SyncSelection> toSelections() {
        return selections.stream()
                .map(selection -> SyncSelection.of(selection.getEndpoint(), selection.getSchema()))
                .toList();
    }

    // Getters and Setters
    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public LocalDate getFromDate() { return fromDate; }
    public void setFromDate(LocalDate fromDate) { this.fromDate = fromDate; }

    public LocalDate getToDate() { return toDate; }
    public void setToDate(LocalDate toDate) { this.toDate = toDate; }

    public List<Selection> getSelections() { return selections; }
    public void setSelections(List<Selection> selections) { this.selections = selections; }

    @Override
    public String toString() {
        return "TriggerRunRequest{" +
                "runId='" + runId + '\'' +
                ", fromDate=" + fromDate +
                ", toDate=" + toDate +
                ", selections=" + selections +
                '}';
    }

    /**
     * One endpoint/schema pair
     */
    public static class Selection {

        @NotBlank(message = "Endpoint is required")
        private String endpoint;

        @NotNull(message = "Schema is required")
        private SchemaType schema;

        public Selection() {}

        public Selection(String endpoint, SchemaType schema) {
            this.endpoint = endpoint;
            this.schema = schema;
        }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public SchemaType getSchema() { return schema; }
        public void setSchema(SchemaType schema) { this.schema = schema; }

        @Override
        public String toString() {
            return endpoint + "/" + schema;
        }
    }
}
