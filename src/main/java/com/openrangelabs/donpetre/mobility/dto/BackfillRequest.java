package com.openrangelabs.donpetre.mobility.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.SchemaType;
import com.openrangelabs.donpetre.mobility.model.SyncSelection;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * Request DTO for filling the gaps of one endpoint/schema pair over a date range
 */
public class BackfillRequest {

    @NotBlank(message = "Endpoint is required")
    private String endpoint;

    @NotNull(message = "Schema is required")
    private SchemaType schema;

    @NotNull(message = "From date is required")
    private LocalDate fromDate;

    @NotNull(message = "To date is required")
    private LocalDate toDate;

    private boolean dryRun = false;

    // Constructors
    public BackfillRequest() {}

    public BackfillRequest(String endpoint, SchemaType schema, LocalDate fromDate, LocalDate toDate, boolean dryRun) {
        this.endpoint = endpoint;
        this.schema = schema;
        this.fromDate = fromDate;
        this.toDate = toDate;
        this.dryRun = dryRun;
    }

    @JsonIgnore
    @AssertTrue(message = "From date must not be after to date")
    public boolean isDateRangeOrdered() {
        return fromDate == null || toDate == null || !toDate.isBefore(fromDate);
    }

    public DateWindow toDateWindow() {
        return DateWindow.of(fromDate, toDate);
    }

    public SyncSelection toSelection() {
        return SyncSelection.of(endpoint, schema);
    }

    // Getters and Setters
    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

    public SchemaType getSchema() { return schema; }
    public void setSchema(SchemaType schema) { this.schema = schema; }

    public LocalDate getFromDate() { return fromDate; }
    public void setFromDate(LocalDate fromDate) { this.fromDate = fromDate; }

    public LocalDate getToDate() { return toDate; }
    public void setToDate(LocalDate toDate) { this.toDate = toDate; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    @Override
    public String toString() {
        return "BackfillRequest{" +
                "endpoint='" + endpoint + '\'' +
                ", schema=" + schema +
                ", fromDate=" + fromDate +
                ", toDate=" + toDate +
                ", dryRun=" + dryRun +
                '}';
    }
}
