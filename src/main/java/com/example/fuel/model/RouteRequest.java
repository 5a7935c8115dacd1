package com.example.fuel.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RouteRequest {
    /** Starting location (city, state or street address in the USA). */
    @NotBlank(message = "Start location is required")
    @Size(max = 200, message = "Start location must be at most 200 characters")
    private String start;

    /** Ending location (city, state or street address in the USA). */
    @NotBlank(message = "End location is required")
    @Size(max = 200, message = "End location must be at most 200 characters")
    private String end;

    // trimmed on binding so the length limit applies to the trimmed value
    public void setStart(String start) {
        this.start = start == null ? null : start.trim();
    }

    public void setEnd(String end) {
        this.end = end == null ? null : end.trim();
    }
}
