package com.queryroute.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.queryroute.model.EtlTaskContext;
import com.queryroute.model.PlaceholderRequirement;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Either {@code available_fields} or a {@code source_id} whose table supplies the fields.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EtlPlanRequest {
    @Valid
    @NotEmpty(message = "At least one requirement is required")
    private List<PlaceholderRequirement> requirements = new ArrayList<>();

    private List<String> availableFields = new ArrayList<>();
    private String sourceId;
    private EtlTaskContext context;
}
