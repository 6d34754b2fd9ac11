package com.queryroute.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlOptions;
import com.queryroute.model.EtlTaskContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EtlExecuteRequest {
    @NotBlank(message = "Source ID is required")
    private String sourceId;

    @Valid
    @NotNull(message = "Instructions are required")
    private EtlInstructions instructions;

    private EtlTaskContext context;

    private EtlOptions options = new EtlOptions();
}
