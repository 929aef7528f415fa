package com.dashboard.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Request model for a tracked user event.
 * 
 * A userId that does not exist yet creates a placeholder user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EventIngestRequest {

    private UUID userId;

    @NotNull
    private UUID sessionId;

    @NotBlank
    @Size(max = 50)
    private String eventType;

    private String pagePath;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
