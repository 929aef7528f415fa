package com.dashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request model for running a catalog operation by name.
 * 
 * Only operations registered in the catalog can run; params are bound by
 * name and never interpolated into SQL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomQueryRequest {

    @NotBlank
    @JsonAlias("query_type")
    private String queryType;

    @Builder.Default
    private Map<String, Object> params = new HashMap<>();
}
