package com.infomedia.abacox.callorchestrator.dto.call;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FunctionCallEvent {
    @NotBlank
    private String functionName;
    private Map<String, Object> parameters;
    private Instant timestamp;
    private Double confidence;

    public Object parameter(String name) {
        return parameters == null ? null : parameters.get(name);
    }
}
