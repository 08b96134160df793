package com.infomedia.abacox.callorchestrator.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UrgentAction {
    /**
     * {@code alert_manager}, {@code escalate_pricing}, {@code offer_discount} or {@code transfer_call}.
     */
    private String type;
    private String reason;
    private String managerId;
    private Map<String, Object> data;
}
