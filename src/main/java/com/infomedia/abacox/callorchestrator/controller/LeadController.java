package com.infomedia.abacox.callorchestrator.controller;

import com.infomedia.abacox.callorchestrator.component.durable.WorkflowDescription;
import com.infomedia.abacox.callorchestrator.component.voicelead.VoiceLeadService;
import com.infomedia.abacox.callorchestrator.dto.lead.VoiceLeadInput;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@Tag(name = "LeadController", description = "Voice lead workflows")
@RequestMapping("/api/leads")
public class LeadController {

    private final VoiceLeadService voiceLeadService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Start the voice lead workflow for a call")
    public WorkflowDescription startLead(@Valid @RequestBody VoiceLeadInput input) {
        return voiceLeadService.startLead(input);
    }

    @GetMapping(value = "/{callId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Describe the voice lead workflow of a call")
    public WorkflowDescription describe(@PathVariable String callId) {
        return voiceLeadService.describe(callId);
    }
}
