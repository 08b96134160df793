package com.infomedia.abacox.callorchestrator.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.infomedia.abacox.callorchestrator.component.callworkflow.CallWorkflowService;
import com.infomedia.abacox.callorchestrator.component.durable.WorkflowDescription;
import com.infomedia.abacox.callorchestrator.dto.call.CallContext;
import com.infomedia.abacox.callorchestrator.dto.call.CallMetrics;
import com.infomedia.abacox.callorchestrator.dto.call.CallResult;
import com.infomedia.abacox.callorchestrator.dto.call.CallStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@Tag(name = "CallController", description = "Call lifecycle workflows")
@Log4j2
@RequestMapping("/api/calls")
public class CallController {

    private final CallWorkflowService callWorkflowService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Start the lifecycle workflow of a call",
            description = "Creates the durable execution voice-call-{callId}. Fails with 409 if the call already has one.")
    public WorkflowDescription startCall(@Valid @RequestBody CallContext callContext) {
        return callWorkflowService.startCall(callContext);
    }

    @PostMapping(value = "/{callId}/signals/{channel}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Deliver a signal to a call",
            description = "Channels: transcript, function-call, call-end, transfer-request. The signal is journaled before this returns.")
    public void signal(@Parameter(description = "Call identifier") @PathVariable String callId,
                       @Parameter(description = "Signal channel name") @PathVariable String channel,
                       @RequestBody JsonNode payload) {
        log.debug("Signal {} for call {}", channel, callId);
        callWorkflowService.signal(callId, channel, payload);
    }

    @GetMapping(value = "/{callId}/status", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Current status snapshot of a call")
    public CallStatus getStatus(@PathVariable String callId) {
        return callWorkflowService.getStatus(callId);
    }

    @GetMapping(value = "/{callId}/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Metrics derived from the call's transcripts and function calls")
    public CallMetrics getMetrics(@PathVariable String callId) {
        return callWorkflowService.getMetrics(callId);
    }

    @GetMapping(value = "/{callId}/lead-score", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Current lead score of a call")
    public Double getLeadScore(@PathVariable String callId) {
        return callWorkflowService.getLeadScore(callId);
    }

    @GetMapping(value = "/{callId}/result", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Final status of a call",
            description = "200 with the final status once the workflow completed, 202 with the current status while it runs, 409 if it failed.")
    public ResponseEntity<CallResult> getResult(@PathVariable String callId) {
        CallResult result = callWorkflowService.getResult(callId);
        return ResponseEntity.status(result.isCompleted() ? HttpStatus.OK : HttpStatus.ACCEPTED).body(result);
    }

    @GetMapping(value = "/{callId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Describe the durable execution of a call")
    public WorkflowDescription describe(@PathVariable String callId) {
        return callWorkflowService.describe(callId);
    }
}
