package com.infomedia.abacox.callorchestrator.controller;

import com.infomedia.abacox.callorchestrator.component.worker.WorkerHost;
import com.infomedia.abacox.callorchestrator.dto.worker.WorkerHealth;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@Tag(name = "WorkerController", description = "Worker health")
@RequestMapping("/api/worker")
public class WorkerController {

    private final WorkerHost workerHost;

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Health of the worker", description = "503 when the event store is unreachable or the worker is not accepting work.")
    public ResponseEntity<WorkerHealth> health() {
        WorkerHealth health = workerHost.health();
        boolean healthy = health.isConnected() && health.isAcceptingWork();
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
