package com.infomedia.abacox.callorchestrator.controller;

import com.infomedia.abacox.callorchestrator.component.postcall.PostCallJobService;
import com.infomedia.abacox.callorchestrator.db.entity.PostCallJob;
import com.infomedia.abacox.callorchestrator.dto.postcall.PostCallJobDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@Tag(name = "PostCallJobController", description = "Post-call recovery jobs")
@RequestMapping("/api/post-call/jobs")
public class PostCallJobController {

    private final PostCallJobService postCallJobService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List post-call jobs, newest first")
    public List<PostCallJobDto> list(@Parameter(description = "Only jobs in this status")
                                     @RequestParam(required = false) PostCallJob.Status status) {
        return postCallJobService.findJobs(status).stream().map(PostCallJobDto::from).toList();
    }

    @PostMapping(value = "/{id}/requeue", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Requeue a job that needs manual review")
    public PostCallJobDto requeue(@PathVariable Long id) {
        return PostCallJobDto.from(postCallJobService.requeue(id));
    }
}
