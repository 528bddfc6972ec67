package com.ogt.tapak.controller;

import com.ogt.tapak.job.TransferJob;
import com.ogt.tapak.job.TransferJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private final TransferJobService jobService;

    // GET /jobs?type=UPLOAD|EXPORT (últimos 100)
    @GetMapping
    public ResponseEntity<List<TransferJob>> getRecentJobs(@RequestParam(value = "type", required = false) String type) {
        return ResponseEntity.ok(jobService.recent(type));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransferJob> getJob(@PathVariable UUID id) {
        return ResponseEntity.of(jobService.find(id));
    }
}
