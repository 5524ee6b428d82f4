package com.sandy.aiot.gateway.controller;

import com.sandy.aiot.gateway.entity.QueueJob;
import com.sandy.aiot.gateway.service.impl.DurableJobQueue;
import com.sandy.aiot.gateway.vo.QueueStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/queue")
@RequiredArgsConstructor
public class QueueController {

    private final DurableJobQueue jobQueue;

    @GetMapping("/stats")
    public QueueStats stats() {
        return jobQueue.stats();
    }

    @GetMapping("/failed")
    public List<QueueJob> failed(@RequestParam(defaultValue = "50") int limit) {
        return jobQueue.failedJobs(limit);
    }

    @PostMapping("/failed/{id}/retry")
    public QueueJob retry(@PathVariable long id) {
        return jobQueue.retryFailed(id);
    }
}
