package com.sandy.aiot.gateway.controller;

import com.sandy.aiot.gateway.service.impl.DiagnosticWorkflowService;
import com.sandy.aiot.gateway.vo.DiagnosticIntent;
import com.sandy.aiot.gateway.vo.DiagnosticReport;
import com.sandy.aiot.gateway.vo.DiagnosticRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/diagnostics")
@RequiredArgsConstructor
public class DiagnosticController {

    private final DiagnosticWorkflowService diagnosticWorkflowService;

    @PostMapping
    public DiagnosticReport diagnose(@RequestBody DiagnosticRequest request) {
        return diagnosticWorkflowService.diagnose(request);
    }

    @GetMapping("/system-status")
    public DiagnosticReport systemStatus() {
        return diagnosticWorkflowService.diagnose(DiagnosticRequest.builder().intent(DiagnosticIntent.SYSTEM_STATUS).build());
    }
}
