package com.sandy.aiot.gateway.controller;

import com.sandy.aiot.gateway.detection.PatternDetectionService;
import com.sandy.aiot.gateway.vo.PatternDetectionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/patterns")
@RequiredArgsConstructor
public class PatternController {

    private final PatternDetectionService patternDetectionService;

    @GetMapping("/{deviceId}")
    public PatternDetectionResult detect(@PathVariable String deviceId) {
        return patternDetectionService.detectForDevice(deviceId);
    }
}
