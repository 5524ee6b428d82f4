package com.sandy.aiot.gateway.service.impl;

import com.sandy.aiot.gateway.config.ExecutorConfig;
import com.sandy.aiot.gateway.detection.PatternCorrelator;
import com.sandy.aiot.gateway.detection.PatternDetectionService;
import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.provider.AutomationLookupProvider;
import com.sandy.aiot.gateway.provider.DeviceHealthProvider;
import com.sandy.aiot.gateway.provider.DeviceIdentityResolver;
import com.sandy.aiot.gateway.service.EventStore;
import com.sandy.aiot.gateway.tools.ParallelTasks;
import com.sandy.aiot.gateway.tools.TaskOutcome;
import com.sandy.aiot.gateway.vo.AutomationMatch;
import com.sandy.aiot.gateway.vo.DeviceHealth;
import com.sandy.aiot.gateway.vo.DeviceInfo;
import com.sandy.aiot.gateway.vo.DiagnosticContext;
import com.sandy.aiot.gateway.vo.DiagnosticIntent;
import com.sandy.aiot.gateway.vo.DiagnosticReport;
import com.sandy.aiot.gateway.vo.DiagnosticRequest;
import com.sandy.aiot.gateway.vo.EventQuery;
import com.sandy.aiot.gateway.vo.Pattern;
import com.sandy.aiot.gateway.vo.PatternDetectionResult;
import com.sandy.aiot.gateway.vo.PatternType;
import com.sandy.aiot.gateway.vo.Severity;
import com.sandy.aiot.gateway.vo.SimilarDevice;
import com.sandy.aiot.gateway.vo.SystemStatusReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Gathers health, events, patterns, similar devices and automations for a diagnostic intent
 * and compiles them into a report. Data sources are queried concurrently; a failed or slow
 * source is listed in {@code unavailableSources} and its section left out.
 */
@Service
@Slf4j
public class DiagnosticWorkflowService {

    static final String SOURCE_HEALTH = "health";
    static final String SOURCE_EVENTS = "events";
    static final String SOURCE_PATTERNS = "patterns";
    static final String SOURCE_SIMILAR = "similarDevices";
    static final String SOURCE_AUTOMATIONS = "automations";
    static final String SOURCE_SYSTEM = "systemStatus";
    static final String SOURCE_DIRECTORY = "deviceDirectory";

    private static final int RICH_CONTEXT_EVENTS = 10;
    private static final int MAX_RECENT_ISSUES = 20;

    private final DeviceIdentityResolver identityResolver;
    private final DeviceHealthProvider healthProvider;
    private final AutomationLookupProvider automationLookup;
    private final EventStore eventStore;
    private final PatternDetectionService patternDetection;
    private final PatternCorrelator correlator;
    private final Executor executor;

    @Value("${gateway.diagnostics.timeout-ms:450}")
    private long timeoutMs;
    @Value("${gateway.diagnostics.batch-size:10}")
    private int batchSize;
    @Value("${gateway.diagnostics.batch-timeout-ms:2000}")
    private long batchTimeoutMs;

    public DiagnosticWorkflowService(DeviceIdentityResolver identityResolver,
                                     DeviceHealthProvider healthProvider,
                                     AutomationLookupProvider automationLookup,
                                     EventStore eventStore,
                                     PatternDetectionService patternDetection,
                                     PatternCorrelator correlator,
                                     @Qualifier(ExecutorConfig.DIAGNOSTIC_EXECUTOR) Executor executor) {
        this.identityResolver = identityResolver;
        this.healthProvider = healthProvider;
        this.automationLookup = automationLookup;
        this.eventStore = eventStore;
        this.patternDetection = patternDetection;
        this.correlator = correlator;
        this.executor = executor;
    }

    public DiagnosticReport diagnose(DiagnosticRequest request) {
        if (request == null || request.getIntent() == null) {
            throw new IllegalArgumentException("intent is required");
        }
        long start = System.currentTimeMillis();
        DiagnosticIntent intent = request.getIntent();
        DiagnosticContext context = DiagnosticContext.builder()
                .intent(intent)
                .deviceReference(request.getDevice())
                .build();
        List<String> unavailable = new ArrayList<>();

        if (intent == DiagnosticIntent.SYSTEM_STATUS) {
            try {
                context.setSystemStatus(systemStatus());
            } catch (Exception e) {
                log.error("System status failed errorType={} message={}", e.getClass().getSimpleName(), e.getMessage(), e);
                unavailable.add(SOURCE_SYSTEM);
            }
            return compile(context, unavailable, start);
        }

        Optional<DeviceInfo> device;
        try {
            device = identityResolver.resolve(request.getDevice());
        } catch (Exception e) {
            log.warn("Device resolution failed ref={} error={}", request.getDevice(), e.getMessage());
            unavailable.add(SOURCE_DIRECTORY);
            device = Optional.empty();
        }
        if (device.isEmpty()) {
            log.info("Diagnostic target not resolved intent={} ref={}", intent, request.getDevice());
            return compile(context, unavailable, start);
        }
        context.setDevice(device.get());
        gatherDeviceData(context, device.get().getId(), unavailable);
        return compile(context, unavailable, start);
    }

    private void gatherDeviceData(DiagnosticContext context, String deviceId, List<String> unavailable) {
        ParallelTasks tasks = new ParallelTasks(executor);
        switch (context.getIntent()) {
            case DEVICE_HEALTH:
                tasks.submit(SOURCE_HEALTH, () -> healthProvider.getHealth(deviceId));
                tasks.submit(SOURCE_EVENTS, () -> eventStore.query(deviceId, EventQuery.latest(50)));
                tasks.submit(SOURCE_SIMILAR, () -> identityResolver.findSimilar(deviceId, 3));
                break;
            case ISSUE_DIAGNOSIS:
                tasks.submit(SOURCE_HEALTH, () -> healthProvider.getHealth(deviceId));
                tasks.submit(SOURCE_EVENTS, () -> eventStore.query(deviceId, EventQuery.latest(100)));
                tasks.submit(SOURCE_PATTERNS, () -> patternDetection.detectForDevice(deviceId));
                tasks.submit(SOURCE_SIMILAR, () -> identityResolver.findSimilar(deviceId, 3));
                tasks.submit(SOURCE_AUTOMATIONS, () -> automationLookup.findAutomationsForDevice(deviceId));
                break;
            case DISCOVERY:
                tasks.submit(SOURCE_SIMILAR, () -> identityResolver.findSimilar(deviceId, 10));
                break;
            default:
                throw new IllegalStateException("not a device intent: " + context.getIntent());
        }
        Map<String, TaskOutcome<?>> outcomes = tasks.awaitAll(timeoutMs);
        outcomes.forEach((source, outcome) -> {
            if (!outcome.isSuccess()) {
                log.warn("Diagnostic source unavailable deviceId={} source={} reason={}", deviceId, source, outcome.failureMessage());
                unavailable.add(source);
                return;
            }
            Object value = outcome.value().orElse(null);
            apply(context, source, value);
        });
    }

    @SuppressWarnings("unchecked")
    private void apply(DiagnosticContext context, String source, Object value) {
        switch (source) {
            case SOURCE_HEALTH:
                context.setHealth((DeviceHealth) value);
                break;
            case SOURCE_EVENTS:
                context.setRecentEvents((List<DeviceEvent>) value);
                break;
            case SOURCE_PATTERNS:
                context.setPatterns(value == null ? List.of() : ((PatternDetectionResult) value).getPatterns());
                break;
            case SOURCE_SIMILAR:
                context.setSimilarDevices((List<SimilarDevice>) value);
                break;
            case SOURCE_AUTOMATIONS:
                context.setAutomations((List<AutomationMatch>) value);
                break;
            default:
                log.debug("Ignoring unknown diagnostic source={}", source);
        }
    }

    /**
     * Health and patterns for every known device, {@code batch-size} devices at a time, then
     * cross-device correlation of the per-device patterns.
     */
    public SystemStatusReport systemStatus() {
        List<DeviceInfo> devices = identityResolver.listDevices();
        Map<String, List<Pattern>> patternsByDevice = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        int healthy = 0, warning = 0, critical = 0, unknown = 0;

        int size = Math.max(1, batchSize);
        for (int from = 0; from < devices.size(); from += size) {
            List<DeviceInfo> batch = devices.subList(from, Math.min(devices.size(), from + size));
            ParallelTasks tasks = new ParallelTasks(executor);
            for (DeviceInfo d : batch) {
                tasks.submit(SOURCE_HEALTH + ":" + d.getId(), () -> healthProvider.getHealth(d.getId()));
                tasks.submit(SOURCE_PATTERNS + ":" + d.getId(), () -> patternDetection.detectForDevice(d.getId()));
            }
            Map<String, TaskOutcome<?>> outcomes = tasks.awaitAll(batchTimeoutMs);
            for (DeviceInfo d : batch) {
                TaskOutcome<?> h = outcomes.get(SOURCE_HEALTH + ":" + d.getId());
                TaskOutcome<?> p = outcomes.get(SOURCE_PATTERNS + ":" + d.getId());
                List<Pattern> patterns = p != null && p.isSuccess()
                        ? p.value().map(v -> ((PatternDetectionResult) v).getPatterns()).orElse(List.of())
                        : List.of();
                patternsByDevice.put(d.getId(), patterns);
                Severity worst = patterns.stream().map(Pattern::getSeverity)
                        .max((a, b) -> Integer.compare(a.rank(), b.rank())).orElse(null);

                if (h == null || !h.isSuccess() || h.value().isEmpty()) {
                    unknown++;
                    continue;
                }
                DeviceHealth health = (DeviceHealth) h.value().get();
                if (health.getStatus() == DeviceHealth.Status.OFFLINE) {
                    critical++;
                    issues.add(d.displayName() + ": offline");
                } else if (health.getStatus() == DeviceHealth.Status.WARNING
                        || (worst != null && worst.isAtLeast(Severity.WARNING))) {
                    warning++;
                } else {
                    healthy++;
                }
                for (Pattern pattern : patterns) {
                    if (pattern.getSeverity() == Severity.CRITICAL) {
                        issues.add(d.displayName() + ": " + pattern.getDescription());
                    }
                }
            }
            log.debug("System status batch processed from={} size={}", from, batch.size());
        }

        List<Pattern> correlated = correlator.correlate(patternsByDevice);
        return SystemStatusReport.builder()
                .totalDevices(devices.size())
                .healthyDevices(healthy)
                .warningDevices(warning)
                .criticalDevices(critical)
                .unknownDevices(unknown)
                .correlatedFindings(correlated)
                .recentIssues(issues.size() > MAX_RECENT_ISSUES ? new ArrayList<>(issues.subList(0, MAX_RECENT_ISSUES)) : issues)
                .build();
    }

    private DiagnosticReport compile(DiagnosticContext context, List<String> unavailable, long start) {
        long elapsed = System.currentTimeMillis() - start;
        DiagnosticReport report = DiagnosticReport.builder()
                .summary(summary(context, unavailable))
                .context(context)
                .recommendations(recommendations(context))
                .richContext(richContext(context, unavailable))
                .unavailableSources(new ArrayList<>(unavailable))
                .elapsedMs(elapsed)
                .timestamp(Instant.now())
                .build();
        log.info("Diagnostic report compiled intent={} device={} unavailable={} durationMs={}",
                context.getIntent(), context.getDevice() != null ? context.getDevice().getId() : context.getDeviceReference(), unavailable, elapsed);
        return report;
    }

    private String summary(DiagnosticContext context, List<String> unavailable) {
        String summary;
        if (context.getIntent() == DiagnosticIntent.SYSTEM_STATUS) {
            SystemStatusReport s = context.getSystemStatus();
            summary = s == null
                    ? "System-wide status unavailable"
                    : "System-wide status: " + s.getHealthyDevices() + "/" + s.getTotalDevices() + " devices healthy";
        } else if (context.getDevice() == null) {
            summary = "Device '" + context.getDeviceReference() + "' could not be resolved";
        } else {
            String status = context.getHealth() != null ? context.getHealth().getStatus().name() : "unknown";
            summary = "Diagnostic data gathered for " + context.getDevice().displayName() + " (status: " + status + ")";
        }
        if (!unavailable.isEmpty()) {
            summary += "; unavailable: " + String.join(", ", unavailable);
        }
        return summary;
    }

    List<String> recommendations(DiagnosticContext context) {
        Set<String> out = new LinkedHashSet<>();
        DeviceHealth health = context.getHealth();
        if (health != null && !health.isOnline()) {
            out.add("Check device power supply and network connectivity");
            out.add("Verify the hub is online and reachable");
        }
        if (health != null && health.getBatteryLevel() != null && health.getBatteryLevel() < 20) {
            out.add("Battery level is low (" + Math.round(health.getBatteryLevel()) + "%). Replace battery soon.");
        }
        List<Pattern> patterns = context.getPatterns() == null ? List.of() : context.getPatterns();
        if (patterns.stream().anyMatch(p -> p.getType() == PatternType.CONNECTIVITY_GAP)) {
            out.add("Detected connectivity gaps. Check network stability and hub logs.");
        }
        if (patterns.stream().anyMatch(p -> p.getType() == PatternType.AUTOMATION_CONFLICT)) {
            out.add("Detected rapid state changes. Check for automation loops or faulty sensors.");
        }
        patterns.forEach(p -> out.addAll(p.getRecommendations()));
        if (context.getSystemStatus() != null) {
            context.getSystemStatus().getCorrelatedFindings().forEach(p -> out.addAll(p.getRecommendations()));
        }
        return new ArrayList<>(out);
    }

    private String richContext(DiagnosticContext context, List<String> unavailable) {
        StringBuilder sb = new StringBuilder();
        DeviceInfo device = context.getDevice();
        if (device != null) {
            sb.append("## Device Information\n");
            sb.append("- **Name**: ").append(device.displayName()).append('\n');
            sb.append("- **ID**: ").append(device.getId()).append('\n');
            sb.append("- **Location**: ").append(device.getLocationId() != null ? device.getLocationId() : "Not assigned").append('\n');
            sb.append("- **Capabilities**: ").append(String.join(", ", device.getCapabilities())).append('\n');
        }
        DeviceHealth health = context.getHealth();
        if (health != null) {
            sb.append("\n## Health Status\n");
            sb.append("- **Status**: ").append(health.getStatus()).append('\n');
            sb.append("- **Online**: ").append(health.isOnline() ? "Yes" : "No").append('\n');
            if (health.getBatteryLevel() != null) sb.append("- **Battery**: ").append(Math.round(health.getBatteryLevel())).append("%\n");
            if (health.getLastActivity() != null) sb.append("- **Last Activity**: ").append(health.getLastActivity()).append('\n');
        }
        List<DeviceEvent> events = context.getRecentEvents();
        if (events != null && !events.isEmpty()) {
            sb.append("\n## Recent Events\n");
            sb.append("Showing ").append(Math.min(RICH_CONTEXT_EVENTS, events.size())).append(" most recent events:\n\n");
            events.stream().limit(RICH_CONTEXT_EVENTS).forEach(e -> sb.append("- **").append(e.getTimestamp()).append("**: ")
                    .append(e.getCapability()).append('.').append(e.getAttribute()).append(" = ").append(e.typedValue()).append('\n'));
            if (events.size() > RICH_CONTEXT_EVENTS) {
                sb.append("\n_(").append(events.size() - RICH_CONTEXT_EVENTS).append(" more events not shown)_\n");
            }
        }
        List<Pattern> patterns = context.getPatterns();
        if (patterns != null && !patterns.isEmpty()) {
            sb.append("\n## Detected Patterns\n");
            patterns.forEach(p -> sb.append(patternLine(p)));
        }
        List<SimilarDevice> similar = context.getSimilarDevices();
        if (similar != null && !similar.isEmpty()) {
            sb.append("\n## Similar Devices\n");
            similar.forEach(s -> sb.append("- **").append(s.getDevice().displayName()).append("** (")
                    .append(Math.round(s.getScore() * 100)).append("% match)\n"));
        }
        List<AutomationMatch> automations = context.getAutomations();
        if (automations != null && !automations.isEmpty()) {
            sb.append("\n## Automations Involving This Device\n");
            automations.forEach(a -> sb.append("- **").append(a.getName()).append("** (").append(a.isEnabled() ? "Enabled" : "Disabled")
                    .append("): ").append(a.getDescription() != null ? a.getDescription() : "No description").append('\n'));
        }
        SystemStatusReport system = context.getSystemStatus();
        if (system != null) {
            sb.append("\n## System Status Overview\n");
            sb.append("- **Total Devices**: ").append(system.getTotalDevices()).append('\n');
            sb.append("- **Healthy**: ").append(system.getHealthyDevices()).append('\n');
            sb.append("- **Warnings**: ").append(system.getWarningDevices()).append('\n');
            sb.append("- **Critical/Offline**: ").append(system.getCriticalDevices()).append('\n');
            if (system.getUnknownDevices() > 0) sb.append("- **Unknown**: ").append(system.getUnknownDevices()).append('\n');
            if (!system.getCorrelatedFindings().isEmpty()) {
                sb.append("\n**Cross-Device Findings**:\n");
                system.getCorrelatedFindings().forEach(p -> sb.append(patternLine(p)));
            }
            if (!system.getRecentIssues().isEmpty()) {
                sb.append("\n**Recent Issues**:\n");
                system.getRecentIssues().forEach(i -> sb.append("  - ").append(i).append('\n'));
            }
        }
        if (!unavailable.isEmpty()) {
            sb.append("\n## Unavailable Data Sources\n");
            unavailable.forEach(u -> sb.append("- ").append(u).append('\n'));
        }
        return sb.toString().trim();
    }

    private static String patternLine(Pattern p) {
        return "- **" + p.getType() + "** [" + p.getSeverity() + "]: " + p.getDescription()
                + " (" + p.getOccurrences() + " occurrences, " + Math.round(p.getConfidence() * 100) + "% confidence)\n";
    }
}
