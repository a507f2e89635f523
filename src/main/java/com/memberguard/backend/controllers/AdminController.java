package com.memberguard.backend.controllers;

import com.memberguard.backend.config.AdminProperties;
import com.memberguard.backend.dto.AccessRequestDto;
import com.memberguard.backend.dto.ApproveRequest;
import com.memberguard.backend.dto.AuditLogDto;
import com.memberguard.backend.dto.BroadcastRequest;
import com.memberguard.backend.dto.GrowthStatsDto;
import com.memberguard.backend.dto.PlanPerformanceDto;
import com.memberguard.backend.dto.SalesReportDto;
import com.memberguard.backend.dto.SubscriptionDto;
import com.memberguard.backend.lifecycle.JobReport;
import com.memberguard.backend.lifecycle.LifecycleJob;
import com.memberguard.backend.models.AccessRequest;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.scheduler.LifecycleJobScheduler;
import com.memberguard.backend.services.AccessRequestService;
import com.memberguard.backend.services.ApprovalService;
import com.memberguard.backend.services.AuditService;
import com.memberguard.backend.services.BroadcastService;
import com.memberguard.backend.services.SubscriptionService;
import com.memberguard.backend.services.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Operator endpoints. The acting admin's Telegram id is taken from the
 * {@code X-Admin-Telegram-Id} header, or from configuration when absent.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private static final String ADMIN_HEADER = "X-Admin-Telegram-Id";

    private final AccessRequestService accessRequestService;
    private final ApprovalService approvalService;
    private final SubscriptionService subscriptionService;
    private final BroadcastService broadcastService;
    private final UserService userService;
    private final AuditService auditService;
    private final LifecycleJobScheduler lifecycleJobScheduler;
    private final AdminProperties adminProperties;

    // ========================================
    // Access requests
    // ========================================

    @GetMapping("/requests")
    public ResponseEntity<List<AccessRequestDto>> pendingRequests() {
        List<AccessRequestDto> pending = accessRequestService.listPending().stream()
                .map(AccessRequestDto::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(pending);
    }

    @PostMapping("/requests/{requestId}/approve")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable Long requestId,
                                                       @Valid @RequestBody ApproveRequest body,
                                                       @RequestHeader(value = ADMIN_HEADER, required = false) Long adminId) {
        log.info("Admin request: approve access request {} with plan {}", requestId, body.getPlanId());

        ApprovalService.ApprovalResult result = approvalService.approve(requestId, adminProperties.actorId(adminId), body.getPlanId());

        Map<String, Object> response = new HashMap<>();
        response.put("request", AccessRequestDto.from(result.request()));
        response.put("subscription", SubscriptionDto.from(result.subscription()));
        response.put("renewal", result.renewal());
        response.put("inviteSent", result.inviteLink() != null);
        response.put("referralBonus", result.referralOutcome().name());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/requests/{requestId}/reject")
    public ResponseEntity<AccessRequestDto> reject(@PathVariable Long requestId,
                                                   @RequestHeader(value = ADMIN_HEADER, required = false) Long adminId) {
        log.info("Admin request: reject access request {}", requestId);
        AccessRequest request = approvalService.reject(requestId, adminProperties.actorId(adminId));
        return ResponseEntity.ok(AccessRequestDto.from(request));
    }

    // ========================================
    // Subscriptions
    // ========================================

    @PostMapping("/subscriptions/{subscriptionId}/cancel")
    public ResponseEntity<SubscriptionDto> cancel(@PathVariable Long subscriptionId,
                                                  @RequestHeader(value = ADMIN_HEADER, required = false) Long adminId) {
        log.info("Admin request: cancel subscription {}", subscriptionId);
        Subscription subscription = subscriptionService.cancel(subscriptionId, adminProperties.actorId(adminId));
        return ResponseEntity.ok(SubscriptionDto.from(subscription));
    }

    @GetMapping("/subscriptions/expiring-today")
    public ResponseEntity<List<SubscriptionDto>> expiringToday() {
        return ResponseEntity.ok(subscriptionService.todayExpiryList().stream()
                .map(SubscriptionDto::from)
                .collect(Collectors.toList()));
    }

    // ========================================
    // Broadcast & jobs
    // ========================================

    @PostMapping("/broadcasts")
    public ResponseEntity<BroadcastService.BroadcastResult> broadcast(@Valid @RequestBody BroadcastRequest body,
                                                                      @RequestHeader(value = ADMIN_HEADER, required = false) Long adminId) {
        BroadcastService.BroadcastResult result = broadcastService.broadcast(
                adminProperties.actorId(adminId), body.getTarget(), body.getMessage());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/jobs/{job}/run")
    public ResponseEntity<?> runJob(@PathVariable LifecycleJob job) {
        log.info("Admin request: run {} now", job);
        Optional<JobReport> report = lifecycleJobScheduler.run(job);
        if (report.isEmpty()) {
            Map<String, Object> response = new HashMap<>();
            response.put("job", job.name());
            response.put("message", "Job is already running or failed, see logs");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }
        return ResponseEntity.ok(report.get());
    }

    // ========================================
    // Stats & reports
    // ========================================

    @GetMapping("/stats")
    public ResponseEntity<GrowthStatsDto> stats() {
        return ResponseEntity.ok(userService.growthStats());
    }

    @GetMapping("/reports/sales")
    public ResponseEntity<SalesReportDto> salesReport(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(subscriptionService.salesReport(from, to));
    }

    @GetMapping("/reports/plans")
    public ResponseEntity<List<PlanPerformanceDto>> planPerformance() {
        return ResponseEntity.ok(subscriptionService.planPerformance());
    }

    @GetMapping("/audit-logs")
    public ResponseEntity<List<AuditLogDto>> recentAuditLogs() {
        return ResponseEntity.ok(auditService.recentEntries().stream()
                .map(AuditLogDto::from)
                .collect(Collectors.toList()));
    }
}
