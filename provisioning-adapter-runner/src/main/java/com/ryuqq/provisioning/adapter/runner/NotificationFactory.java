package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.notification.Channel;
import com.ryuqq.provisioning.core.notification.Notification;
import com.ryuqq.provisioning.core.notification.NotificationKind;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 전이별 알림 생성기.
 *
 * <p>렌더링은 Notifier의 몫이며, 여기서는 수신자와 사실 값만 채웁니다.
 * CHAT 알림은 recipient가 null이며 Notifier가 설정된 채널로 보냅니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
final class NotificationFactory {

    private final EngineConfig config;

    NotificationFactory(EngineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    List<Notification> approvalRequested(DeploymentRequest request, String templateName, BigDecimal estimatedMonthlyCost) {
        Map<String, String> facts = baseFacts(request, templateName);
        facts.put("request_type", request.getRequestType().name());
        if (estimatedMonthlyCost != null) {
            facts.put("estimated_monthly_cost", estimatedMonthlyCost.toPlainString());
        }
        return config.approverEmails().stream()
            .map(approver -> Notification.of(NotificationKind.APPROVAL_REQUESTED, request.getId(), approver, facts))
            .collect(Collectors.toList());
    }

    Notification approved(DeploymentRequest request, String templateName, String approverName) {
        Map<String, String> facts = baseFacts(request, templateName);
        facts.put("approved_by", approverName);
        return Notification.of(NotificationKind.REQUEST_APPROVED, request.getId(), request.getRequester().email(), facts);
    }

    Notification rejected(DeploymentRequest request, String templateName, String rejectorName, String reason) {
        Map<String, String> facts = baseFacts(request, templateName);
        facts.put("rejected_by", rejectorName);
        facts.put("reason", reason);
        return Notification.of(NotificationKind.REQUEST_REJECTED, request.getId(), request.getRequester().email(), facts);
    }

    Notification deploymentStarted(DeploymentRequest request, String templateName, String approverName) {
        Map<String, String> facts = baseFacts(request, templateName);
        facts.put("status", "started");
        facts.put("approved_by", approverName);
        request.getPipelineRun().ifPresent(run -> putIfPresent(facts, "build_url", run.url()));
        return Notification.of(NotificationKind.DEPLOYMENT_STARTED, request.getId(), null, facts);
    }

    Notification deploymentFinished(DeploymentRequest request, String templateName, boolean success) {
        Map<String, String> facts = baseFacts(request, templateName);
        facts.put("status", success ? "completed" : "failed");
        request.getPipelineRun().ifPresent(run -> putIfPresent(facts, "build_url", run.url()));
        NotificationKind kind = success ? NotificationKind.DEPLOYMENT_COMPLETED : NotificationKind.DEPLOYMENT_FAILED;
        return Notification.of(kind, request.getId(), null, facts);
    }

    List<Notification> approvalReminder(DeploymentRequest request, String templateName, Duration pending, Channel channel) {
        Map<String, String> facts = baseFacts(request, templateName);
        facts.put("pending_hours", String.valueOf(pending.toHours()));
        if (channel == Channel.CHAT) {
            return List.of(new Notification(NotificationKind.APPROVAL_REMINDER, channel, request.getId(), null, facts));
        }
        return config.approverEmails().stream()
            .map(approver -> new Notification(NotificationKind.APPROVAL_REMINDER, channel, request.getId(), approver, facts))
            .collect(Collectors.toList());
    }

    Notification expirationWarning(DeploymentRequest request, String templateName) {
        Map<String, String> facts = baseFacts(request, templateName);
        request.getExpiresAt().ifPresent(expiresAt -> facts.put("expires_at", expiresAt.toString()));
        return Notification.of(NotificationKind.EXPIRATION_WARNING, request.getId(), request.getRequester().email(), facts);
    }

    private Map<String, String> baseFacts(DeploymentRequest request, String templateName) {
        Map<String, String> facts = new LinkedHashMap<>();
        facts.put("request_id", request.getId().getValue());
        facts.put("template_name", templateName);
        facts.put("requester_name", request.getRequester().displayName());
        facts.put("link", config.requestLink(request.getId()));
        return facts;
    }

    private static void putIfPresent(Map<String, String> facts, String key, String value) {
        if (value != null) {
            facts.put(key, value);
        }
    }
}
