package com.memberguard.backend.integrations;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memberguard.backend.config.TelegramProperties;
import com.memberguard.backend.models.Plan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Telegram Bot API integration
 *
 * Implements both collaborator contracts against one bot:
 * - sendMessage for user delivery and log channel alerts
 * - getChatMember / createChatInviteLink / banChatMember for the premium group
 */
@Service
@Slf4j
public class TelegramBotClient implements NotificationGateway, GroupMembershipProvider {

    private static final Set<String> MEMBER_STATUSES = Set.of("member", "administrator", "creator");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TelegramProperties telegramProperties;
    private final Clock clock;

    public TelegramBotClient(RestTemplate telegramRestTemplate,
                             ObjectMapper objectMapper,
                             TelegramProperties telegramProperties,
                             Clock clock) {
        this.restTemplate = telegramRestTemplate;
        this.objectMapper = objectMapper;
        this.telegramProperties = telegramProperties;
        this.clock = clock;
    }

    // ========================================
    // NotificationGateway
    // ========================================

    @Override
    public DeliveryResult deliver(long chatId, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", chatId);
        body.put("text", message.text());
        body.put("parse_mode", "Markdown");
        if (message.hasRenewalOptions()) {
            body.put("reply_markup", Map.of("inline_keyboard", renewalKeyboard(message.renewalOptions())));
        }

        try {
            call("sendMessage", body);
            return DeliveryResult.DELIVERED;
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
                log.info("Chat {} is unreachable: {}", chatId, e.getStatusText());
                return DeliveryResult.UNREACHABLE;
            }
            log.warn("sendMessage to {} failed: {} {}", chatId, e.getStatusCode(), e.getResponseBodyAsString());
            return DeliveryResult.TRANSIENT_ERROR;
        } catch (RestClientException e) {
            log.warn("sendMessage to {} failed: {}", chatId, e.getMessage());
            return DeliveryResult.TRANSIENT_ERROR;
        }
    }

    @Override
    public void alertOperators(String text) {
        String channel = telegramProperties.getLogChannelId();
        if (channel == null || channel.isBlank()) {
            log.debug("No log channel configured, alert dropped: {}", text);
            return;
        }

        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", channel);
        body.put("text", text);
        body.put("parse_mode", "Markdown");

        try {
            call("sendMessage", body);
        } catch (RestClientException e) {
            log.warn("Log channel alert failed: {}", e.getMessage());
        }
    }

    // ========================================
    // GroupMembershipProvider
    // ========================================

    @Override
    public boolean isMember(long userId) throws GroupMembershipException {
        Map<String, Object> body = Map.of(
                "chat_id", telegramProperties.getPremiumGroupId(),
                "user_id", userId);

        try {
            JsonNode member = call("getChatMember", body);
            String status = member.path("status").asText("");
            if ("restricted".equals(status)) {
                return member.path("is_member").asBoolean(false);
            }
            return MEMBER_STATUSES.contains(status);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.BAD_REQUEST.value()) {
                // Telegram answers 400 for users it has never seen in the group
                log.debug("getChatMember for {} returned 400, treating as non-member", userId);
                return false;
            }
            throw new GroupMembershipException("getChatMember failed for user " + userId + ": " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new GroupMembershipException("getChatMember failed for user " + userId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String createSingleUseInvite(long userId, int ttlSeconds) {
        long expireAt = clock.instant().getEpochSecond() + ttlSeconds;

        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", telegramProperties.getPremiumGroupId());
        body.put("name", "User_" + userId);
        body.put("member_limit", 1);
        body.put("expire_date", expireAt);

        try {
            JsonNode invite = call("createChatInviteLink", body);
            String link = invite.path("invite_link").asText(null);
            if (link == null) {
                log.error("createChatInviteLink for user {} returned no link", userId);
            }
            return link;
        } catch (RestClientException e) {
            log.error("createChatInviteLink failed for user {}: {}", userId, e.getMessage());
            return null;
        }
    }

    @Override
    public boolean removeMember(long userId) {
        String groupId = telegramProperties.getPremiumGroupId();
        try {
            call("banChatMember", Map.of("chat_id", groupId, "user_id", userId));
            // Lift the ban straight away so a later renewal invite still works
            call("unbanChatMember", Map.of("chat_id", groupId, "user_id", userId, "only_if_banned", true));
            log.info("User {} removed from group {}", userId, groupId);
            return true;
        } catch (RestClientException e) {
            log.warn("Could not remove {} from group {}: {}", userId, groupId, e.getMessage());
            return false;
        }
    }

    // ========================================
    // Plumbing
    // ========================================

    private JsonNode call(String method, Map<String, Object> body) {
        String url = telegramProperties.getApiBaseUrl() + "/bot" + telegramProperties.getBotToken() + "/" + method;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

        if (response.getBody() == null) {
            throw new RestClientException("Empty response from Telegram method " + method);
        }

        try {
            JsonNode root = objectMapper.readTree(response.getBody());
            if (!root.path("ok").asBoolean(false)) {
                throw new RestClientException("Telegram method " + method + " failed: " + root.path("description").asText());
            }
            return root.path("result");
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new RestClientException("Unreadable response from Telegram method " + method, e);
        }
    }

    private List<List<Map<String, String>>> renewalKeyboard(List<Plan> plans) {
        List<List<Map<String, String>>> rows = new ArrayList<>();
        for (Plan plan : plans) {
            String label = "🔄 Renew " + plan.getDurationDays() + " Days"
                    + (plan.isFree() ? "" : " · " + plan.getPrice().toPlainString() + " " + plan.getCurrency());
            rows.add(List.of(Map.of("text", label, "callback_data", "renew_request_" + plan.getId())));
        }
        return rows;
    }
}
