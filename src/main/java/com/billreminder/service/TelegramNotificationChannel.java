package com.billreminder.service;

import com.billreminder.config.TelegramProperties;
import com.billreminder.domain.enums.ChannelFailureKind;
import com.billreminder.service.exception.ChannelException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramNotificationChannel implements NotificationChannel {

    private static final List<String> UNREACHABLE_CHAT_MARKERS = List.of(
            "chat not found",
            "user is deactivated",
            "bot was blocked",
            "bot was kicked",
            "have no rights to send"
    );

    private final RestClient telegramRestClient;
    private final TelegramProperties properties;

    @Override
    public void send(Long userId, String text) {
        log.info("Send Telegram message. chatId={}", userId);
        Map<String, Object> payload = new HashMap<>();
        payload.put("chat_id", userId);
        payload.put("text", text);

        try {
            telegramRestClient.post()
                    .uri("/bot{token}/sendMessage", properties.botToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Telegram message sent. chatId={}", userId);
        } catch (HttpClientErrorException e) {
            ChannelFailureKind kind = classify(e);
            throw new ChannelException(kind,
                    "Telegram rejected message. chatId=" + userId + ", status=" + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            // 5xx and I/O errors
            throw new ChannelException(ChannelFailureKind.TRANSIENT,
                    "Telegram unavailable. chatId=" + userId + ", error=" + e.getMessage(), e);
        }
    }

    private ChannelFailureKind classify(HttpClientErrorException e) {
        int status = e.getStatusCode().value();
        if (status == HttpStatus.FORBIDDEN.value()) {
            return ChannelFailureKind.PERMANENT;
        }
        if (status == HttpStatus.BAD_REQUEST.value()) {
            String body = e.getResponseBodyAsString().toLowerCase(Locale.ROOT);
            for (String marker : UNREACHABLE_CHAT_MARKERS) {
                if (body.contains(marker)) {
                    return ChannelFailureKind.PERMANENT;
                }
            }
        }
        // 429, token problems (401/404) and unrecognised 400s are retried
        return ChannelFailureKind.TRANSIENT;
    }
}
