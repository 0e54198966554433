package com.kraken.trading.telegram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Sends messages through the Telegram Bot API. Delivery runs asynchronously and
 * failures are only logged. Without a bot token or chat id it just logs the text.
 */
public class TelegramNotifier implements TradeNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private final WebClient client;
    private final String token;
    private final String chatId;

    public TelegramNotifier(String baseUrl, String token, String chatId) {
        this(WebClient.builder().baseUrl(baseUrl).build(), token, chatId);
    }

    TelegramNotifier(WebClient client, String token, String chatId) {
        this.client = client;
        this.token = token;
        this.chatId = chatId;
        if (!isEnabled()) {
            log.info("Telegram notifications disabled (TELEGRAM_BOT_TOKEN / TELEGRAM_CHAT_ID not set)");
        }
    }

    public boolean isEnabled() {
        return token != null && !token.isBlank() && chatId != null && !chatId.isBlank();
    }

    @Override
    public void send(String text) {
        if (!isEnabled()) {
            log.info("[NOTIFY] {}", text);
            return;
        }
        try {
            client.post()
                    .uri("/bot{token}/sendMessage", token)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("chat_id", chatId, "text", text))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            Mono.error(new IllegalStateException("Telegram returned HTTP " + resp.statusCode())))
                    .toBodilessEntity()
                    .subscribe(
                            resp -> log.debug("Telegram message delivered ({})", resp.getStatusCode()),
                            err -> log.warn("Telegram notification failed: {}", err.getMessage())
                    );
        } catch (RuntimeException e) {
            log.warn("Telegram notification failed: {}", e.toString());
        }
    }
}
