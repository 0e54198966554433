package com.kraken.trading.broker;

import com.kraken.trading.config.AppConfig;
import com.kraken.trading.model.Candle;
import com.kraken.trading.model.OrderSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Thin Kraken REST client. Every call returns the decoded JSON body; transport
 * failures and timeouts are folded into the body as {@code {"error": [...]}} the
 * same way Kraken reports API errors, so callers only inspect one shape.
 */
@Component
public class KrakenClient {

    private static final Logger log = LoggerFactory.getLogger(KrakenClient.class);
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() {};
    private static final String ADD_ORDER_PATH = "/0/private/AddOrder";

    public record Ticker(double last, double lastVolume, double bid, double ask) {}

    private final WebClient client;
    private final AppConfig config;
    private final Duration timeout;

    @Autowired
    public KrakenClient(
            @Value("${kraken.base-url:https://api.kraken.com}") String baseUrl,
            @Value("${kraken.timeout-sec:10}") long timeoutSec,
            AppConfig config
    ) {
        this(WebClient.builder().baseUrl(baseUrl).build(), config, Duration.ofSeconds(timeoutSec));
    }

    KrakenClient(WebClient client, AppConfig config, Duration timeout) {
        this.client = client;
        this.config = config;
        this.timeout = timeout;
    }

    /* ===================== Public market data ===================== */

    public Map<String, Object> ticker(String pair) {
        return client.get()
                .uri(b -> b.path("/0/public/Ticker").queryParam("pair", pair).build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JSON_MAP)
                .timeout(timeout)
                .onErrorResume(ex -> errorBody("Ticker", ex))
                .block();
    }

    public Map<String, Object> ohlc(String pair, int intervalMinutes, Long since) {
        return client.get()
                .uri(b -> {
                    b.path("/0/public/OHLC").queryParam("pair", pair).queryParam("interval", intervalMinutes);
                    if (since != null) b.queryParam("since", since);
                    return b.build();
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JSON_MAP)
                .timeout(timeout)
                .onErrorResume(ex -> errorBody("OHLC", ex))
                .block();
    }

    /* ======================== Private trading ===================== */

    public Map<String, Object> addMarketOrder(String pair, OrderSide side, double volume) {
        String nonce = Long.toString(System.currentTimeMillis());
        String postData = "nonce=" + nonce
                + "&ordertype=market"
                + "&type=" + side.wireValue()
                + "&volume=" + BigDecimal.valueOf(volume).toPlainString()
                + "&pair=" + pair;
        String signature;
        try {
            signature = sign(ADD_ORDER_PATH, nonce, postData, config.krakenSecret());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.error("Kraken request signing failed: {}", e.toString());
            return Map.of("error", List.of("signing failed: " + e.getMessage()));
        }

        log.info("POST {} {}", ADD_ORDER_PATH, postData);

        return client.post()
                .uri(ADD_ORDER_PATH)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .header("API-Key", config.krakenKey())
                .header("API-Sign", signature)
                .bodyValue(postData)
                .retrieve()
                .bodyToMono(JSON_MAP)
                .doOnNext(resp -> log.info("Kraken response: {}", resp))
                .timeout(timeout)
                .onErrorResume(ex -> errorBody("AddOrder", ex))
                .block();
    }

    /**
     * Kraken API-Sign: base64(HMAC-SHA512(path + SHA256(nonce + postData), base64decode(secret))).
     */
    static String sign(String path, String nonce, String postData, String secret) throws GeneralSecurityException {
        MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
        byte[] hash = sha256.digest((nonce + postData).getBytes(StandardCharsets.UTF_8));
        byte[] pathBytes = path.getBytes(StandardCharsets.UTF_8);
        byte[] message = new byte[pathBytes.length + hash.length];
        System.arraycopy(pathBytes, 0, message, 0, pathBytes.length);
        System.arraycopy(hash, 0, message, pathBytes.length, hash.length);

        Mac mac = Mac.getInstance("HmacSHA512");
        mac.init(new SecretKeySpec(Base64.getDecoder().decode(secret), "HmacSHA512"));
        return Base64.getEncoder().encodeToString(mac.doFinal(message));
    }

    /* ========================= Parsing ============================ */

    /** Kraken error strings of a response; a null body counts as an error. */
    public static List<String> errors(Map<String, Object> body) {
        if (body == null) return List.of("empty response");
        Object e = body.get("error");
        if (e instanceof Collection<?> c) return c.stream().map(String::valueOf).toList();
        if (e != null) return List.of(e.toString());
        return List.of();
    }

    /**
     * Extracts the ticker for {@code pair}. Kraken keys results by its internal
     * pair name (XBTUSD comes back as XXBTZUSD), so a single entry is accepted
     * whatever its key.
     */
    public static Optional<Ticker> parseTicker(Map<String, Object> body, String pair) {
        if (!errors(body).isEmpty()) return Optional.empty();
        Object node = pairNode(body, pair);
        if (!(node instanceof Map<?, ?> m)) return Optional.empty();
        Double last = element(m.get("c"), 0);
        if (last == null) return Optional.empty();
        Double lastVolume = element(m.get("c"), 1);
        Double bid = element(m.get("b"), 0);
        Double ask = element(m.get("a"), 0);
        return Optional.of(new Ticker(last,
                lastVolume != null ? lastVolume : 0.0,
                bid != null ? bid : last,
                ask != null ? ask : last));
    }

    /** OHLC rows as candles, oldest first. Malformed rows are skipped. */
    public static List<Candle> parseOhlc(Map<String, Object> body, String pair) {
        if (!errors(body).isEmpty()) return List.of();
        Object node = pairNode(body, pair);
        if (!(node instanceof List<?> rows)) return List.of();
        List<Candle> candles = new ArrayList<>(rows.size());
        for (Object row : rows) {
            if (!(row instanceof List<?> r) || r.size() < 7) continue;
            Double time = toD(r.get(0));
            Double open = toD(r.get(1));
            Double high = toD(r.get(2));
            Double low = toD(r.get(3));
            Double close = toD(r.get(4));
            Double volume = toD(r.get(6));
            if (time == null || open == null || high == null || low == null || close == null || volume == null) continue;
            try {
                candles.add(new Candle(Instant.ofEpochSecond(time.longValue()), open, high, low, close, volume));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed OHLC row {}: {}", r, e.getMessage());
            }
        }
        return candles;
    }

    /** The {@code last} cursor of an OHLC response, to pass as {@code since} on the next poll. */
    public static Optional<Long> ohlcCursor(Map<String, Object> body) {
        Object result = body == null ? null : body.get("result");
        if (result instanceof Map<?, ?> m) {
            Double last = toD(m.get("last"));
            if (last != null) return Optional.of(last.longValue());
        }
        return Optional.empty();
    }

    /** First transaction id of an AddOrder response. */
    public static Optional<String> parseTxid(Map<String, Object> body) {
        if (!errors(body).isEmpty()) return Optional.empty();
        Object result = body.get("result");
        if (result instanceof Map<?, ?> m && m.get("txid") instanceof List<?> ids && !ids.isEmpty()) {
            return Optional.of(String.valueOf(ids.get(0)));
        }
        return Optional.empty();
    }

    private static Object pairNode(Map<String, Object> body, String pair) {
        Object result = body.get("result");
        if (!(result instanceof Map<?, ?> m)) return null;
        if (m.containsKey(pair)) return m.get(pair);
        List<Object> candidates = new ArrayList<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            if (!"last".equals(e.getKey())) candidates.add(e.getValue());
        }
        return candidates.size() == 1 ? candidates.get(0) : null;
    }

    private static Double element(Object node, int index) {
        if (node instanceof List<?> l && l.size() > index) return toD(l.get(index));
        return null;
    }

    private static Double toD(Object v) {
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return null; }
    }

    private static Mono<Map<String, Object>> errorBody(String call, Throwable ex) {
        log.error("Kraken {} error: {}", call, ex.toString());
        Map<String, Object> body = new HashMap<>();
        body.put("error", List.of(ex.toString()));
        return Mono.just(body);
    }
}
