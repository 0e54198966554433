package com.kraken.trading.controller;

import com.kraken.trading.engine.TradingEngine;
import com.kraken.trading.model.EngineStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
public class TradeController {
    private final TradingEngine engine;

    public TradeController(TradingEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/api/status")
    public EngineStatus status() {
        return engine.status();
    }

    @PostMapping("/api/start")
    public ResponseEntity<Map<String, Object>> start() {
        boolean started = engine.start();
        String message = started ? "Bot started successfully!" : "Bot is already running";
        return ResponseEntity.ok(Map.of("message", message, "running", true));
    }

    @PostMapping("/api/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean stopped = engine.stop();
        String message = stopped ? "Bot stopped successfully!" : "Bot is not running";
        return ResponseEntity.ok(Map.of("message", message, "running", false));
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "healthy", "timestamp", Instant.now().toString());
    }
}
