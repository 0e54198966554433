package com.kraken.trading;

import com.kraken.trading.engine.TradingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class TradingApplication {
    private static final Logger log = LoggerFactory.getLogger(TradingApplication.class);

    public static void main(String[] args) { SpringApplication.run(TradingApplication.class, args); }

    @Bean
    CommandLineRunner autoStart(@Value("${trading.auto-start:false}") boolean autoStart, TradingEngine engine) {
        return args -> {
            if (!autoStart) {
                log.info("Auto-start disabled; POST /api/start to begin trading.");
                return;
            }
            log.info("Auto-starting trading loop…");
            engine.start();
        };
    }
}
