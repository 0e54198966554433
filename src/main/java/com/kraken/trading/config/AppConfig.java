package com.kraken.trading.config;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Secrets read from a {@code .env} file or the process environment.
 */
public class AppConfig {
    private final Dotenv env;

    public AppConfig() {
        this(Dotenv.configure().ignoreIfMissing().load());
    }

    AppConfig(Dotenv env) {
        this.env = env;
    }

    public String krakenKey()      { return env.get("KRAKEN_API_KEY", ""); }
    public String krakenSecret()   { return env.get("KRAKEN_API_SECRET", ""); }
    public String telegramToken()  { return env.get("TELEGRAM_BOT_TOKEN", ""); }
    public String telegramChatId() { return env.get("TELEGRAM_CHAT_ID", ""); }

    public boolean hasKrakenCredentials() {
        return !krakenKey().isBlank() && !krakenSecret().isBlank();
    }
}
