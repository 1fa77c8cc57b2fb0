package com.vipgate.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Telegram Bot API access used for removals, invites and direct messages.
 *
 * Token must come from env (VIPGATE_TELEGRAM_BOT_TOKEN).
 */
@ConfigurationProperties(prefix = "vipgate.telegram")
public record TelegramProperties(

    boolean enabled,

    String botToken,

    @DefaultValue("https://api.telegram.org") String apiBaseUrl,

    @DefaultValue("10") int timeoutSeconds,

    /**
     * Shown to members in removal notices and error replies, e.g. "@vip_support".
     */
    String supportContact

) {
}
