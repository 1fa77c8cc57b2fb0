package com.vipgate.api.wiring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vipgate.api.config.BillingProperties;
import com.vipgate.api.config.ReconcilerProperties;
import com.vipgate.api.config.TelegramProperties;
import com.vipgate.application.ReconcilerObserver;
import com.vipgate.application.access.AccessService;
import com.vipgate.application.admin.SubscriptionAdminService;
import com.vipgate.application.billing.BillingEventIngestor;
import com.vipgate.application.config.ReconcilerSettings;
import com.vipgate.application.notify.MessageTemplates;
import com.vipgate.application.ports.InviteLogStore;
import com.vipgate.application.ports.MembershipDirectoryPort;
import com.vipgate.application.ports.NotifierPort;
import com.vipgate.application.ports.ProcessedEventStore;
import com.vipgate.application.ports.RemovalLogStore;
import com.vipgate.application.ports.SubscriptionStore;
import com.vipgate.application.ports.WarningLogStore;
import com.vipgate.application.ports.WhitelistStore;
import com.vipgate.application.sweep.GracePeriodSweeper;
import com.vipgate.application.sweep.SweepEngine;
import com.vipgate.application.warning.ExpiryWarningService;
import com.vipgate.domain.billing.EventReducer;
import com.vipgate.infrastructure.telegram.DisabledTelegram;
import com.vipgate.infrastructure.telegram.TelegramBotApi;
import com.vipgate.infrastructure.telegram.TelegramDirectNotifier;
import com.vipgate.infrastructure.telegram.TelegramMembershipDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Plain application services are built here; only adapters are component-scanned.
 */
@Configuration
public class VipGateWiringConfig {

  private static final Logger log = LoggerFactory.getLogger(VipGateWiringConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ReconcilerSettings reconcilerSettings(
      ReconcilerProperties reconciler,
      BillingProperties billing,
      TelegramProperties telegram
  ) {
    ReconcilerSettings s = reconciler.toSettings(billing.renewUrl(), telegram.supportContact());
    if (s.groupIds().isEmpty()) {
      log.warn("vipgate.reconciler.group-ids is empty: sweeps will log ERROR entries and invites are unavailable");
    }
    log.info("Reconciler settings: grace={} sweepHour={} notificationHour={} zone={} autoRemoval={} groups={}",
        s.gracePeriod(), s.sweepHour(), s.notificationHour(), s.zone(), s.autoRemovalEnabled(), s.groupIds());
    return s;
  }

  @Bean
  public MessageTemplates messageTemplates(ReconcilerSettings settings) {
    return new MessageTemplates(settings);
  }

  @Bean
  public EventReducer eventReducer(BillingProperties billing) {
    return new EventReducer(billing.planResolver());
  }

  /**
   * Telegram boundary.
   * Disabled (tests, local runs without a token): every call fails, so the sweep logs FAILED and retries.
   */
  @Bean
  @ConditionalOnProperty(prefix = "vipgate.telegram", name = "enabled", havingValue = "true")
  public TelegramBotApi telegramBotApi(TelegramProperties telegram, ObjectMapper mapper) {
    if (telegram.botToken() == null || telegram.botToken().isBlank()) {
      throw new IllegalStateException("vipgate.telegram.bot-token is empty. Set VIPGATE_TELEGRAM_BOT_TOKEN.");
    }
    return new TelegramBotApi(
        telegram.apiBaseUrl(),
        telegram.botToken().trim(),
        Duration.ofSeconds(telegram.timeoutSeconds()),
        mapper
    );
  }

  @Bean
  public MembershipDirectoryPort membershipDirectory(ObjectProvider<TelegramBotApi> api, Clock clock) {
    TelegramBotApi a = api.getIfAvailable();
    if (a == null) {
      log.warn("Telegram integration disabled: removals and invites will fail");
      return DisabledTelegram.directory();
    }
    return new TelegramMembershipDirectory(a, clock);
  }

  @Bean
  public NotifierPort notifier(ObjectProvider<TelegramBotApi> api) {
    TelegramBotApi a = api.getIfAvailable();
    return a == null ? DisabledTelegram.notifier() : new TelegramDirectNotifier(a);
  }

  @Bean
  public BillingEventIngestor billingEventIngestor(
      ProcessedEventStore processed,
      SubscriptionStore subscriptions,
      EventReducer reducer,
      Clock clock,
      ReconcilerObserver observer
  ) {
    return new BillingEventIngestor(processed, subscriptions, reducer, clock, observer);
  }

  @Bean
  public GracePeriodSweeper gracePeriodSweeper(
      SubscriptionStore subscriptions,
      WhitelistStore whitelist,
      RemovalLogStore removalLog,
      MembershipDirectoryPort directory,
      NotifierPort notifier,
      MessageTemplates messages,
      ReconcilerSettings settings,
      Clock clock,
      ReconcilerObserver observer
  ) {
    return new GracePeriodSweeper(subscriptions, whitelist, removalLog, directory, notifier, messages, settings,
        clock, observer);
  }

  @Bean
  public SweepEngine sweepEngine(GracePeriodSweeper sweeper, ReconcilerSettings settings, ReconcilerObserver observer) {
    return new SweepEngine(sweeper, settings, observer);
  }

  @Bean
  public ExpiryWarningService expiryWarningService(
      SubscriptionStore subscriptions,
      WarningLogStore warningLog,
      NotifierPort notifier,
      MessageTemplates messages,
      ReconcilerSettings settings,
      Clock clock,
      ReconcilerObserver observer
  ) {
    return new ExpiryWarningService(subscriptions, warningLog, notifier, messages, settings, clock, observer);
  }

  @Bean
  public AccessService accessService(
      SubscriptionStore subscriptions,
      InviteLogStore inviteLog,
      MembershipDirectoryPort directory,
      ReconcilerSettings settings,
      Clock clock
  ) {
    return new AccessService(subscriptions, inviteLog, directory, settings, clock);
  }

  @Bean
  public SubscriptionAdminService subscriptionAdminService(
      SubscriptionStore subscriptions,
      MembershipDirectoryPort directory,
      ReconcilerSettings settings,
      Clock clock
  ) {
    return new SubscriptionAdminService(subscriptions, directory, settings, clock);
  }
}
