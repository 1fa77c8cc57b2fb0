package com.vipgate.infrastructure.telegram;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.vipgate.application.ports.InviteHandle;
import com.vipgate.application.ports.MembershipException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelegramMembershipDirectoryTest {

  @RegisterExtension
  static WireMockExtension wireMock = WireMockExtension.newInstance()
      .options(wireMockConfig().dynamicPort())
      .build();

  private static final Instant NOW = Instant.parse("2026-03-03T12:00:00Z");
  private static final String PREFIX = "/bot123:abc/";

  private TelegramMembershipDirectory directory;

  @BeforeEach
  void setUp() {
    TelegramBotApi api = new TelegramBotApi(wireMock.baseUrl(), "123:abc", Duration.ofSeconds(2), new ObjectMapper());
    directory = new TelegramMembershipDirectory(api, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void removeBansThenUnbans() throws Exception {
    wireMock.stubFor(post(urlEqualTo(PREFIX + "banChatMember")).willReturn(okJson("{\"ok\":true,\"result\":true}")));
    wireMock.stubFor(post(urlEqualTo(PREFIX + "unbanChatMember")).willReturn(okJson("{\"ok\":true,\"result\":true}")));

    directory.removeMember(-100123L, 42L);

    wireMock.verify(postRequestedFor(urlEqualTo(PREFIX + "banChatMember"))
        .withRequestBody(equalToJson("{\"chat_id\":-100123,\"user_id\":42}", true, true)));
    wireMock.verify(postRequestedFor(urlEqualTo(PREFIX + "unbanChatMember"))
        .withRequestBody(equalToJson("{\"chat_id\":-100123,\"user_id\":42,\"only_if_banned\":true}", true, true)));
  }

  @Test
  void rejectedBanIsPermanentFailure() {
    wireMock.stubFor(post(urlEqualTo(PREFIX + "banChatMember")).willReturn(aResponse()
        .withStatus(400)
        .withHeader("Content-Type", "application/json")
        .withBody("{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: not enough rights\"}")));

    assertThatThrownBy(() -> directory.removeMember(-100123L, 42L))
        .isInstanceOf(MembershipException.class)
        .hasMessageContaining("not enough rights")
        .satisfies(e -> assertThat(((MembershipException) e).isTransient()).isFalse());
    wireMock.verify(0, postRequestedFor(urlEqualTo(PREFIX + "unbanChatMember")));
  }

  @Test
  void rateLimitIsTransient() {
    wireMock.stubFor(post(urlEqualTo(PREFIX + "banChatMember")).willReturn(aResponse()
        .withStatus(429)
        .withBody("{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 5\"}")));

    assertThatThrownBy(() -> directory.removeMember(-1L, 2L))
        .isInstanceOf(MembershipException.class)
        .satisfies(e -> assertThat(((MembershipException) e).isTransient()).isTrue());
  }

  @Test
  void slowServerTimesOut() {
    wireMock.stubFor(post(urlEqualTo(PREFIX + "banChatMember"))
        .willReturn(okJson("{\"ok\":true,\"result\":true}").withFixedDelay(4000)));

    assertThatThrownBy(() -> directory.removeMember(-1L, 2L)).isInstanceOf(MembershipException.class);
  }

  @Test
  void createsSingleUseInvite() throws Exception {
    long expire = NOW.plus(Duration.ofHours(24)).getEpochSecond();
    wireMock.stubFor(post(urlEqualTo(PREFIX + "createChatInviteLink")).willReturn(okJson(
        "{\"ok\":true,\"result\":{\"invite_link\":\"https://t.me/+AbC\",\"expire_date\":" + expire
            + ",\"member_limit\":1}}")));

    InviteHandle h = directory.createInvite(-100123L, Duration.ofHours(24), 1);

    assertThat(h.link()).isEqualTo("https://t.me/+AbC");
    assertThat(h.expiresAt()).isEqualTo(Instant.ofEpochSecond(expire));
    assertThat(h.memberLimit()).isEqualTo(1);
    wireMock.verify(postRequestedFor(urlEqualTo(PREFIX + "createChatInviteLink"))
        .withRequestBody(equalToJson("{\"chat_id\":-100123,\"member_limit\":1,\"expire_date\":" + expire + "}",
            true, true)));
  }
}
