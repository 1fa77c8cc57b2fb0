package com.vipgate.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Minimal Bot API client: only the calls the reconciler needs.
 *
 * Every call is a JSON POST to {@code {baseUrl}/bot{token}/{method}} bounded by the configured
 * connect/read/write timeouts. Plain text only (no parse_mode).
 */
public class TelegramBotApi {

  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

  private final String baseUrl;
  private final String botToken;
  private final ObjectMapper om;
  private final OkHttpClient http;

  public TelegramBotApi(String baseUrl, String botToken, Duration timeout, ObjectMapper om) {
    if (botToken == null || botToken.isBlank()) {
      throw new IllegalArgumentException("Telegram bot token is required");
    }
    this.baseUrl = stripTrailingSlash(Objects.requireNonNullElse(baseUrl, "https://api.telegram.org"));
    this.botToken = botToken.trim();
    this.om = om == null ? new ObjectMapper() : om;
    long ms = (timeout == null ? Duration.ofSeconds(10) : timeout).toMillis();
    this.http = new OkHttpClient.Builder()
        .connectTimeout(ms, TimeUnit.MILLISECONDS)
        .readTimeout(ms, TimeUnit.MILLISECONDS)
        .writeTimeout(ms, TimeUnit.MILLISECONDS)
        .build();
  }

  public void banChatMember(long chatId, long userId) throws IOException {
    ObjectNode body = om.createObjectNode();
    body.put("chat_id", chatId);
    body.put("user_id", userId);
    body.put("revoke_messages", false);
    call("banChatMember", body);
  }

  /**
   * With {@code only_if_banned} this lifts the ban without touching users who never joined.
   */
  public void unbanChatMember(long chatId, long userId) throws IOException {
    ObjectNode body = om.createObjectNode();
    body.put("chat_id", chatId);
    body.put("user_id", userId);
    body.put("only_if_banned", true);
    call("unbanChatMember", body);
  }

  /**
   * @return the created link object ({@code invite_link}, {@code expire_date}, {@code member_limit})
   */
  public JsonNode createChatInviteLink(long chatId, Instant expireAt, int memberLimit, String name) throws IOException {
    ObjectNode body = om.createObjectNode();
    body.put("chat_id", chatId);
    if (expireAt != null) body.put("expire_date", expireAt.getEpochSecond());
    if (memberLimit > 0) body.put("member_limit", memberLimit);
    if (name != null) body.put("name", name);
    return call("createChatInviteLink", body);
  }

  public JsonNode sendMessage(long chatId, String text) throws IOException {
    ObjectNode body = om.createObjectNode();
    body.put("chat_id", chatId);
    body.put("text", text);
    body.put("disable_web_page_preview", true);
    return call("sendMessage", body);
  }

  JsonNode call(String method, ObjectNode payload) throws IOException {
    Request request = new Request.Builder()
        .url(baseUrl + "/bot" + botToken + "/" + method)
        .post(RequestBody.create(om.writeValueAsString(payload), JSON))
        .build();

    try (Response resp = http.newCall(request).execute()) {
      ResponseBody rb = resp.body();
      String raw = rb == null ? "" : rb.string();

      JsonNode root;
      try {
        root = raw.isBlank() ? null : om.readTree(raw);
      } catch (IOException e) {
        throw new TelegramApiException(resp.code(), "unreadable response for " + method);
      }

      if (root == null || !root.path("ok").asBoolean(false)) {
        int code = root == null ? resp.code() : root.path("error_code").asInt(resp.code());
        String description = root == null ? "HTTP " + resp.code() : root.path("description").asText("no description");
        throw new TelegramApiException(code, description);
      }
      return root.path("result");
    }
  }

  private static String stripTrailingSlash(String url) {
    String u = url.trim();
    return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
  }
}
