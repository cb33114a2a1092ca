/*
 * どこで: Importer Webhook
 * 何を: Webhook 設定の CRUD と配信履歴の参照を提供する
 * なぜ: URL とイベント名の検証を 1 箇所に集め、不正な購読を保存しないため
 */
package com.example.importer.webhook;

import com.example.importer.model.Webhook;
import com.example.importer.model.WebhookDelivery;
import com.example.importer.model.WebhookEventType;
import com.example.importer.repository.WebhookDeliveryRepository;
import com.example.importer.repository.WebhookRepository;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WebhookService {

  private static final Logger logger = LoggerFactory.getLogger(WebhookService.class);
  static final int MAX_PAGE_SIZE = 100;

  private final WebhookRepository webhookRepository;
  private final WebhookDeliveryRepository deliveryRepository;
  private final Clock clock;

  public List<Webhook> list() {
    return webhookRepository.findAll();
  }

  public Webhook get(long webhookId) {
    return webhookRepository
        .findById(webhookId)
        .orElseThrow(() -> new WebhookNotFoundException(webhookId));
  }

  public Webhook create(String url, List<String> events, Boolean enabled) {
    final String normalizedUrl = normalizeUrl(url);
    final List<String> normalizedEvents = normalizeEvents(events);
    final long id =
        webhookRepository.insert(
            normalizedUrl, normalizedEvents, enabled == null || enabled, Instant.now(clock));
    logger.info("webhook created id={} events={}", id, normalizedEvents);
    return get(id);
  }

  /** null の項目は現在値を維持する。 */
  public Webhook update(long webhookId, String url, List<String> events, Boolean enabled) {
    final Webhook current = get(webhookId);
    final String nextUrl = url == null ? current.url() : normalizeUrl(url);
    final List<String> nextEvents = events == null ? current.events() : normalizeEvents(events);
    final boolean nextEnabled = enabled == null ? current.enabled() : enabled;
    final int updated =
        webhookRepository.update(webhookId, nextUrl, nextEvents, nextEnabled, Instant.now(clock));
    if (updated == 0) {
      throw new WebhookNotFoundException(webhookId);
    }
    logger.info("webhook updated id={} enabled={}", webhookId, nextEnabled);
    return get(webhookId);
  }

  public void delete(long webhookId) {
    if (webhookRepository.delete(webhookId) == 0) {
      throw new WebhookNotFoundException(webhookId);
    }
    logger.info("webhook deleted id={}", webhookId);
  }

  /**
   * 配信履歴を新しい順に返す。
   *
   * @param page 1 始まり
   * @param pageSize 1..100
   */
  public List<WebhookDelivery> deliveries(long webhookId, int page, int pageSize) {
    if (page < 1) {
      throw new InvalidWebhookException("page must be >= 1");
    }
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw new InvalidWebhookException("page_size must be between 1 and " + MAX_PAGE_SIZE);
    }
    get(webhookId);
    return deliveryRepository.findByWebhookId(
        webhookId, pageSize, (long) (page - 1) * pageSize);
  }

  private String normalizeUrl(String url) {
    if (url == null) {
      throw new InvalidWebhookException("url is required");
    }
    final String trimmed = url.strip();
    if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
      throw new InvalidWebhookException("URL must start with http:// or https://");
    }
    final URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new InvalidWebhookException("URL is malformed: " + ex.getReason());
    }
    // 送信時に URI.create へそのまま渡せる絶対 URL だけを保存する
    if (!uri.isAbsolute() || uri.getHost() == null || uri.getHost().isEmpty()) {
      throw new InvalidWebhookException("URL must be absolute with a host");
    }
    return trimmed;
  }

  private List<String> normalizeEvents(List<String> events) {
    if (events == null || events.isEmpty()) {
      throw new InvalidWebhookException("Events list cannot be empty");
    }
    final LinkedHashSet<String> unique = new LinkedHashSet<>();
    for (String event : events) {
      if (event == null || WebhookEventType.fromValue(event.strip()).isEmpty()) {
        throw new InvalidWebhookException("unknown event type: " + event);
      }
      unique.add(event.strip());
    }
    return new ArrayList<>(unique);
  }
}
