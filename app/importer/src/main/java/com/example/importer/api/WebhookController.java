/*
 * どこで: Importer API
 * 何を: Webhook の CRUD、同期テスト、配信履歴のエンドポイントを公開する
 * なぜ: 連携先の登録から疎通確認、配信結果の確認までを API で完結させるため
 */
package com.example.importer.api;

import com.example.importer.api.request.WebhookCreateRequest;
import com.example.importer.api.request.WebhookUpdateRequest;
import com.example.importer.api.response.WebhookDeliveryResponse;
import com.example.importer.api.response.WebhookResponse;
import com.example.importer.api.response.WebhookTestResponse;
import com.example.importer.webhook.WebhookService;
import com.example.importer.webhook.WebhookTestService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

  private final WebhookService webhookService;
  private final WebhookTestService webhookTestService;

  @GetMapping
  public List<WebhookResponse> list() {
    return webhookService.list().stream().map(WebhookResponse::from).toList();
  }

  @GetMapping("/{webhookId}")
  public WebhookResponse get(@PathVariable("webhookId") long webhookId) {
    return WebhookResponse.from(webhookService.get(webhookId));
  }

  @PostMapping
  public ResponseEntity<WebhookResponse> create(@Valid @RequestBody WebhookCreateRequest request) {
    final WebhookResponse response =
        WebhookResponse.from(
            webhookService.create(request.url(), request.events(), request.enabled()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @PutMapping("/{webhookId}")
  public WebhookResponse update(
      @PathVariable("webhookId") long webhookId, @RequestBody WebhookUpdateRequest request) {
    return WebhookResponse.from(
        webhookService.update(webhookId, request.url(), request.events(), request.enabled()));
  }

  @DeleteMapping("/{webhookId}")
  public ResponseEntity<Void> delete(@PathVariable("webhookId") long webhookId) {
    webhookService.delete(webhookId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{webhookId}/test")
  public WebhookTestResponse test(@PathVariable("webhookId") long webhookId) {
    return WebhookTestResponse.from(webhookTestService.test(webhookId));
  }

  @GetMapping("/{webhookId}/deliveries")
  public List<WebhookDeliveryResponse> deliveries(
      @PathVariable("webhookId") long webhookId,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "50") int pageSize) {
    return webhookService.deliveries(webhookId, page, pageSize).stream()
        .map(WebhookDeliveryResponse::from)
        .toList();
  }
}
