/*
 * どこで: Importer 商品サービス
 * 何を: 単票の商品作成/更新/削除/参照を行い、product.* イベントを発行する
 * なぜ: CSV 取込と同じ upsert / delete プリミティブだけで products を変更するため
 */
package com.example.importer.product;

import com.example.importer.model.ProductFilter;
import com.example.importer.model.ProductRecord;
import com.example.importer.model.ProductRow;
import com.example.importer.model.WebhookEventType;
import com.example.importer.repository.ProductRepository;
import com.example.importer.webhook.WebhookEventPublisher;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ProductService {

  private static final Logger logger = LoggerFactory.getLogger(ProductService.class);
  static final int MAX_PAGE_SIZE = 100;
  static final int MAX_TEXT_LENGTH = 255;

  private final ProductRepository productRepository;
  private final WebhookEventPublisher webhookEventPublisher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public ProductPage list(ProductFilter filter, int page, int pageSize) {
    if (page < 1) {
      throw new InvalidProductException("page must be >= 1");
    }
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw new InvalidProductException("page_size must be between 1 and " + MAX_PAGE_SIZE);
    }
    final List<ProductRecord> items =
        productRepository.findPage(filter, pageSize, (long) (page - 1) * pageSize);
    return new ProductPage(items, productRepository.count(filter), page, pageSize);
  }

  public ProductRecord get(long productId) {
    return productRepository
        .findById(productId)
        .orElseThrow(() -> new ProductNotFoundException(productId));
  }

  public ProductRecord create(String sku, String name, String description, Boolean active) {
    final ProductRow row =
        new ProductRow(
            requireText("sku", sku), requireText("name", name), description, active == null || active);
    final ProductRecord created =
        transactionTemplate.execute(
            status -> {
              if (productRepository.findBySku(row.sku()).isPresent()) {
                throw new ProductConflictException(row.sku());
              }
              productRepository.upsertAll(List.of(row), Instant.now(clock));
              return productRepository
                  .findBySku(row.sku())
                  .orElseThrow(() -> new IllegalStateException("created product not found"));
            });
    logger.info("product created id={} sku={}", created.id(), created.sku());
    webhookEventPublisher.publish(WebhookEventType.PRODUCT_CREATED, eventData(created));
    return created;
  }

  /**
   * sku は変更できない(大文字小文字の違いのみ許容)。null の項目は現在値を維持する。
   */
  public ProductRecord update(
      long productId, String sku, String name, String description, Boolean active) {
    final ProductRecord updated =
        transactionTemplate.execute(
            status -> {
              final ProductRecord current = get(productId);
              if (sku != null && !requireText("sku", sku).equalsIgnoreCase(current.sku())) {
                throw new InvalidProductException("sku cannot be changed");
              }
              final ProductRow row =
                  new ProductRow(
                      current.sku(),
                      name == null ? current.name() : requireText("name", name),
                      description == null ? current.description() : description,
                      active == null ? current.active() : active);
              productRepository.upsertAll(List.of(row), Instant.now(clock));
              return get(productId);
            });
    logger.info("product updated id={} sku={}", updated.id(), updated.sku());
    webhookEventPublisher.publish(WebhookEventType.PRODUCT_UPDATED, eventData(updated));
    return updated;
  }

  public void delete(long productId) {
    final ProductRecord deleted =
        transactionTemplate.execute(
            status -> {
              final ProductRecord current = get(productId);
              if (productRepository.deleteByIds(List.of(productId)) == 0) {
                throw new ProductNotFoundException(productId);
              }
              return current;
            });
    logger.info("product deleted id={} sku={}", deleted.id(), deleted.sku());
    webhookEventPublisher.publish(WebhookEventType.PRODUCT_DELETED, eventData(deleted));
  }

  private String requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidProductException(field + " is required");
    }
    final String trimmed = value.strip();
    if (trimmed.length() > MAX_TEXT_LENGTH) {
      throw new InvalidProductException(field + " must be at most " + MAX_TEXT_LENGTH + " characters");
    }
    return trimmed;
  }

  private Map<String, Object> eventData(ProductRecord product) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("id", product.id());
    data.put("sku", product.sku());
    data.put("name", product.name());
    data.put("description", product.description());
    data.put("active", product.active());
    return data;
  }
}
