package com.example.importer.api.response;

import com.example.importer.product.ProductPage;
import java.util.List;

public record ProductListResponse(
    List<ProductResponse> items, long total, int page, int pageSize, long totalPages) {

  public static ProductListResponse from(ProductPage page) {
    final long totalPages = (page.total() + page.pageSize() - 1) / page.pageSize();
    return new ProductListResponse(
        page.items().stream().map(ProductResponse::from).toList(),
        page.total(),
        page.page(),
        page.pageSize(),
        totalPages);
  }
}
