package com.example.importer.product;

import com.example.importer.model.ProductRecord;
import java.util.List;

public record ProductPage(List<ProductRecord> items, long total, int page, int pageSize) {

  public ProductPage {
    items = List.copyOf(items);
  }
}
