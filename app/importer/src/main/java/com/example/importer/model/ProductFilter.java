package com.example.importer.model;

/** 商品一覧の絞り込み条件。文字列は部分一致(大文字小文字無視)、null は条件なし。 */
public record ProductFilter(String sku, String name, String description, Boolean active) {

  public static ProductFilter none() {
    return new ProductFilter(null, null, null, null);
  }
}
