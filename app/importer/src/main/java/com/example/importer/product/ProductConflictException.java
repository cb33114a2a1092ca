package com.example.importer.product;

/** 大文字小文字を無視して同じ sku の商品が既にある場合(409)。 */
public class ProductConflictException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ProductConflictException(String sku) {
    super("Product with SKU '" + sku + "' already exists");
  }
}
