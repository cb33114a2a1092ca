package com.example.importer.product;

public class ProductNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ProductNotFoundException(long productId) {
    super("Product with ID " + productId + " not found");
  }
}
