/*
 * どこで: Importer API
 * 何を: 商品の一覧/参照/作成/更新/削除エンドポイントを公開する
 * なぜ: CSV 取込と同じ書き込み経路を単票操作でも使えるようにするため
 */
package com.example.importer.api;

import com.example.importer.api.request.ProductCreateRequest;
import com.example.importer.api.request.ProductUpdateRequest;
import com.example.importer.api.response.ProductListResponse;
import com.example.importer.api.response.ProductResponse;
import com.example.importer.model.ProductFilter;
import com.example.importer.product.ProductService;
import jakarta.validation.Valid;
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
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

  private final ProductService productService;

  @GetMapping
  public ProductListResponse list(
      @RequestParam(name = "sku", required = false) String sku,
      @RequestParam(name = "name", required = false) String name,
      @RequestParam(name = "description", required = false) String description,
      @RequestParam(name = "active", required = false) Boolean active,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    final ProductFilter filter = new ProductFilter(sku, name, description, active);
    return ProductListResponse.from(productService.list(filter, page, pageSize));
  }

  @GetMapping("/{productId}")
  public ProductResponse get(@PathVariable("productId") long productId) {
    return ProductResponse.from(productService.get(productId));
  }

  @PostMapping
  public ResponseEntity<ProductResponse> create(@Valid @RequestBody ProductCreateRequest request) {
    final ProductResponse response =
        ProductResponse.from(
            productService.create(
                request.sku(), request.name(), request.description(), request.active()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @PutMapping("/{productId}")
  public ProductResponse update(
      @PathVariable("productId") long productId,
      @Valid @RequestBody ProductUpdateRequest request) {
    return ProductResponse.from(
        productService.update(
            productId, request.sku(), request.name(), request.description(), request.active()));
  }

  @DeleteMapping("/{productId}")
  public ResponseEntity<Void> delete(@PathVariable("productId") long productId) {
    productService.delete(productId);
    return ResponseEntity.noContent().build();
  }
}
