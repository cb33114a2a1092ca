package com.example.importer.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.importer.model.ProductFilter;
import com.example.importer.model.ProductRecord;
import com.example.importer.product.ProductConflictException;
import com.example.importer.product.ProductNotFoundException;
import com.example.importer.product.ProductPage;
import com.example.importer.product.ProductService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ProductController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class ProductControllerTest {

  private static final Instant NOW = Instant.parse("2026-01-12T00:00:00Z");
  private static final ProductRecord WIDGET =
      new ProductRecord(1L, "A1", "Widget", null, true, NOW, NOW);

  @Autowired private MockMvc mockMvc;

  @MockBean private ProductService productService;

  @Test
  void listPassesFiltersAndPaging() throws Exception {
    final ProductFilter filter = new ProductFilter("a1", null, null, true);
    when(productService.list(filter, 2, 10)).thenReturn(new ProductPage(List.of(WIDGET), 11L, 2, 10));

    mockMvc
        .perform(get("/api/products?sku=a1&active=true&page=2&page_size=10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].sku").value("A1"))
        .andExpect(jsonPath("$.total").value(11))
        .andExpect(jsonPath("$.page_size").value(10))
        .andExpect(jsonPath("$.total_pages").value(2));
  }

  @Test
  void createReturns201() throws Exception {
    when(productService.create("A1", "Widget", null, null)).thenReturn(WIDGET);

    mockMvc
        .perform(
            post("/api/products")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"sku":"A1","name":"Widget"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(1))
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void createWithoutSkuIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/products")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"Widget"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("sku is required"));
  }

  @Test
  void duplicateSkuReturns409() throws Exception {
    when(productService.create("a1", "Widget", null, null))
        .thenThrow(new ProductConflictException("a1"));

    mockMvc
        .perform(
            post("/api/products")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"sku":"a1","name":"Widget"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("PRODUCT_SKU_CONFLICT"));
  }

  @Test
  void missingProductReturns404() throws Exception {
    when(productService.get(9L)).thenThrow(new ProductNotFoundException(9L));

    mockMvc
        .perform(get("/api/products/9"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Product with ID 9 not found"));
  }

  @Test
  void deleteReturns204() throws Exception {
    mockMvc.perform(delete("/api/products/1")).andExpect(status().isNoContent());

    verify(productService).delete(1L);
  }
}
