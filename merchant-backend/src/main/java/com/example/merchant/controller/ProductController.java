package com.example.merchant.controller;

import com.example.merchant.model.Product;
import com.example.merchant.repository.ProductRepository;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductRepository productRepository;

    public ProductController(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> listProducts(@RequestParam(required = false) String category) {
        List<Map<String, Object>> products = productRepository.findAll(category).stream()
                .map(ProductController::toJson)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("products", products);
        response.put("total", products.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/{productId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getProduct(@PathVariable Long productId) {
        return productRepository.findById(productId)
                .map(product -> ResponseEntity.ok(toJson(product)))
                .orElseGet(() -> ErrorResponses.of(HttpStatus.NOT_FOUND, "product_not_found",
                        "Product not found: " + productId));
    }

    static Map<String, Object> toJson(Product product) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", product.id());
        json.put("name", product.name());
        json.put("description", product.description());
        json.put("price", product.price());
        json.put("category", product.category());
        json.put("image_url", product.imageUrl());
        json.put("stock_quantity", product.stockQuantity());
        json.put("created_at", product.createdAt() != null ? product.createdAt().toString() : null);
        return json;
    }

}
