package com.example.merchant.controller;

import com.example.merchant.exception.CheckoutException;
import com.example.merchant.model.AddCartItemRequest;
import com.example.merchant.model.Cart;
import com.example.merchant.model.CartItem;
import com.example.merchant.service.CartService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/cart")
public class CartController {

    private static final Logger logger = LoggerFactory.getLogger(CartController.class);

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> createCart() {
        Cart cart = cartService.createCart();
        return ResponseEntity.status(HttpStatus.CREATED).body(toJson(cart));
    }

    @GetMapping(value = "/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getCart(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(toJson(cartService.requireCart(sessionId)));
        } catch (CheckoutException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping(value = "/{sessionId}/items",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> addItem(@PathVariable String sessionId,
                                                       @RequestBody AddCartItemRequest request) {
        try {
            Cart cart = cartService.addItem(sessionId, request.productId(), request.quantity());
            return ResponseEntity.ok(toJson(cart));
        } catch (CheckoutException e) {
            logger.info("Cannot add to cart {}: {}", sessionId, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    static List<Map<String, Object>> itemsJson(List<CartItem> items) {
        return items.stream().map(item -> {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("product_id", item.productId());
            json.put("product_name", item.productName());
            json.put("quantity", item.quantity());
            json.put("unit_price", item.unitPrice());
            json.put("total_price", item.lineTotal());
            return json;
        }).toList();
    }

    private static Map<String, Object> toJson(Cart cart) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("session_id", cart.sessionId());
        json.put("items", itemsJson(cart.items()));
        json.put("subtotal", cart.items().stream()
                .map(CartItem::lineTotal)
                .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add));
        return json;
    }

}
