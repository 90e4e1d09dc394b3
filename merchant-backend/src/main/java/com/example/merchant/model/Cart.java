package com.example.merchant.model;

import java.util.List;

public record Cart(Long id, String sessionId, List<CartItem> items) {

    public Cart {
        items = List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

}
