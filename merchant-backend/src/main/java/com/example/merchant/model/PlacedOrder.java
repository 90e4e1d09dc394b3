package com.example.merchant.model;

import java.util.List;

public record PlacedOrder(Order order, List<OrderItem> items) {

    public PlacedOrder {
        items = List.copyOf(items);
    }

}
