package com.example.merchant.controller;

import com.example.merchant.model.Order;
import com.example.merchant.model.PlacedOrder;
import com.example.merchant.service.OrderService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @GetMapping(value = "/{orderNumber}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getOrder(@PathVariable String orderNumber) {
        return orderService.findByOrderNumber(orderNumber)
                .map(placed -> ResponseEntity.ok(toJson(placed)))
                .orElseGet(() -> ErrorResponses.of(HttpStatus.NOT_FOUND, "order_not_found",
                        "Order not found: " + orderNumber));
    }

    private static Map<String, Object> toJson(PlacedOrder placed) {
        Order order = placed.order();
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", order.id());
        json.put("order_number", order.orderNumber());
        json.put("customer_name", order.customerName());
        json.put("customer_email", order.customerEmail());
        json.put("phone", order.phone());
        json.put("shipping_address", order.shippingAddress());
        json.put("billing_address", order.billingAddress());
        json.put("subtotal", order.subtotal());
        json.put("shipping_cost", order.shippingCost());
        json.put("tax_amount", order.taxAmount());
        json.put("discount_amount", order.discountAmount());
        json.put("total_amount", order.totalAmount());
        json.put("status", order.status());
        json.put("created_at", order.createdAt().toString());

        Map<String, Object> payment = new LinkedHashMap<>();
        payment.put("method", order.paymentMethod());
        payment.put("status", order.paymentStatus());
        payment.put("transaction_id", order.transactionId());
        if (Order.METHOD_CREDIT_CARD.equals(order.paymentMethod())) {
            payment.put("card_brand", order.cardBrand());
            payment.put("card_last_four", order.cardLastFour());
            payment.put("provider_reference", order.providerReference());
        } else {
            payment.put("receipt_id", order.receiptId());
            payment.put("payment_rail", order.paymentRail());
            payment.put("processing_fee", order.processingFee());
            payment.put("net_amount", order.netAmount());
        }
        json.put("payment", payment);

        json.put("items", placed.items().stream().map(item -> {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("product_id", item.productId());
            line.put("product_name", item.productName());
            line.put("quantity", item.quantity());
            line.put("price", item.price());
            return line;
        }).toList());
        return json;
    }

}
