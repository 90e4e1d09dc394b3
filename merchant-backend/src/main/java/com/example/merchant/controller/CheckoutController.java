package com.example.merchant.controller;

import com.example.merchant.config.PaymentProperties;
import com.example.merchant.exception.CheckoutException;
import com.example.merchant.model.Address;
import com.example.merchant.model.CardCheckoutResult;
import com.example.merchant.model.ChargeQuote;
import com.example.merchant.model.DelegatedCheckoutRequest;
import com.example.merchant.model.DelegatedCheckoutResult;
import com.example.merchant.model.FinalizeRequest;
import com.example.merchant.model.FulfillRequest;
import com.example.merchant.model.Order;
import com.example.merchant.model.PaymentSession;
import com.example.merchant.model.SettlementReceipt;
import com.example.merchant.security.AgentAuthenticationToken;
import com.example.merchant.service.SettlementOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payment endpoints of the cart: finalize (answers 402 Payment Required), card fulfill and
 * agent checkout with an x402 delegation token.
 */
@RestController
@RequestMapping("/api/cart")
public class CheckoutController {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutController.class);

    static final String HEADER_PAYMENT_REQUIRED = "X-Payment-Required";
    static final String HEADER_PAYMENT_SESSION_ID = "X-Payment-Session-ID";
    static final String HEADER_PAYMENT_AMOUNT = "X-Payment-Amount";
    static final String HEADER_PAYMENT_CURRENCY = "X-Payment-Currency";
    static final String HEADER_PAYMENT_PROVIDER = "X-Payment-Provider";

    private static final List<String> CARD_REQUIRED_FIELDS =
            List.of("payment_session_id", "card_number", "expiry_date", "cvv", "cardholder_name");

    private final SettlementOrchestrator orchestrator;
    private final PaymentProperties paymentProperties;

    public CheckoutController(SettlementOrchestrator orchestrator, PaymentProperties paymentProperties) {
        this.orchestrator = orchestrator;
        this.paymentProperties = paymentProperties;
    }

    @PostMapping(value = "/{sessionId}/finalize",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> finalizeCart(@PathVariable String sessionId,
                                                            @RequestBody FinalizeRequest request) {
        PaymentSession session;
        try {
            session = orchestrator.finalizeCart(sessionId, request);
        } catch (CheckoutException e) {
            logger.info("Finalize of cart {} refused: {}", sessionId, e.getMessage());
            return ErrorResponses.of(e);
        } catch (Exception e) {
            logger.error("❌Error finalizing cart {}", sessionId, e);
            return ErrorResponses.serverError("An error occurred while finalizing the cart");
        }

        ChargeQuote quote = session.quote();
        String fulfillEndpoint = ServletUriComponentsBuilder.fromCurrentContextPath()
                .path("/api/cart/{sessionId}/fulfill")
                .buildAndExpand(sessionId)
                .toUriString();

        Map<String, Object> amount = new LinkedHashMap<>();
        amount.put("subtotal", quote.subtotal());
        amount.put("shipping", quote.shipping());
        amount.put("tax", quote.tax());
        amount.put("discount", quote.discount());
        amount.put("total", quote.total());
        amount.put("currency", quote.currency());

        Map<String, Object> cardMethod = new LinkedHashMap<>();
        cardMethod.put("type", Order.METHOD_CREDIT_CARD);
        cardMethod.put("provider", paymentProperties.getProvider());
        cardMethod.put("endpoint", fulfillEndpoint);
        cardMethod.put("method", "POST");
        cardMethod.put("required_fields", CARD_REQUIRED_FIELDS);

        Map<String, Object> customer = new LinkedHashMap<>();
        customer.put("name", session.customer().name());
        customer.put("email", session.customer().email());
        customer.put("phone", session.customer().phone());

        Map<String, Object> orderSummary = new LinkedHashMap<>();
        orderSummary.put("items", CartController.itemsJson(session.items()));
        orderSummary.put("shipping_address", addressJson(session.shippingAddress()));
        orderSummary.put("customer", customer);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Payment Required");
        body.put("message", "Cart finalized. Payment required to complete order.");
        body.put("payment_session_id", session.sessionId().toString());
        body.put("amount", amount);
        body.put("payment_methods", List.of(cardMethod));
        body.put("expires_at", session.expiresAt().toString());
        body.put("order_summary", orderSummary);

        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                .header(HEADER_PAYMENT_REQUIRED, "true")
                .header(HEADER_PAYMENT_SESSION_ID, session.sessionId().toString())
                .header(HEADER_PAYMENT_AMOUNT, quote.total().toPlainString())
                .header(HEADER_PAYMENT_CURRENCY, quote.currency())
                .header(HEADER_PAYMENT_PROVIDER, paymentProperties.getProvider())
                .body(body);
    }

    @PostMapping(value = "/{sessionId}/fulfill",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> fulfill(@PathVariable String sessionId,
                                                       @RequestBody FulfillRequest request) {
        CardCheckoutResult result;
        try {
            result = orchestrator.fulfill(sessionId, request);
        } catch (CheckoutException e) {
            logger.info("Fulfill of cart {} failed: {} ({})", sessionId, e.getErrorCode(), e.getMessage());
            return ErrorResponses.of(e);
        } catch (Exception e) {
            logger.error("❌Error fulfilling cart {}", sessionId, e);
            return ErrorResponses.serverError("An error occurred while processing the payment");
        }

        Order order = result.placed().order();
        Map<String, Object> orderJson = new LinkedHashMap<>();
        orderJson.put("id", order.id());
        orderJson.put("order_number", order.orderNumber());
        orderJson.put("status", order.status());
        orderJson.put("total_amount", order.totalAmount());
        orderJson.put("created_at", order.createdAt().toString());

        Map<String, Object> payment = new LinkedHashMap<>();
        payment.put("transaction_id", result.payment().transactionId());
        payment.put("provider_reference", result.payment().providerReference());
        payment.put("status", "completed");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "fulfilled");
        response.put("message", "Order completed successfully");
        response.put("order", orderJson);
        response.put("payment", payment);
        response.put("fulfillment", fulfillmentJson(result.trackingNumber(), null));
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/{sessionId}/x402/checkout",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> checkoutWithDelegation(@PathVariable String sessionId,
                                                                      @RequestBody DelegatedCheckoutRequest request,
                                                                      Authentication authentication) {
        if (authentication instanceof AgentAuthenticationToken agent) {
            logger.info("x402 checkout of cart {} by verified agent {} (keyId={})",
                    sessionId, agent.getAgentName(), agent.getKeyId());
        }

        DelegatedCheckoutResult result;
        try {
            result = orchestrator.checkoutWithDelegation(sessionId, request);
        } catch (CheckoutException e) {
            logger.info("x402 checkout of cart {} failed: {} ({})", sessionId, e.getErrorCode(), e.getMessage());
            return ErrorResponses.of(e);
        } catch (Exception e) {
            logger.error("❌Error in x402 checkout of cart {}", sessionId, e);
            return ErrorResponses.serverError("An error occurred while settling the payment");
        }

        Order order = result.placed().order();
        Map<String, Object> orderJson = new LinkedHashMap<>();
        orderJson.put("id", order.id());
        orderJson.put("order_number", order.orderNumber());
        orderJson.put("customer_name", order.customerName());
        orderJson.put("customer_email", order.customerEmail());
        orderJson.put("total_amount", order.totalAmount());
        orderJson.put("subtotal", order.subtotal());
        orderJson.put("tax_amount", order.taxAmount());
        orderJson.put("shipping_cost", order.shippingCost());
        orderJson.put("status", order.status());
        orderJson.put("payment_method", order.paymentMethod());
        orderJson.put("payment_status", order.paymentStatus());
        orderJson.put("created_at", order.createdAt().toString());
        orderJson.put("items", result.placed().items().stream().map(item -> {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("product_id", item.productId());
            line.put("product_name", item.productName());
            line.put("quantity", item.quantity());
            line.put("unit_price", item.price());
            line.put("total_price", item.price().multiply(BigDecimal.valueOf(item.quantity())));
            return line;
        }).toList());

        SettlementReceipt receipt = result.settlement().transactionReceipt();
        Map<String, Object> payment = new LinkedHashMap<>();
        payment.put("method", order.paymentMethod());
        payment.put("receipt_id", receipt.receiptId());
        payment.put("transaction_id", receipt.transactionId());
        payment.put("payment_rail", receipt.paymentRailUsed());
        payment.put("amount_charged", receipt.amount());
        payment.put("processing_fee", receipt.processingFee());
        payment.put("net_amount", receipt.netAmount());
        payment.put("status", "completed");

        Map<String, Object> delegation = new LinkedHashMap<>();
        delegation.put("remaining_limit", result.settlement().remainingDelegationLimit());
        delegation.put("agent_id", result.agentId());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "x402 checkout completed successfully");
        response.put("order", orderJson);
        response.put("payment", payment);
        response.put("delegation", delegation);
        response.put("fulfillment", fulfillmentJson(result.trackingNumber(), "processing"));
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> fulfillmentJson(String trackingNumber, String status) {
        Map<String, Object> fulfillment = new LinkedHashMap<>();
        if (status != null) {
            fulfillment.put("status", status);
        }
        fulfillment.put("tracking_number", trackingNumber);
        fulfillment.put("estimated_delivery", "5-7 business days");
        fulfillment.put("shipping_carrier", "Standard Shipping");
        return fulfillment;
    }

    private static Map<String, Object> addressJson(Address address) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("street", address.street());
        json.put("city", address.city());
        json.put("state", address.state());
        json.put("zip", address.zip());
        json.put("country", address.country());
        return json;
    }

}
