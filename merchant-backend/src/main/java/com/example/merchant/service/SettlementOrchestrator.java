package com.example.merchant.service;

import com.example.merchant.config.FacilitatorProperties;
import com.example.merchant.exception.FacilitatorUnreachableException;
import com.example.merchant.exception.InvalidPaymentFieldsException;
import com.example.merchant.exception.InvalidRequestException;
import com.example.merchant.exception.OrderNotRecordedException;
import com.example.merchant.exception.SessionNotFoundException;
import com.example.merchant.exception.SettlementDeniedException;
import com.example.merchant.model.Address;
import com.example.merchant.model.CardCheckoutResult;
import com.example.merchant.model.CardDetails;
import com.example.merchant.model.CardPaymentResult;
import com.example.merchant.model.Cart;
import com.example.merchant.model.ChargeQuote;
import com.example.merchant.model.CustomerInfo;
import com.example.merchant.model.DelegatedCheckoutRequest;
import com.example.merchant.model.DelegatedCheckoutResult;
import com.example.merchant.model.FinalizeRequest;
import com.example.merchant.model.FulfillRequest;
import com.example.merchant.model.PaymentSession;
import com.example.merchant.model.PlacedOrder;
import com.example.merchant.model.SettlementReceipt;
import com.example.merchant.model.SettlementRequest;
import com.example.merchant.model.SettlementResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives a cart from finalize to a placed order.
 * <p>
 * Card checkout is two calls: {@link #finalizeCart} prices the cart and parks it in a payment
 * session, {@link #fulfill} consumes the session and charges the card. Delegated checkout settles
 * an agent's delegation token with the Payment Facilitator in a single call.
 * In both paths the order is written only after payment is confirmed.
 */
@Service
public class SettlementOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SettlementOrchestrator.class);

    private final CartService cartService;
    private final ChargeCalculator chargeCalculator;
    private final PaymentSessionStore sessionStore;
    private final CardValidator cardValidator;
    private final CardPaymentProcessor cardPaymentProcessor;
    private final PaymentFacilitatorClient facilitatorClient;
    private final MerchantSignatureGenerator signatureGenerator;
    private final OrderService orderService;
    private final FacilitatorProperties facilitatorProperties;

    public SettlementOrchestrator(CartService cartService,
                                  ChargeCalculator chargeCalculator,
                                  PaymentSessionStore sessionStore,
                                  CardValidator cardValidator,
                                  CardPaymentProcessor cardPaymentProcessor,
                                  PaymentFacilitatorClient facilitatorClient,
                                  MerchantSignatureGenerator signatureGenerator,
                                  OrderService orderService,
                                  FacilitatorProperties facilitatorProperties) {
        this.cartService = cartService;
        this.chargeCalculator = chargeCalculator;
        this.sessionStore = sessionStore;
        this.cardValidator = cardValidator;
        this.cardPaymentProcessor = cardPaymentProcessor;
        this.facilitatorClient = facilitatorClient;
        this.signatureGenerator = signatureGenerator;
        this.orderService = orderService;
        this.facilitatorProperties = facilitatorProperties;
    }

    /**
     * Price the cart and open a payment session for it. The cart itself is left untouched.
     */
    public PaymentSession finalizeCart(String cartSessionId, FinalizeRequest request) {
        Address shipping = request.shippingAddress();
        if (shipping == null || !shipping.isComplete()) {
            throw new InvalidRequestException("A complete shipping_address is required");
        }
        CustomerInfo customer = request.customerInfo();
        if (customer == null || isBlank(customer.name()) || isBlank(customer.email())) {
            throw new InvalidRequestException("customer_info with name and email is required");
        }
        Address billing = request.billingAddress() != null ? request.billingAddress() : shipping;
        if (!billing.isComplete()) {
            throw new InvalidRequestException("billing_address is incomplete");
        }

        Cart cart = cartService.requireCheckoutCart(cartSessionId);
        ChargeQuote quote = chargeCalculator.quote(cart.items(), shipping, request.couponCode());
        PaymentSession session = sessionStore.create(cartSessionId, cart.items(), quote, shipping, billing,
                customer, request.couponCode());

        logger.info("Finalized cart {}: total {} {}, payment session {} expires {}",
                cartSessionId, quote.total(), quote.currency(), session.sessionId(), session.expiresAt());
        return session;
    }

    /**
     * Pay a finalized cart by card. The payment session is consumed before the card is checked,
     * so any failure after that point needs a new finalize.
     */
    public CardCheckoutResult fulfill(String cartSessionId, FulfillRequest request) {
        List<String> missing = missingPaymentFields(request);
        if (!missing.isEmpty()) {
            throw new InvalidPaymentFieldsException("Missing required payment fields: " + String.join(", ", missing));
        }

        Cart cart = cartService.requireCart(cartSessionId);

        PaymentSession session = parseSessionId(request.paymentSessionId())
                .flatMap(sessionStore::consume)
                .orElseThrow(SessionNotFoundException::new);
        if (!session.cartSessionId().equals(cartSessionId)) {
            logger.warn("⚠️Payment session {} belongs to cart {}, not {}",
                    session.sessionId(), session.cartSessionId(), cartSessionId);
            throw new SessionNotFoundException();
        }

        CardDetails card = cardValidator.validate(request);
        CardPaymentResult payment = cardPaymentProcessor.processCard(card, session.quote().total(), session.quote().currency());

        PlacedOrder placed = orderService.placeCardOrder(cart, session, payment);
        return new CardCheckoutResult(placed, payment, orderService.newTrackingNumber());
    }

    /**
     * Settle the cart with an agent's delegation token and place the order.
     * A refused or failed settlement leaves the cart as it was. A successful settlement is recorded
     * on the cart before the order is written, and a cart carrying one is never settled again.
     */
    public DelegatedCheckoutResult checkoutWithDelegation(String cartSessionId, DelegatedCheckoutRequest request) {
        if (request == null || isBlank(request.delegationToken()) || isBlank(request.agentId())) {
            throw new InvalidRequestException("delegation_token and agent_id are required");
        }

        SettlementState state = SettlementState.CART;
        Cart cart = cartService.requireCheckoutCart(cartSessionId);
        cartService.requireUnsettled(cart);

        ChargeQuote quote = chargeCalculator.delegatedQuote(cart.items());
        state = state.moveTo(SettlementState.QUOTED);

        SettlementRequest settlementRequest = new SettlementRequest(
                request.delegationToken(),
                facilitatorProperties.getMerchant().getId(),
                facilitatorProperties.getMerchant().getName(),
                cartSessionId,
                quote.total(),
                quote.currency(),
                cart.items().stream()
                        .map(item -> new SettlementRequest.Item(item.productId(), item.productName(),
                                item.quantity(), item.unitPrice()))
                        .toList(),
                signatureGenerator.sign(cartSessionId, quote.total())
        );

        state = state.moveTo(SettlementState.SETTLEMENT_REQUESTED);
        logger.info("Requesting settlement of {} {} for cart {} on behalf of agent {}",
                quote.total(), quote.currency(), cartSessionId, request.agentId());

        SettlementResponse settlement;
        try {
            settlement = facilitatorClient.settle(settlementRequest);
            state = state.moveTo(SettlementState.SETTLED);
        } catch (SettlementDeniedException e) {
            state = state.moveTo(SettlementState.SETTLEMENT_DENIED);
            logger.warn("⚠️Cart {} ended in {} (facilitator status {})", cartSessionId, state, e.getFacilitatorStatus());
            throw e;
        } catch (FacilitatorUnreachableException e) {
            state = state.moveTo(SettlementState.FACILITATOR_UNREACHABLE);
            logger.warn("⚠️Cart {} ended in {}", cartSessionId, state);
            throw e;
        }

        SettlementReceipt receipt = settlement.transactionReceipt();
        PlacedOrder placed;
        try {
            cartService.recordSettlement(cart, receipt);
            placed = placeIfSettled(state, cart, quote, request.agentId(), settlement);
        } catch (RuntimeException e) {
            logger.error("❌Cart {} settled for {} {} under receipt {} (transaction {}, agent {}) but the order was not recorded",
                    cartSessionId, quote.total(), quote.currency(), receipt.receiptId(), receipt.transactionId(),
                    request.agentId(), e);
            throw new OrderNotRecordedException(receipt.receiptId(), e);
        }
        logger.info("Cart {} settled: receipt {} via {}", cartSessionId,
                receipt.receiptId(), receipt.paymentRailUsed());
        return new DelegatedCheckoutResult(placed, settlement, request.agentId(), orderService.newTrackingNumber());
    }

    private PlacedOrder placeIfSettled(SettlementState state, Cart cart, ChargeQuote quote, String agentId,
                                       SettlementResponse settlement) {
        if (state != SettlementState.SETTLED) {
            throw new IllegalStateException("Cannot place an order in state " + state);
        }
        return orderService.placeDelegatedOrder(cart, quote, agentId, settlement.transactionReceipt());
    }

    private static List<String> missingPaymentFields(FulfillRequest request) {
        List<String> missing = new ArrayList<>();
        if (request == null) {
            return List.of("payment_session_id", "card_number", "expiry_date", "cvv", "cardholder_name");
        }
        if (isBlank(request.paymentSessionId())) {
            missing.add("payment_session_id");
        }
        if (isBlank(request.cardNumber())) {
            missing.add("card_number");
        }
        if (isBlank(request.expiryDate())) {
            missing.add("expiry_date");
        }
        if (isBlank(request.cvv())) {
            missing.add("cvv");
        }
        if (isBlank(request.cardholderName())) {
            missing.add("cardholder_name");
        }
        return missing;
    }

    private static Optional<UUID> parseSessionId(String value) {
        try {
            return Optional.of(UUID.fromString(value.strip()));
        } catch (IllegalArgumentException e) {
            logger.debug("Not a payment session id: {}", value);
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

}
