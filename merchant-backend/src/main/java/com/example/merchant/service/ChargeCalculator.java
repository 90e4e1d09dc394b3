package com.example.merchant.service;

import com.example.merchant.config.PaymentProperties;
import com.example.merchant.model.Address;
import com.example.merchant.model.CartItem;
import com.example.merchant.model.ChargeQuote;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Prices a cart: subtotal, shipping, tax, coupon discount and total.
 * Every amount is rounded half-up to cents as soon as it is computed, and the total is the sum of
 * the rounded parts.
 */
@Component
public class ChargeCalculator {

    static final String COUPON_SAVE10 = "SAVE10";
    static final String COUPON_FREESHIP = "FREESHIP";

    private static final BigDecimal SAVE10_RATE = new BigDecimal("0.10");

    private final PaymentProperties properties;

    public ChargeCalculator(PaymentProperties properties) {
        this.properties = properties;
    }

    /**
     * Quote for the interactive checkout, which knows the destination and may carry a coupon.
     */
    public ChargeQuote quote(List<CartItem> items, Address shippingAddress, String couponCode) {
        BigDecimal subtotal = subtotal(items);
        boolean domestic = shippingAddress.country() != null
                && properties.getReferenceCountry().equalsIgnoreCase(shippingAddress.country().strip());

        BigDecimal shipping;
        if (domestic) {
            shipping = subtotal.compareTo(properties.getShipping().getFreeThreshold()) < 0
                    ? properties.getShipping().getDomestic()
                    : BigDecimal.ZERO;
        } else {
            shipping = properties.getShipping().getInternational();
        }

        BigDecimal tax = domestic ? subtotal.multiply(properties.getTax().getRate()) : BigDecimal.ZERO;

        BigDecimal discount = BigDecimal.ZERO;
        String coupon = couponCode == null ? "" : couponCode.strip().toUpperCase(Locale.ROOT);
        if (COUPON_SAVE10.equals(coupon)) {
            discount = subtotal.multiply(SAVE10_RATE);
        } else if (COUPON_FREESHIP.equals(coupon)) {
            shipping = BigDecimal.ZERO;
        }

        return build(subtotal, shipping, tax, discount);
    }

    /**
     * Quote for agent checkout with a delegation token: no address and no coupon, so shipping is
     * the flat delegated rate and tax the delegated rate.
     */
    public ChargeQuote delegatedQuote(List<CartItem> items) {
        BigDecimal subtotal = subtotal(items);
        BigDecimal tax = subtotal.multiply(properties.getTax().getDelegatedRate());
        return build(subtotal, properties.getShipping().getDelegated(), tax, BigDecimal.ZERO);
    }

    private BigDecimal subtotal(List<CartItem> items) {
        return items.stream()
                .map(CartItem::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private ChargeQuote build(BigDecimal subtotal, BigDecimal shipping, BigDecimal tax, BigDecimal discount) {
        BigDecimal s = cents(subtotal);
        BigDecimal sh = cents(shipping);
        BigDecimal t = cents(tax);
        BigDecimal d = cents(discount);
        BigDecimal total = s.add(sh).add(t).subtract(d).max(BigDecimal.ZERO.setScale(2));
        return new ChargeQuote(s, sh, t, d, cents(total), properties.getCurrency());
    }

    private static BigDecimal cents(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

}
