package com.example.merchant.service;

import com.example.merchant.config.FacilitatorProperties;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Signs settlement requests so the facilitator can tell they come from this merchant:
 * hex HMAC-SHA256 over {@code <merchantId>:<cartId>:<total>}, total with two decimals.
 */
@Component
public class MerchantSignatureGenerator {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final FacilitatorProperties properties;

    public MerchantSignatureGenerator(FacilitatorProperties properties) {
        this.properties = properties;
    }

    public String sign(String cartId, BigDecimal total) {
        String merchantId = properties.getMerchant().getId();
        String data = merchantId + ":" + cartId + ":" + total.setScale(2, RoundingMode.HALF_UP).toPlainString();
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(properties.getMerchant().getSecret().getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return Hex.toHexString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

}
