package com.example.merchant.security;

import com.example.merchant.config.AgentTrustProperties;
import com.example.signature.SignatureAlgorithm;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrustedAgentKeyLoaderTest {

    private static final String DEMO_RSA_PUBLIC_KEY = """
            -----BEGIN PUBLIC KEY-----
            MIIBIjANBgkqhkiG9w0BAQEFAAOCAQ8AMIIBCgKCAQEAysHJFJ9uoVvU1sH2x3TV
            bwW3nfyp34eOb8w177Ei/Bx8pk+8Ibu1yulV0nCBl/c9insg1k2x7dw1jRDZHJBG
            wIpCdRL0GKm6qIdtsjeOcMnkI5ET0zGpxkhuRUwRblYW3LAdAq1Gja1WSPQKRT8r
            EhUsmSlDWgAf0rFna15Ok6zOO3q21LtrEjnJSrgO+cr33YH0IAdALD7hqtPYK7+/
            7dD/XIgGW9cX0USMxdDBUt8TnN2TYar5YXetpMnFOPpQHiGpKTkDwrRggcthUyuC
            e1CoL/9a/DWilJwd481QkurvZqGaKegX5DlI+jLNvfi8TWMS3jCjknyOLg54KU86
            LQIDAQAB
            -----END PUBLIC KEY-----
            """;

    private final TrustedAgentKeyLoader loader = new TrustedAgentKeyLoader();

    private static AgentTrustProperties.Agent agent(String identifier, String algorithm, String publicKey) {
        AgentTrustProperties.Agent agent = new AgentTrustProperties.Agent();
        agent.setIdentifier(identifier);
        agent.setName("Example Directory");
        agent.setAlgorithm(algorithm);
        agent.setPublicKey(publicKey);
        return agent;
    }

    @Test
    void loadsConfiguredRsaAgent() {
        List<TrustedAgentKey> keys = loader.load(List.of(
                agent("https://directory.example.com", "rsa-pss-sha256", DEMO_RSA_PUBLIC_KEY)));

        assertEquals(1, keys.size());
        assertEquals(SignatureAlgorithm.RSA_PSS_SHA256, keys.get(0).algorithm());
        assertEquals("Example Directory", keys.get(0).displayName());
    }

    @Test
    void failsOnUnsupportedAlgorithm() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.load(List.of(
                agent("https://directory.example.com", "hmac-sha256", DEMO_RSA_PUBLIC_KEY))));

        assertTrue(e.getMessage().contains("hmac-sha256"));
    }

    @Test
    void failsOnKeyOfTheWrongType() {
        assertThrows(IllegalStateException.class, () -> loader.load(List.of(
                agent("https://directory.example.com", "ed25519", DEMO_RSA_PUBLIC_KEY))));
    }

    @Test
    void failsOnMissingIdentifier() {
        assertThrows(IllegalStateException.class, () -> loader.load(List.of(
                agent(" ", "rsa-pss-sha256", DEMO_RSA_PUBLIC_KEY))));
    }

}
