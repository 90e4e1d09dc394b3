package com.example.agent.client;

import com.example.agent.config.AgentProperties;
import com.example.agent.signer.AgentRequestSigner;
import com.example.signature.DecodedSignature;
import com.example.signature.RequestComponents;
import com.example.signature.SignatureAlgorithm;
import com.example.signature.SignatureCodec;
import com.example.signature.SignatureContext;
import com.example.signature.SignatureHeaders;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.verification.LoggedRequest;
import org.junit.jupiter.api.*;
import org.springframework.web.client.RestClient;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

class MerchantClientTest {

    static WireMockServer wm;
    static KeyPair keys;

    MerchantClient client;

    @BeforeAll
    static void startServer() throws Exception {
        wm = new WireMockServer(0);
        wm.start();
        keys = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    }

    @AfterAll
    static void stopServer() {
        wm.stop();
    }

    @BeforeEach
    void setUp() {
        wm.resetAll();
        AgentProperties properties = new AgentProperties();
        properties.setMerchantBaseUrl("http://localhost:" + wm.port());
        AgentRequestSigner signer = new AgentRequestSigner("https://agent.example.org", "k1", SignatureAlgorithm.ED25519,
                keys.getPrivate(), Duration.ofMinutes(8), Clock.systemUTC());
        client = new MerchantClient(RestClient.builder(), signer, properties);
    }

    private static void assertSignedFor(LoggedRequest request, String path, String tag) throws Exception {
        SignatureHeaders headers = new SignatureHeaders(
                request.getHeader(SignatureHeaders.SIGNATURE_AGENT),
                request.getHeader(SignatureHeaders.SIGNATURE_INPUT),
                request.getHeader(SignatureHeaders.SIGNATURE));
        DecodedSignature decoded = SignatureCodec.decode(headers);

        assertEquals("https://agent.example.org", decoded.context().agentIdentifier());
        assertEquals(tag, decoded.context().tag());
        assertTrue(SignatureAlgorithm.ED25519.verify(keys.getPublic(),
                SignatureCodec.signatureBase(decoded.context(),
                        RequestComponents.of(request.getHeader("Host"), path)),
                decoded.signature()));
    }

    @Test
    void fetchProductSendsBrowsingSignature() throws Exception {
        wm.stubFor(get(urlEqualTo("/api/products/3"))
                .willReturn(okJson("{\"id\": 3, \"name\": \"Running Shoes\"}")));

        Map<String, Object> product = client.fetchProduct(3);

        assertEquals("Running Shoes", product.get("name"));
        List<LoggedRequest> requests = wm.findAll(getRequestedFor(urlEqualTo("/api/products/3")));
        assertEquals(1, requests.size());
        assertEquals("localhost:" + wm.port(), requests.get(0).getHeader("Host"));
        assertSignedFor(requests.get(0), "/api/products/3", SignatureContext.TAG_BROWSER_AUTH);
    }

    @Test
    void checkoutSendsPayerSignatureAndToken() throws Exception {
        wm.stubFor(post(urlEqualTo("/api/cart/cart-42/x402/checkout"))
                .willReturn(okJson("{\"status\": \"success\"}")));

        Map<String, Object> result = client.checkoutWithDelegation("cart-42", "dlg_abc", "agent-7");

        assertEquals("success", result.get("status"));
        wm.verify(postRequestedFor(urlEqualTo("/api/cart/cart-42/x402/checkout"))
                .withRequestBody(matchingJsonPath("$.delegation_token", equalTo("dlg_abc")))
                .withRequestBody(matchingJsonPath("$.agent_id", equalTo("agent-7"))));
        LoggedRequest request = wm.findAll(postRequestedFor(urlEqualTo("/api/cart/cart-42/x402/checkout"))).get(0);
        assertSignedFor(request, "/api/cart/cart-42/x402/checkout", SignatureContext.TAG_PAYER_AUTH);
    }

    @Test
    void merchantErrorIsReportedWithItsBody() {
        String body = "{\"error\":\"invalid_signature\",\"error_description\":\"unknown agent\"}";
        wm.stubFor(get(urlEqualTo("/api/products/1"))
                .willReturn(aResponse().withStatus(401).withHeader("Content-Type", "application/json").withBody(body)));

        MerchantRequestException e = assertThrows(MerchantRequestException.class, () -> client.fetchProduct(1));

        assertEquals(401, e.getStatus());
        assertEquals(body, e.getResponseBody());
    }

    @Test
    void settlementFailureIsReported() {
        wm.stubFor(post(urlEqualTo("/api/cart/cart-42/x402/checkout"))
                .willReturn(aResponse().withStatus(503).withBody("{\"error\":\"facilitator_unreachable\"}")));

        MerchantRequestException e = assertThrows(MerchantRequestException.class,
                () -> client.checkoutWithDelegation("cart-42", "dlg_abc", "agent-7"));

        assertEquals(503, e.getStatus());
    }

}
