package com.example.merchant.controller;

import com.example.merchant.repository.OrderRepository;
import com.example.merchant.security.TrustedAgentKeyStore;
import com.example.merchant.service.MerchantSignatureGenerator;
import com.example.merchant.service.OrderService;
import com.example.signature.SignatureContext;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DelegatedCheckoutIntegrationTest {

    static WireMockServer facilitator = startFacilitator();

    private static final String RECEIPT = """
            {"transaction_receipt": {"receipt_id": "rcpt_9f2c", "transaction_id": "txn_5d1e",
              "payment_rail_used": "card", "amount": 58.50, "processing_fee": 1.70, "net_amount": 56.80},
             "remaining_delegation_limit": 441.50}
            """;

    @Autowired
    MockMvc mockMvc;

    @Autowired
    TrustedAgentKeyStore keyStore;

    @Autowired
    OrderRepository orderRepository;

    @Autowired
    MerchantSignatureGenerator signatureGenerator;

    @MockitoSpyBean
    OrderService orderService;

    private static WireMockServer startFacilitator() {
        WireMockServer server = new WireMockServer(0);
        server.start();
        return server;
    }

    @DynamicPropertySource
    static void facilitatorProperties(DynamicPropertyRegistry registry) {
        registry.add("merchant.facilitator.base-url", () -> "http://localhost:" + facilitator.port());
        registry.add("merchant.facilitator.read-timeout", () -> "500ms");
    }

    @AfterAll
    static void stopFacilitator() {
        facilitator.stop();
    }

    @BeforeEach
    void setUp() {
        facilitator.resetAll();
        TestAgent.trust(keyStore);
    }

    private String cartWithTwoNotebookSets() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/cart")).andReturn();
        String sessionId = JsonPath.read(created.getResponse().getContentAsString(), "$.session_id");
        mockMvc.perform(post("/api/cart/{id}/items", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\": 10, \"quantity\": 2}"))
                .andExpect(status().isOk());
        return sessionId;
    }

    private ResultActions checkout(String sessionId, String body) throws Exception {
        String path = "/api/cart/" + sessionId + "/x402/checkout";
        return mockMvc.perform(TestAgent.signed(post(path), path, SignatureContext.TAG_PAYER_AUTH)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private ResultActions checkout(String sessionId) throws Exception {
        return checkout(sessionId, "{\"delegation_token\": \"dlg_abc\", \"agent_id\": \"agent-7\"}");
    }

    @Test
    void settledCheckoutPlacesOrder() throws Exception {
        facilitator.stubFor(WireMock.post(urlEqualTo("/x402/settle")).willReturn(okJson(RECEIPT)));
        String sessionId = cartWithTwoNotebookSets();

        MvcResult result = checkout(sessionId)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.message").value("x402 checkout completed successfully"))
                .andExpect(jsonPath("$.order.customer_name").value("Agent agent-7"))
                .andExpect(jsonPath("$.order.customer_email").value("agent_agent-7@system.local"))
                .andExpect(jsonPath("$.order.subtotal").value(40.0))
                .andExpect(jsonPath("$.order.shipping_cost").value(15.0))
                .andExpect(jsonPath("$.order.tax_amount").value(3.5))
                .andExpect(jsonPath("$.order.total_amount").value(58.5))
                .andExpect(jsonPath("$.order.payment_method").value("x402_delegation"))
                .andExpect(jsonPath("$.order.items[0].total_price").value(40.0))
                .andExpect(jsonPath("$.payment.receipt_id").value("rcpt_9f2c"))
                .andExpect(jsonPath("$.payment.payment_rail").value("card"))
                .andExpect(jsonPath("$.payment.net_amount").value(56.8))
                .andExpect(jsonPath("$.delegation.remaining_limit").value(441.5))
                .andExpect(jsonPath("$.delegation.agent_id").value("agent-7"))
                .andExpect(jsonPath("$.fulfillment.status").value("processing"))
                .andExpect(jsonPath("$.fulfillment.tracking_number").value(matchesPattern("TRK[0-9A-F]{10}")))
                .andReturn();

        facilitator.verify(postRequestedFor(urlEqualTo("/x402/settle"))
                .withRequestBody(matchingJsonPath("$.delegation_token", equalTo("dlg_abc")))
                .withRequestBody(matchingJsonPath("$.cart_id", equalTo(sessionId)))
                .withRequestBody(matchingJsonPath("$.amount", matching("58\\.50?")))
                .withRequestBody(matchingJsonPath("$.items[0].name", equalTo("Notebook Set")))
                .withRequestBody(matchingJsonPath("$.merchant_signature",
                        equalTo(signatureGenerator.sign(sessionId, new BigDecimal("58.50"))))));

        mockMvc.perform(get("/api/cart/{id}", sessionId))
                .andExpect(jsonPath("$.items", hasSize(0)));

        String orderNumber = JsonPath.read(result.getResponse().getContentAsString(), "$.order.order_number");
        mockMvc.perform(get("/api/orders/{orderNumber}", orderNumber))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payment.receipt_id").value("rcpt_9f2c"))
                .andExpect(jsonPath("$.payment.transaction_id").value("txn_5d1e"))
                .andExpect(jsonPath("$.payment.processing_fee").value(1.7));
    }

    @Test
    void failedOrderWriteAfterSettlementIsNeverSettledAgain() throws Exception {
        facilitator.stubFor(WireMock.post(urlEqualTo("/x402/settle")).willReturn(okJson(RECEIPT)));
        doThrow(new DataAccessResourceFailureException("orders table unavailable"))
                .when(orderService).placeDelegatedOrder(any(), any(), any(), any());
        String sessionId = cartWithTwoNotebookSets();
        long orders = orderRepository.count();

        checkout(sessionId)
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("order_not_recorded"))
                .andExpect(jsonPath("$.receipt_id").value("rcpt_9f2c"));

        checkout(sessionId)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("settlement_already_recorded"))
                .andExpect(jsonPath("$.receipt_id").value("rcpt_9f2c"));

        facilitator.verify(1, postRequestedFor(urlEqualTo("/x402/settle")));
        assertEquals(orders, orderRepository.count());
    }

    @Test
    void facilitatorTimeoutLeavesCartAndPlacesNoOrder() throws Exception {
        facilitator.stubFor(WireMock.post(urlEqualTo("/x402/settle")).willReturn(okJson(RECEIPT).withFixedDelay(2000)));
        String sessionId = cartWithTwoNotebookSets();
        long orders = orderRepository.count();

        checkout(sessionId)
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("facilitator_unreachable"));

        assertEquals(orders, orderRepository.count());
        mockMvc.perform(get("/api/cart/{id}", sessionId))
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].quantity").value(2));
    }

    @Test
    void refusedSettlementLeavesCartAndPlacesNoOrder() throws Exception {
        facilitator.stubFor(WireMock.post(urlEqualTo("/x402/settle"))
                .willReturn(aResponse().withStatus(403).withBody("{\"detail\":\"Delegation token revoked\"}")));
        String sessionId = cartWithTwoNotebookSets();
        long orders = orderRepository.count();

        checkout(sessionId)
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error").value("settlement_denied"))
                .andExpect(jsonPath("$.error_description").value("Payment settlement failed: {\"detail\":\"Delegation token revoked\"}"))
                .andExpect(jsonPath("$.facilitator_status").value(403))
                .andExpect(jsonPath("$.facilitator_response").value("{\"detail\":\"Delegation token revoked\"}"));

        assertEquals(orders, orderRepository.count());
        mockMvc.perform(get("/api/cart/{id}", sessionId))
                .andExpect(jsonPath("$.items", hasSize(1)));
    }

    @Test
    void successWithoutReceiptIsUnavailable() throws Exception {
        facilitator.stubFor(WireMock.post(urlEqualTo("/x402/settle")).willReturn(okJson("{\"remaining_delegation_limit\": 10}")));
        String sessionId = cartWithTwoNotebookSets();
        long orders = orderRepository.count();

        checkout(sessionId).andExpect(status().isServiceUnavailable());

        assertEquals(orders, orderRepository.count());
    }

    @Test
    void missingDelegationTokenIsBadRequest() throws Exception {
        String sessionId = cartWithTwoNotebookSets();

        checkout(sessionId, "{\"agent_id\": \"agent-7\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));
        facilitator.verify(0, postRequestedFor(urlEqualTo("/x402/settle")));
    }

    @Test
    void emptyCartIsBadRequest() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/cart")).andReturn();
        String sessionId = JsonPath.read(created.getResponse().getContentAsString(), "$.session_id");

        checkout(sessionId)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("cart_empty"));
    }

    @Test
    void unknownCartIsNotFound() throws Exception {
        checkout("no-such-cart")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("cart_not_found"));
    }

}
