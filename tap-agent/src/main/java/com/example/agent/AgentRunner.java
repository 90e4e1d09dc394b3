package com.example.agent;

import com.example.agent.client.MerchantClient;
import com.example.agent.client.MerchantRequestException;
import com.example.agent.config.AgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Makes one signed product request at startup, as a smoke test of the merchant's trust setup.
 */
@Component
@ConditionalOnProperty(prefix = "agent", name = "run-on-startup", havingValue = "true")
public class AgentRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(AgentRunner.class);

    private final MerchantClient merchantClient;
    private final AgentProperties properties;

    public AgentRunner(MerchantClient merchantClient, AgentProperties properties) {
        this.merchantClient = merchantClient;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        try {
            Map<String, Object> product = merchantClient.fetchProduct(properties.getStartupProductId());
            logger.info("Merchant accepted our signature, product: {}", product);
        } catch (MerchantRequestException e) {
            logger.error("❌Merchant rejected the signed request: {}", e.getMessage());
        } catch (RestClientException e) {
            logger.error("❌Merchant at {} not reachable", properties.getMerchantBaseUrl(), e);
        }
    }

}
