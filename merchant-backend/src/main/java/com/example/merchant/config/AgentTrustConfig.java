package com.example.merchant.config;

import com.example.merchant.security.TrustedAgentKey;
import com.example.merchant.security.TrustedAgentKeyLoader;
import com.example.merchant.security.TrustedAgentKeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AgentTrustConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentTrustConfig.class);

    @Bean
    public TrustedAgentKeyStore trustedAgentKeyStore(AgentTrustProperties properties, TrustedAgentKeyLoader loader) {
        TrustedAgentKeyStore store = new TrustedAgentKeyStore(loader.load(properties.getAgents()));
        if (store.size() == 0) {
            logger.warn("⚠️No trusted agents configured, every signed request will be rejected");
        } else {
            logger.info("Loaded {} trusted agent key(s): {}", store.size(), store.all().stream()
                    .map(TrustedAgentKey::agentIdentifier)
                    .sorted()
                    .toList());
        }
        return store;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

}
