package com.example.merchant.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

/**
 * Authentication for a request whose agent signature was verified.
 * The principal is the agent identifier; there are no credentials to keep.
 */
public class AgentAuthenticationToken extends AbstractAuthenticationToken {

    public static final String ROLE_AGENT = "ROLE_AGENT";

    private final String agentIdentifier;
    private final String agentName;
    private final String keyId;
    private final String tag;

    public AgentAuthenticationToken(String agentIdentifier, String agentName, String keyId, String tag) {
        super(AuthorityUtils.createAuthorityList(ROLE_AGENT));
        this.agentIdentifier = agentIdentifier;
        this.agentName = agentName;
        this.keyId = keyId;
        this.tag = tag;
        setAuthenticated(true);
    }

    @Override
    public Object getPrincipal() {
        return agentIdentifier;
    }

    @Override
    public Object getCredentials() {
        return "";
    }

    public String getAgentIdentifier() {
        return agentIdentifier;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getKeyId() {
        return keyId;
    }

    public String getTag() {
        return tag;
    }

}
