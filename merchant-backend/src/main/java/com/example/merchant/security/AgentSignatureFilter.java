package com.example.merchant.security;

import com.example.merchant.config.AgentTrustProperties;
import com.example.signature.RequestComponents;
import com.example.signature.SignatureContext;
import com.example.signature.SignatureHeaders;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verifies agent signatures (Signature-Agent, Signature-Input, Signature) on incoming requests.
 * <p>
 * Requests without any signature header pass through untouched unless their path is agent-only.
 * Requests carrying a signature must verify; on success an {@link AgentAuthenticationToken} is put
 * into the security context, otherwise the request ends with 401.
 */
public class AgentSignatureFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AgentSignatureFilter.class);

    private final SignatureVerifier signatureVerifier;
    private final AgentTrustProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public AgentSignatureFilter(SignatureVerifier signatureVerifier, AgentTrustProperties properties) {
        this.signatureVerifier = signatureVerifier;
        this.properties = properties;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        SignatureHeaders headers = new SignatureHeaders(
                request.getHeader(SignatureHeaders.SIGNATURE_AGENT),
                request.getHeader(SignatureHeaders.SIGNATURE_INPUT),
                request.getHeader(SignatureHeaders.SIGNATURE));
        String path = request.getRequestURI();

        if (headers.isAbsent()) {
            if (matchesAny(properties.getRequiredPaths(), path)) {
                log.info("Unsigned request to agent-only path {}", path);
                sendError(response, VerificationResult.MISSING_SIGNATURE);
                return;
            }
            filterChain.doFilter(request, response);
            return;
        }

        Set<String> expectedTags = matchesAny(properties.getPayerPaths(), path)
                ? Set.of(SignatureContext.TAG_PAYER_AUTH)
                : Set.of(SignatureContext.TAG_BROWSER_AUTH);

        VerificationResult result = signatureVerifier.verify(headers, requestComponents(request), expectedTags);
        if (!result.trusted()) {
            log.warn("⚠️Rejected signed {} {}: {}", request.getMethod(), path, result.message());
            sendError(response, result.message());
            return;
        }

        SignatureContext context = result.context();
        SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
        securityContext.setAuthentication(new AgentAuthenticationToken(
                context.agentIdentifier(), result.agentName(), context.keyId(), context.tag()));
        SecurityContextHolder.setContext(securityContext);

        filterChain.doFilter(request, response);
    }

    /**
     * The request as the signature sees it: Host header as authority, path with query string, and
     * every header as a field so any declared custom component can be resolved.
     */
    static RequestComponents requestComponents(HttpServletRequest request) {
        String authority = request.getHeader(HttpHeaders.HOST);
        if (authority == null || authority.isBlank()) {
            int port = request.getServerPort();
            boolean defaultPort = port <= 0
                    || ("http".equals(request.getScheme()) && port == 80)
                    || ("https".equals(request.getScheme()) && port == 443);
            authority = defaultPort ? request.getServerName() : request.getServerName() + ":" + port;
        }
        String path = request.getRequestURI();
        if (request.getQueryString() != null) {
            path = path + "?" + request.getQueryString();
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            fields.put(name, String.join(", ", Collections.list(request.getHeaders(name))));
        }
        return new RequestComponents(authority, path, fields);
    }

    private boolean matchesAny(List<String> patterns, String path) {
        return patterns.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    private void sendError(HttpServletResponse response, String description) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(
                "{\"error\":\"invalid_signature\",\"error_description\":\"" + description + "\"}");
    }

}
