package com.example.presence.security;

import com.example.presence.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Authenticates device requests to /presence/** with an HMAC signature.
 * A verified request runs as the device id with ROLE_DEVICE.
 */
public class HmacAuthenticationFilter extends OncePerRequestFilter {

    public static final String DEVICE_ID_ATTRIBUTE = "presence.deviceId";

    static final String API_KEY_HEADER = "x-api-key";
    static final String DEVICE_ID_HEADER = "x-device-id";
    static final String TIMESTAMP_HEADER = "x-ts";
    static final String SIGNATURE_HEADER = "x-signature";

    private final Logger log = LoggerFactory.getLogger(HmacAuthenticationFilter.class);

    private final RequestMatcher deviceEndpoints = new AntPathRequestMatcher("/presence/**");
    private final HmacSignatureVerifier verifier;
    private final ObjectMapper objectMapper;

    public HmacAuthenticationFilter(HmacSignatureVerifier verifier, ObjectMapper objectMapper) {
        this.verifier = verifier;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !deviceEndpoints.matches(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        CachedBodyHttpServletRequest wrapped = new CachedBodyHttpServletRequest(request);
        String deviceId = request.getHeader(DEVICE_ID_HEADER);
        try {
            verifier.verify(request.getHeader(API_KEY_HEADER), deviceId,
                    request.getHeader(TIMESTAMP_HEADER), request.getHeader(SIGNATURE_HEADER),
                    wrapped.getCachedBody());
        } catch (HmacVerificationException ex) {
            log.warn("Rejected device request {} {} device={}: {}",
                    request.getMethod(), request.getRequestURI(), deviceId, ex.getMessage());
            writeError(response, ex);
            return;
        }

        PreAuthenticatedAuthenticationToken authentication = new PreAuthenticatedAuthenticationToken(
                deviceId, null, List.of(new SimpleGrantedAuthority("ROLE_DEVICE")));
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
        wrapped.setAttribute(DEVICE_ID_ATTRIBUTE, deviceId);

        chain.doFilter(wrapped, response);
    }

    private void writeError(HttpServletResponse response, HmacVerificationException ex) throws IOException {
        response.setStatus(ex.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(ex.getStatus().value())
                .error(ex.getStatus().getReasonPhrase())
                .kind("Unauthorized")
                .message(ex.getMessage())
                .build();
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
