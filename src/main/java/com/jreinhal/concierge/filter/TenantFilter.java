package com.jreinhal.concierge.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.concierge.exception.NotFoundException;
import com.jreinhal.concierge.tenant.Tenant;
import com.jreinhal.concierge.tenant.TenantContextHolder;
import com.jreinhal.concierge.tenant.TenantService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves {@code X-Tenant-Id} into a {@link com.jreinhal.concierge.tenant.TenantContext} for
 * tenant-scoped API calls. Suspended tenants keep read access only.
 */
@Component
@Order(2)
public class TenantFilter extends OncePerRequestFilter {
    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String MDC_KEY = "tenantId";
    private static final Pattern SAFE_TENANT_ID = Pattern.compile("^[a-z0-9_-]{1,64}$");
    private final TenantService tenantService;
    private final ObjectMapper objectMapper;

    public TenantFilter(TenantService tenantService, ObjectMapper objectMapper) {
        this.tenantService = tenantService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/") || path.startsWith("/api/tenants");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requested = request.getHeader(TENANT_HEADER);
        if (requested == null || !SAFE_TENANT_ID.matcher(requested.trim()).matches()) {
            reject(response, HttpStatus.BAD_REQUEST, "Missing or invalid " + TENANT_HEADER + " header");
            return;
        }
        Tenant tenant;
        try {
            tenant = this.tenantService.requireTenant(requested.trim());
        }
        catch (NotFoundException e) {
            reject(response, HttpStatus.NOT_FOUND, "Unknown tenant");
            return;
        }
        if (!tenant.isActive() && !HttpMethod.GET.matches(request.getMethod())) {
            reject(response, HttpStatus.FORBIDDEN, "Tenant suspended");
            return;
        }
        TenantContextHolder.set(tenant.toContext());
        MDC.put(MDC_KEY, tenant.id());
        try {
            chain.doFilter(request, response);
        } finally {
            TenantContextHolder.clear();
            MDC.remove(MDC_KEY);
        }
    }

    private void reject(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        this.objectMapper.writeValue(response.getOutputStream(),
                Map.of("error", message, "timestamp", Instant.now().toString()));
    }
}
