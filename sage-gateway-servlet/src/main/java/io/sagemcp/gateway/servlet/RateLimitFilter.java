/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.servlet;

import java.io.IOException;
import java.util.Optional;

import io.sagemcp.gateway.ratelimit.RateLimitDecision;
import io.sagemcp.gateway.ratelimit.RateLimiter;
import io.sagemcp.gateway.ratelimit.TenantPathExtractor;
import io.sagemcp.gateway.util.Assert;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Applies the tenant's token bucket to MCP endpoint requests. A denied request gets
 * {@code 429} with a {@code Retry-After} header; other paths pass through untouched.
 */
public class RateLimitFilter implements Filter {

	static final int SC_TOO_MANY_REQUESTS = 429;

	private final RateLimiter rateLimiter;

	public RateLimitFilter(RateLimiter rateLimiter) {
		Assert.notNull(rateLimiter, "rateLimiter must not be null");
		this.rateLimiter = rateLimiter;
	}

	@Override
	public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
			throws IOException, ServletException {
		if (!(request instanceof HttpServletRequest httpRequest)
				|| !(response instanceof HttpServletResponse httpResponse)) {
			chain.doFilter(request, response);
			return;
		}
		Optional<String> tenant = TenantPathExtractor.extractTenant(httpRequest.getRequestURI());
		if (tenant.isEmpty()) {
			chain.doFilter(request, response);
			return;
		}
		RateLimitDecision decision = this.rateLimiter.tryAcquire(tenant.get());
		if (decision.allowed()) {
			chain.doFilter(request, response);
			return;
		}
		httpResponse.setStatus(SC_TOO_MANY_REQUESTS);
		httpResponse.setHeader("Retry-After", String.valueOf(decision.retryAfterHeaderSeconds()));
		httpResponse.setContentType("application/json");
		httpResponse.setCharacterEncoding("UTF-8");
		httpResponse.getWriter().write("{\"error\":\"Too Many Requests\"}");
		httpResponse.getWriter().flush();
	}

}
