/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.servlet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import io.sagemcp.gateway.GatewayContext;
import io.sagemcp.gateway.GatewayDispatcher;
import io.sagemcp.gateway.config.GatewayProperties;
import io.sagemcp.gateway.util.Assert;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.Wrapper;
import org.apache.catalina.startup.Tomcat;
import org.apache.tomcat.util.descriptor.web.FilterDef;
import org.apache.tomcat.util.descriptor.web.FilterMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Tomcat hosting the MCP endpoint behind the rate limit filter.
 */
public class SageGatewayServer {

	private static final Logger logger = LoggerFactory.getLogger(SageGatewayServer.class);

	public static final String API_PREFIX = "/api/v1";

	private final GatewayContext context;

	private final int port;

	private Tomcat tomcat;

	public SageGatewayServer(GatewayContext context) {
		this(context, context.getProperties().getServerPort());
	}

	/**
	 * @param port the port to bind, {@code 0} for an ephemeral one
	 */
	public SageGatewayServer(GatewayContext context, int port) {
		Assert.notNull(context, "context must not be null");
		this.context = context;
		this.port = port;
	}

	public synchronized void start() throws LifecycleException {
		Assert.isTrue(this.tomcat == null, "server already started");
		Tomcat server = new Tomcat();
		server.setPort(this.port);

		String baseDir;
		try {
			baseDir = Files.createTempDirectory("sage-gateway-tomcat").toString();
		}
		catch (IOException ex) {
			logger.warn("Cannot create a Tomcat base directory, using java.io.tmpdir: {}", ex.getMessage());
			baseDir = Path.of(System.getProperty("java.io.tmpdir")).toString();
		}
		server.setBaseDir(baseDir);

		Context webContext = server.addContext("", baseDir);

		Wrapper wrapper = webContext.createWrapper();
		wrapper.setName("mcpGatewayServlet");
		wrapper.setServlet(new McpGatewayServlet(new GatewayDispatcher(this.context)));
		wrapper.setLoadOnStartup(1);
		wrapper.setAsyncSupported(true);
		webContext.addChild(wrapper);
		webContext.addServletMappingDecoded(API_PREFIX + "/*", "mcpGatewayServlet");

		FilterDef filterDef = new FilterDef();
		filterDef.setFilterName("rateLimitFilter");
		filterDef.setFilter(new RateLimitFilter(this.context.getRateLimiter()));
		filterDef.setAsyncSupported("true");
		webContext.addFilterDef(filterDef);
		FilterMap filterMap = new FilterMap();
		filterMap.setFilterName("rateLimitFilter");
		filterMap.addURLPattern(API_PREFIX + "/*");
		webContext.addFilterMap(filterMap);

		server.getConnector().setAsyncTimeout(0);

		this.context.start();
		server.start();
		this.tomcat = server;
		logger.info("Sage MCP gateway listening on port {}", getPort());
	}

	/**
	 * The bound port; differs from the configured one when that was {@code 0}.
	 */
	public synchronized int getPort() {
		Assert.notNull(this.tomcat, "server not started");
		return this.tomcat.getConnector().getLocalPort();
	}

	public synchronized void stop() {
		if (this.tomcat == null) {
			return;
		}
		try {
			this.tomcat.stop();
			this.tomcat.destroy();
		}
		catch (LifecycleException ex) {
			logger.error("Error during Tomcat shutdown", ex);
		}
		finally {
			this.tomcat = null;
			this.context.shutdown().block();
		}
	}

	public static void main(String[] args) throws Exception {
		GatewayProperties properties = GatewayProperties.load();
		GatewayContext context = GatewayContext.builder().properties(properties).build();
		SageGatewayServer server = new SageGatewayServer(context);
		Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "sage-gateway-shutdown"));
		server.start();
		server.tomcat.getServer().await();
	}

}
