/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.retry.RetryPolicy;
import io.sagemcp.gateway.runtime.ConnectorOptions;
import io.sagemcp.gateway.runtime.LaunchCommandResolver;
import io.sagemcp.gateway.runtime.LaunchSpec;
import io.sagemcp.gateway.runtime.ProcessManager;
import io.sagemcp.gateway.runtime.ProcessStatusListener;
import io.sagemcp.gateway.spec.BackendUnavailableException;
import io.sagemcp.gateway.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class RegistryBackendFactoryTests {

	@TempDir
	Path scratch;

	private final InMemoryConnectorRegistry registry = new InMemoryConnectorRegistry();

	private ProcessManager processManager;

	private RegistryBackendFactory factory;

	@BeforeEach
	void setUp() {
		this.processManager = new ProcessManager(new LaunchCommandResolver(this.scratch), ConnectorOptions.defaults(),
				new ObjectMapper(), ProcessStatusListener.NOOP, 3, Duration.ofMinutes(1));
		this.factory = new RegistryBackendFactory(this.registry, this.processManager);
	}

	@Test
	void nativeDefinitionBuildsNativeBackend() {
		this.registry.register("acme", "notes", new ConnectorDefinition.Native((tenant, connector,
				token) -> NativeBackend.builder(tenant, connector).userToken(token).build()));

		Backend backend = this.factory.create("acme", "notes", "tok");

		assertThat(backend).isInstanceOf(NativeBackend.class);
		assertThat(backend.getUserToken()).contains("tok");
	}

	@Test
	void nativeHandlersSeeGatewayRetryPolicy() {
		RetryPolicy gatewayPolicy = new RetryPolicy(1, Duration.ofMillis(10), Duration.ofSeconds(1));
		RetryPolicy ownPolicy = new RetryPolicy(5, Duration.ofMillis(10), Duration.ofSeconds(1));
		RegistryBackendFactory withPolicy = new RegistryBackendFactory(this.registry, this.processManager,
				gatewayPolicy);
		AtomicReference<NativeCallContext> seen = new AtomicReference<>();
		ToolSpecification whoami = ToolSpecification.builder()
			.tool(new McpSchema.Tool("whoami", null, Map.of()))
			.callHandler((context, request) -> {
				seen.set(context);
				return Mono.just(McpSchema.CallToolResult.text("ok"));
			})
			.build();
		this.registry.register("acme", "notes", new ConnectorDefinition.Native(
				(tenant, connector, token) -> NativeBackend.builder(tenant, connector).tool(whoami).build()));
		this.registry.register("acme", "custom", new ConnectorDefinition.Native((tenant, connector,
				token) -> NativeBackend.builder(tenant, connector).tool(whoami).retryPolicy(ownPolicy).build()));

		withPolicy.create("acme", "notes", null).send(McpSchema.METHOD_TOOLS_CALL, Map.of("name", "whoami")).block();
		assertThat(seen.get().retryPolicy()).isSameAs(gatewayPolicy);

		withPolicy.create("acme", "custom", null).send(McpSchema.METHOD_TOOLS_CALL, Map.of("name", "whoami")).block();
		assertThat(seen.get().retryPolicy()).isSameAs(ownPolicy);
	}

	@Test
	void externalDefinitionBuildsSubprocessBackendWithoutLaunching() {
		this.registry.register("acme", "github",
				new ConnectorDefinition.External(LaunchSpec.builder().command("npx", "server-github").build()));

		Backend backend = this.factory.create("acme", "github", null);

		assertThat(backend).isInstanceOfSatisfying(SubprocessBackend.class, subprocess -> {
			assertThat(subprocess.getDescriptor().key()).isEqualTo("acme:github");
			assertThat(subprocess.getUserToken()).isEmpty();
		});
		assertThat(this.processManager.size()).isZero();
	}

	@Test
	void unknownConnectorIsUnavailable() {
		assertThatExceptionOfType(BackendUnavailableException.class)
			.isThrownBy(() -> this.factory.create("acme", "missing", null))
			.withMessageContaining("missing");
	}

	@Test
	void unregisteredConnectorIsUnavailable() {
		this.registry.register("acme", "notes",
				new ConnectorDefinition.Native((tenant, connector, token) -> NativeBackend.builder(tenant, connector).build()));
		this.registry.unregister("acme", "notes");

		assertThatExceptionOfType(BackendUnavailableException.class)
			.isThrownBy(() -> this.factory.create("acme", "notes", null));
	}

	@Test
	void definitionsAreScopedPerTenant() {
		this.registry.register("acme", "notes",
				new ConnectorDefinition.Native((tenant, connector, token) -> NativeBackend.builder(tenant, connector).build()));

		assertThat(this.registry.resolve("acme", "notes")).isPresent();
		assertThat(this.registry.resolve("globex", "notes")).isEmpty();
	}

}
