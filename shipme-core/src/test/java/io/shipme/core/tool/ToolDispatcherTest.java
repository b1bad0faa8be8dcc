package io.shipme.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolDispatcherTest {

    private static final ToolDefinition ECHO = new ToolDefinition(
        "echo",
        "Echo the given text",
        InputSchema.of(FieldSpec.string("text").required().build())
    );

    @Test
    void shouldEchoValidArguments() {
        ToolDispatcher dispatcher = new ToolDispatcher();
        dispatcher.register(ECHO, args -> Map.of("text", args.get("text")));

        ToolCallResult result = dispatcher.invoke("echo", Map.of("text", "hi"));

        assertThat(result.success()).isTrue();
        assertThat(result.data()).isEqualTo(Map.of("text", "hi"));
        assertThat(result.toEnvelope()).containsEntry("success", true).containsEntry("text", "hi");
    }

    @Test
    void shouldRejectMissingRequiredFieldWithoutCallingHandler() {
        ToolDispatcher dispatcher = new ToolDispatcher();
        int[] calls = {0};
        dispatcher.register(ECHO, args -> {
            calls[0]++;
            return Map.of();
        });

        ToolCallResult result = dispatcher.invoke("echo", Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("text").contains("Missing required field");
        assertThat(calls[0]).isZero();
    }

    @Test
    void shouldReturnFailureForUnknownTool() {
        ToolDispatcher dispatcher = new ToolDispatcher();
        dispatcher.register(ECHO, args -> args);

        ToolCallResult result = dispatcher.invoke("missing", Map.of());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Unknown tool: missing");
        assertThat(dispatcher.invoke(null, null).success()).isFalse();
    }

    @Test
    void shouldNormalizeHandlerExceptionsAndStayUsable() {
        ToolDispatcher dispatcher = new ToolDispatcher();
        dispatcher.register(new ToolDefinition("boom", "Always fails", InputSchema.empty()), args -> {
            throw new IllegalStateException("vendor exploded");
        });
        dispatcher.register(new ToolDefinition("io", "Checked failure", InputSchema.empty()), args -> {
            throw new IOException("connection reset");
        });
        dispatcher.register(ECHO, args -> Map.of("text", args.get("text")));

        ToolCallResult boom = dispatcher.invoke("boom", Map.of());
        ToolCallResult io = dispatcher.invoke("io", Map.of());
        ToolCallResult echo = dispatcher.invoke("echo", Map.of("text", "still alive"));

        assertThat(boom.success()).isFalse();
        assertThat(boom.error()).isEqualTo("vendor exploded");
        assertThat(io.toEnvelope()).containsEntry("success", false).containsEntry("error", "connection reset");
        assertThat(echo.success()).isTrue();
    }

    @Test
    void shouldUseExceptionTypeWhenMessageIsMissing() {
        ToolDispatcher dispatcher = new ToolDispatcher();
        dispatcher.register(new ToolDefinition("npe", "Null message", InputSchema.empty()), args -> {
            throw new NullPointerException();
        });

        assertThat(dispatcher.invoke("npe", Map.of()).error()).isEqualTo("NullPointerException");
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        ToolDispatcher dispatcher = new ToolDispatcher();
        dispatcher.register(ECHO, args -> args);

        assertThatThrownBy(() -> dispatcher.register(ECHO, args -> args))
            .isInstanceOf(DuplicateToolException.class)
            .hasMessageContaining("echo");
    }

    @Test
    void shouldListToolsInRegistrationOrder() {
        ToolProvider provider = new ToolProvider() {
            @Override
            public String name() {
                return "demo";
            }

            @Override
            public List<Tool> tools() {
                return List.of(
                    Tool.of("zeta", "last alphabetically", InputSchema.empty(), args -> "z"),
                    Tool.of("alpha", "first alphabetically", InputSchema.empty(), args -> "a")
                );
            }
        };

        ToolDispatcher dispatcher = new ToolDispatcher(List.of(provider));
        dispatcher.register(ECHO, args -> args);

        assertThat(dispatcher.list()).extracting(ToolDefinition::name).containsExactly("zeta", "alpha", "echo");
        assertThat(dispatcher.invoke("alpha", Map.of()).toEnvelope()).containsEntry("result", "a");
    }

    @Test
    void shouldApplySchemaDefaultsBeforeHandlerRuns() {
        ToolDispatcher dispatcher = new ToolDispatcher();
        dispatcher.register(
            new ToolDefinition(
                "create",
                "Create with defaults",
                InputSchema.builder()
                    .field(FieldSpec.string("name").required())
                    .field(FieldSpec.string("plan").oneOf("free", "pro").defaultValue("free"))
                    .build()
            ),
            args -> Map.of("plan", args.get("plan"))
        );

        assertThat(dispatcher.invoke("create", Map.of("name", "app")).toEnvelope()).containsEntry("plan", "free");
        assertThat(dispatcher.invoke("create", Map.of("name", "app", "plan", "gold")).error())
            .contains("plan")
            .contains("[free, pro]");
    }
}
