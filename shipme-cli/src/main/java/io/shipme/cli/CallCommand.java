package io.shipme.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shipme.core.tool.ToolCallResult;
import io.shipme.mcp.server.McpServerRuntime;
import io.shipme.mcp.server.config.McpServerConfig;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "call", description = "Invoke one tool and print its result envelope")
public final class CallCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Tool name")
    String tool;

    @Option(names = {"--args"}, description = "Tool arguments as a JSON object", defaultValue = "{}")
    String arguments;

    public CallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        ObjectMapper mapper = new ObjectMapper();
        Map<String, Object> args;
        try {
            args = mapper.readValue(arguments, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            System.err.println("Call command failed: --args must be a JSON object (" + e.getOriginalMessage() + ")");
            return 1;
        }

        try (McpServerRuntime runtime = context.runtimeFactory().create(McpServerConfig.fromEnv(context.environment()))) {
            ToolCallResult result = runtime.dispatcher().invoke(tool, args == null ? Map.of() : args);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.toEnvelope()));
            return result.success() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Call command failed: " + e.getMessage());
            return 1;
        }
    }
}
