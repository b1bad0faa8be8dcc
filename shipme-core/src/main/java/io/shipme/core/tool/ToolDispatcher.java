package io.shipme.core.tool;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes named calls to their handlers and normalizes every outcome into a {@link ToolCallResult}.
 * Nothing thrown by a handler escapes {@link #invoke(String, Map)}.
 */
public final class ToolDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ToolDispatcher.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final List<ToolDefinition> order = new CopyOnWriteArrayList<>();

    public ToolDispatcher() {
    }

    public ToolDispatcher(List<? extends ToolProvider> providers) {
        for (ToolProvider provider : providers) {
            registerAll(provider);
        }
    }

    public synchronized void register(ToolDefinition definition, ToolHandler handler) {
        Tool tool = new Tool(definition, handler);
        if (tools.putIfAbsent(definition.name(), tool) != null) {
            throw new DuplicateToolException(definition.name());
        }
        order.add(definition);
    }

    public void register(Tool tool) {
        register(tool.definition(), tool.handler());
    }

    public void registerAll(ToolProvider provider) {
        List<Tool> provided = provider.tools();
        for (Tool tool : provided) {
            register(tool);
        }
        LOG.debug("Registered {} tool(s) from provider {}", provided.size(), provider.name());
    }

    public List<ToolDefinition> list() {
        return List.copyOf(order);
    }

    public boolean supports(String name) {
        return name != null && tools.containsKey(name);
    }

    public ToolCallResult invoke(String name, Map<String, Object> arguments) {
        Tool tool = name == null ? null : tools.get(name);
        if (tool == null) {
            LOG.warn("Rejected call to unknown tool {}", name);
            return ToolCallResult.failure(new UnknownToolException(name).getMessage());
        }
        try {
            Map<String, Object> validated = tool.definition().inputSchema().validate(arguments);
            LOG.debug("Dispatching tool {}", name);
            Object data = tool.handler().handle(validated);
            return ToolCallResult.success(data);
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = describe(e);
            LOG.warn("Tool {} failed: {}", name, message);
            return ToolCallResult.failure(message);
        }
    }

    private String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
