package io.shipme.core.tool;

import java.util.List;

public interface ToolProvider {
    String name();

    List<Tool> tools();
}
