package io.shipme.cli;

import picocli.CommandLine;

public final class ShipMeApplication {

    private ShipMeApplication() {
    }

    public static void main(String[] args) {
        System.exit(commandLine(new CliContext(System.getenv())).execute(args));
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new ShipMeCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("tools", new ToolsCommand(context));
        commandLine.addSubcommand("call", new CallCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        return commandLine;
    }
}
