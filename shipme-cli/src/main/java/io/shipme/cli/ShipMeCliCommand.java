package io.shipme.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "shipme",
    mixinStandardHelpOptions = true,
    version = "shipme 1.0.0",
    description = "Provisioning tools for Supabase, GitHub and Netlify"
)
public final class ShipMeCliCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.err);
    }
}
