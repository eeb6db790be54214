package com.github.k8soperators.conductor;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@TopCommand
@Command(name = "conductor",
        mixinStandardHelpOptions = true,
        description = "Phase-ordered rollout, status and teardown of the data platform",
        subcommands = {
                DeployCommand.class,
                StatusCommand.class,
                CleanupCommand.class,
                ReconcileCommand.class })
public class ConductorCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
