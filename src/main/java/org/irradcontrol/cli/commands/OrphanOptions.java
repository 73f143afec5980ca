package org.irradcontrol.cli.commands;

import picocli.CommandLine.Option;

/**
 * Options shared by the run commands.
 */
public class OrphanOptions {

    @Option(names = "--kill-orphan", description = "Kill a still running previous instance without asking.")
    private boolean killOrphan;

    @Option(names = "--ignore-orphan", description = "Start even if a previous instance is still running.")
    private boolean ignoreOrphan;

    public ProcessLauncher.OrphanPolicy policy() {
        if (killOrphan) {
            return ProcessLauncher.OrphanPolicy.KILL;
        }
        return ignoreOrphan ? ProcessLauncher.OrphanPolicy.IGNORE : ProcessLauncher.OrphanPolicy.ASK;
    }
}
