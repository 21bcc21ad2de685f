package io.mirrorme.cli;

import picocli.CommandLine.Command;

@Command(name = "mirrorme", mixinStandardHelpOptions = true, description = "MirrorMe behavioral analytics")
public final class MirrorMeCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
