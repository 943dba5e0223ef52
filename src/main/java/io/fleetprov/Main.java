package io.fleetprov;

import io.fleetprov.cli.FleetProvCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new FleetProvCommand()).execute(args);
        System.exit(code);
    }
}
