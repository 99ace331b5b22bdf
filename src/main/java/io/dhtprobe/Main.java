package io.dhtprobe;

import io.dhtprobe.cli.DhtProbeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new DhtProbeCommand()).execute(args);
        System.exit(code);
    }
}
