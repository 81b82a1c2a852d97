package io.shardguard;

import io.shardguard.cli.ShardGuardCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ShardGuardCommand()).execute(args);
        System.exit(code);
    }
}
