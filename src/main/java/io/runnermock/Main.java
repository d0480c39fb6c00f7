package io.runnermock;

import io.runnermock.cli.RunnerMockCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RunnerMockCommand()).execute(args);
        System.exit(code);
    }
}
