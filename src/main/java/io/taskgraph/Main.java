package io.taskgraph;

import io.taskgraph.cli.TaskGraphCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TaskGraphCommand()).execute(args);
        System.exit(code);
    }
}
