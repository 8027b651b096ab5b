package com.taskrelay.worker.process;

import com.taskrelay.worker.WorkerInvocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the argument vector and environment for a worker process.
 */
public class WorkerCommand {

    static final String STRIPPED_ENV_PREFIX = "CLAUDE";

    private final String executable;
    private final List<String> extraArgs;

    public WorkerCommand(String executable, List<String> extraArgs) {
        this.executable = executable;
        this.extraArgs = extraArgs != null ? List.copyOf(extraArgs) : List.of();
    }

    public String executable() {
        return executable;
    }

    /**
     * {@code {executable} --output-format stream-json --verbose --model m [--resume s] [extra...] -p prompt}
     */
    public List<String> arguments(WorkerInvocation invocation) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        command.add("--model");
        command.add(invocation.model());
        if (invocation.isResume()) {
            command.add("--resume");
            command.add(invocation.sessionId());
        }
        command.addAll(extraArgs);
        command.add("-p");
        command.add(invocation.prompt());
        return command;
    }

    /**
     * Remove variables that would make the child believe it runs nested inside another worker.
     */
    public static void stripInheritedSession(Map<String, String> environment) {
        environment.keySet().removeIf(name -> name.startsWith(STRIPPED_ENV_PREFIX));
    }
}
