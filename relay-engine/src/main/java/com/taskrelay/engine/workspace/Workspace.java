package com.taskrelay.engine.workspace;

import java.nio.file.Path;

/**
 * An isolated working directory and the branch checked out in it.
 */
public record Workspace(Path path, String branch) {
}
