package com.tasklens.server.core.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * A resolved {@code log} directory for one engineer. {@code team} is null for the flat layout.
 */
@Value
public class EngineerLogLocation {
    String team;
    String engineer;
    Path logDir;
}
