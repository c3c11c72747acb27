package com.tasklens.server.core.util;

import java.nio.file.Path;

public final class HomePaths {

    private HomePaths() {
    }

    /**
     * Expands a leading {@code ~} or {@code ~/} to the user's home directory.
     */
    public static String expand(String path) {
        if (path == null) {
            return null;
        }
        String home = System.getProperty("user.home");
        if (path.equals("~")) {
            return home;
        }
        if (path.startsWith("~/")) {
            return Path.of(home, path.substring(2)).toString();
        }
        return path;
    }

    /**
     * Expands the home prefix and resolves the result against the working directory.
     */
    public static Path resolve(String path) {
        return Path.of(expand(path)).toAbsolutePath().normalize();
    }
}
