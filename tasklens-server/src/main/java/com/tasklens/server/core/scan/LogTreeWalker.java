package com.tasklens.server.core.scan;

import com.tasklens.server.config.TaskLensProperties;
import com.tasklens.server.core.model.EngineerLogLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds engineer log directories under a team root.
 * <p>
 * Two layouts are supported and may be mixed: {@code <root>/<engineer>/log} and
 * {@code <root>/<team>/<engineer>/log}. A top-level entry with its own {@code log} directory is an
 * engineer, anything else is a team.
 */
@Slf4j
@Component
public class LogTreeWalker {

    static final String LOG_DIR = "log";
    static final String LOG_SUFFIX = ".jsonl";

    private final int maxDepth;

    public LogTreeWalker(TaskLensProperties properties) {
        this.maxDepth = Math.max(1, properties.getQuery().getMaxWalkDepth());
    }

    public List<EngineerLogLocation> discover(Path root, Collection<String> teams, Collection<String> engineers) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        Set<String> teamFilter = toFilter(teams);
        Set<String> engineerFilter = toFilter(engineers);
        List<EngineerLogLocation> locations = new ArrayList<>();

        for (Path entry : listDirectories(root)) {
            String name = entry.getFileName().toString();
            Path directLog = entry.resolve(LOG_DIR);

            if (Files.isDirectory(directLog)) {
                if (accepts(engineerFilter, name)) {
                    locations.add(new EngineerLogLocation(null, name, directLog));
                }
                continue;
            }

            if (!accepts(teamFilter, name)) {
                continue;
            }
            for (Path engineerDir : listDirectories(entry)) {
                String engineer = engineerDir.getFileName().toString();
                if (!accepts(engineerFilter, engineer)) {
                    continue;
                }
                Path logDir = engineerDir.resolve(LOG_DIR);
                if (Files.isDirectory(logDir)) {
                    locations.add(new EngineerLogLocation(name, engineer, logDir));
                }
            }
        }
        return locations;
    }

    /**
     * All {@code .jsonl} files below {@code logDir}, sorted by path. Unreadable directories are skipped,
     * and a directory reached twice through links is only walked once.
     */
    public List<Path> listJsonlFiles(Path logDir) {
        List<Path> files = new ArrayList<>();
        Set<Path> visited = new HashSet<>();
        Deque<PendingDir> stack = new ArrayDeque<>();
        stack.push(new PendingDir(logDir, 0));

        while (!stack.isEmpty()) {
            PendingDir current = stack.pop();
            if (!visited.add(realPath(current.dir))) {
                continue;
            }
            List<Path> entries;
            try (Stream<Path> stream = Files.list(current.dir)) {
                entries = stream.collect(Collectors.toList());
            } catch (IOException e) {
                log.debug("Skipping unreadable directory {}: {}", current.dir, e.getMessage());
                continue;
            }
            for (Path entry : entries) {
                if (Files.isDirectory(entry)) {
                    if (current.depth + 1 < maxDepth) {
                        stack.push(new PendingDir(entry, current.depth + 1));
                    }
                } else if (Files.isRegularFile(entry) && entry.getFileName().toString().endsWith(LOG_SUFFIX)) {
                    files.add(entry);
                }
            }
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }

    private List<Path> listDirectories(Path dir) {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.debug("Skipping unreadable directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private static Path realPath(Path dir) {
        try {
            return dir.toRealPath();
        } catch (IOException e) {
            return dir.toAbsolutePath().normalize();
        }
    }

    private static Set<String> toFilter(Collection<String> names) {
        return names == null || names.isEmpty() ? null : new HashSet<>(names);
    }

    private static boolean accepts(Set<String> filter, String name) {
        return filter == null || filter.contains(name);
    }

    private static final class PendingDir {
        final Path dir;
        final int depth;

        PendingDir(Path dir, int depth) {
            this.dir = dir;
            this.depth = depth;
        }
    }
}
