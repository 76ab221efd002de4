package io.github.drompincen.devgateway.runtime.watch;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;

/**
 * Path filter for watched trees. A relative path is ignored when any of its segments is a
 * dotfile or one of the ignored directory names, or when it is a {@code .log} file.
 */
public class IgnoreRules {

    public static final Set<String> DEFAULT_DIRECTORIES = Set.of(".git", "node_modules", "dist", "build", "target");

    private final Set<String> ignoredNames;

    public IgnoreRules(Collection<String> ignoredNames) {
        this.ignoredNames = Set.copyOf(ignoredNames);
    }

    public static IgnoreRules defaults() {
        return new IgnoreRules(DEFAULT_DIRECTORIES);
    }

    public boolean isIgnored(Path relative) {
        for (Path segment : relative) {
            String name = segment.toString();
            if (name.startsWith(".") || ignoredNames.contains(name)) return true;
        }
        Path fileName = relative.getFileName();
        return fileName != null && fileName.toString().endsWith(".log");
    }
}
