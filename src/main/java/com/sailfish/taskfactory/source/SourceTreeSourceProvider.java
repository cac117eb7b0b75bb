package com.sailfish.taskfactory.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code .java} files from source directories on disk, searched in order.
 */
public class SourceTreeSourceProvider extends CompilationUnitSourceProvider {

    private final List<Path> roots;

    public SourceTreeSourceProvider(Path... roots) {
        this(Arrays.asList(roots));
    }

    public SourceTreeSourceProvider(List<Path> roots) {
        if (roots == null || roots.isEmpty()) {
            throw new IllegalArgumentException("at least one source root is required");
        }
        this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
    }

    public List<Path> getRoots() {
        return roots;
    }

    @Override
    protected Optional<String> readCompilationUnit(String relativePath, Class<?> topLevelClass) throws IOException {
        for (Path root : roots) {
            Path file = root.resolve(relativePath);
            if (Files.isRegularFile(file)) {
                return Optional.of(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            }
        }
        return Optional.empty();
    }
}
