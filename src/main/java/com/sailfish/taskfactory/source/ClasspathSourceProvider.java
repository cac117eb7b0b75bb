package com.sailfish.taskfactory.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks up {@code .java} files as class loader resources, e.g. from a sources jar placed on
 * the classpath. By default the class loader of the task's own class is used.
 */
public class ClasspathSourceProvider extends CompilationUnitSourceProvider {

    private final ClassLoader classLoader;
    private final String resourcePrefix;

    public ClasspathSourceProvider() {
        this(null, "");
    }

    /**
     * @param classLoader Loader to search, or {@code null} to use the loader of each task's class.
     * @param resourcePrefix Prefix prepended to the resource path, e.g. {@code "sources/"}.
     */
    public ClasspathSourceProvider(ClassLoader classLoader, String resourcePrefix) {
        this.classLoader = classLoader;
        this.resourcePrefix = Objects.requireNonNull(resourcePrefix, "resourcePrefix cannot be null");
    }

    @Override
    protected Optional<String> readCompilationUnit(String relativePath, Class<?> topLevelClass) throws IOException {
        ClassLoader loader = classLoader != null ? classLoader : topLevelClass.getClassLoader();
        if (loader == null) {
            return Optional.empty();
        }
        try (InputStream in = loader.getResourceAsStream(resourcePrefix + relativePath)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }
}
