package com.sailfish.taskfactory.source;

import com.sailfish.taskfactory.TaskCallable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.Optional;

/**
 * Base class for providers that locate the {@code .java} file of a method's top-level class
 * and cut the method declaration out of it.
 */
public abstract class CompilationUnitSourceProvider implements SourceProvider {

    private static final Logger log = LoggerFactory.getLogger(CompilationUnitSourceProvider.class);

    @Override
    public Optional<String> getSource(TaskCallable callable) {
        Optional<Method> method = callable.getMethod();
        if (!method.isPresent()) {
            return Optional.empty();
        }
        Class<?> topLevel = topLevelClass(method.get().getDeclaringClass());
        String relativePath = topLevel.getName().replace('.', '/') + ".java";
        try {
            Optional<String> unit = readCompilationUnit(relativePath, topLevel);
            return unit.flatMap(text -> MethodSourceExtractor.extract(text, method.get()));
        } catch (IOException e) {
            log.debug("Failed to read {} for method {}: {}", relativePath, method.get().getName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads the compilation unit at the given path, relative to a source root.
     *
     * @param relativePath e.g. {@code com/example/Jobs.java}
     * @param topLevelClass The class the file declares.
     * @return the file content, or empty if no such file is reachable.
     * @throws IOException if the file exists but cannot be read.
     */
    protected abstract Optional<String> readCompilationUnit(String relativePath, Class<?> topLevelClass) throws IOException;

    private static Class<?> topLevelClass(Class<?> type) {
        Class<?> current = type;
        while (current.getEnclosingClass() != null) {
            current = current.getEnclosingClass();
        }
        return current;
    }
}
