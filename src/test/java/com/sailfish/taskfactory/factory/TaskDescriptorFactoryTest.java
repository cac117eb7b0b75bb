package com.sailfish.taskfactory.factory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sailfish.taskfactory.MethodTaskCallable;
import com.sailfish.taskfactory.SampleTasks;
import com.sailfish.taskfactory.TaskArguments;
import com.sailfish.taskfactory.TaskCallable;
import com.sailfish.taskfactory.model.ExecutorSelector;
import com.sailfish.taskfactory.model.TaskHandle;
import com.sailfish.taskfactory.model.TaskOptions;
import com.sailfish.taskfactory.model.TaskStatus;
import com.sailfish.taskfactory.service.ExecutionContext;
import com.sailfish.taskfactory.source.SourceProvider;
import com.sailfish.taskfactory.source.SourceTreeSourceProvider;
import com.sailfish.taskfactory.wrapper.TaskWrapper;
import com.sailfish.taskfactory.wrapper.TaskWrapperConfig;
import com.sailfish.taskfactory.wrapper.TaskWrapperConstructor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TaskDescriptorFactoryTest {

    private static final String ADD_SOURCE_MD5 = "0af272e52ae765f93b815a22f1bdf7f4";

    private final SourceProvider sourceTree = new SourceTreeSourceProvider(Paths.get("src/test/java"));
    private final TaskOptions cached = TaskOptions.builder().cache(true).build();

    private Logger factoryLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        factoryLogger = (Logger) LoggerFactory.getLogger(TaskDescriptorFactory.class);
        factoryLogger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        factoryLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        factoryLogger.detachAppender(appender);
    }

    @Test
    void identityIsMd5OfMethodSourceWhenCaching() {
        TaskDescriptorFactory factory = new TaskDescriptorFactory(TaskKind.PYTHON,
                MethodTaskCallable.of(SampleTasks.class, "add"), null, cached, sourceTree);

        assertThat(factory.getContentIdentity()).isEqualTo(ADD_SOURCE_MD5);
        assertThat(factory.getDisplayName()).isEqualTo("add");
        assertThat(factory.getStatus()).isEqualTo(TaskStatus.CREATED);
    }

    @Test
    void changingOneCharacterOfSourceChangesIdentity(@TempDir Path root) throws Exception {
        Path before = writeSampleTasks(root.resolve("before"), "return x + y;");
        Path after = writeSampleTasks(root.resolve("after"), "return x - y;");
        TaskCallable add = MethodTaskCallable.of(SampleTasks.class, "add");

        String first = new TaskDescriptorFactory(TaskKind.PYTHON, add, null, cached, new SourceTreeSourceProvider(before))
                .getContentIdentity();
        String again = new TaskDescriptorFactory(TaskKind.PYTHON, add, null, cached, new SourceTreeSourceProvider(before))
                .getContentIdentity();
        String changed = new TaskDescriptorFactory(TaskKind.PYTHON, add, null, cached, new SourceTreeSourceProvider(after))
                .getContentIdentity();

        assertThat(first).isEqualTo(again).matches("[0-9a-f]{32}");
        assertThat(changed).isNotEqualTo(first).matches("[0-9a-f]{32}");
    }

    @Test
    void sameNamedMethodsInNestedClassesGetDistinctIdentities() throws Exception {
        TaskCallable outer = new MethodTaskCallable(null, SampleTasks.class.getMethod("compute", int.class));
        TaskCallable inner = MethodTaskCallable.of(SampleTasks.Other.class, "compute");

        String outerIdentity = new TaskDescriptorFactory(TaskKind.PYTHON, outer, null, cached, sourceTree)
                .getContentIdentity();
        String innerIdentity = new TaskDescriptorFactory(TaskKind.PYTHON, inner, null, cached, sourceTree)
                .getContentIdentity();

        assertThat(outerIdentity).matches("[0-9a-f]{32}");
        assertThat(innerIdentity).matches("[0-9a-f]{32}").isNotEqualTo(outerIdentity);
    }

    @Test
    void identityIsDisplayNameWhenCachingDisabled() {
        SourceProvider provider = mock(SourceProvider.class);

        TaskDescriptorFactory factory = new TaskDescriptorFactory(TaskKind.PYTHON,
                MethodTaskCallable.of(SampleTasks.class, "add"), null, TaskOptions.defaults(), provider);

        assertThat(factory.getContentIdentity()).isEqualTo("add");
        assertThat(factory.isCache()).isFalse();
        verifyNoInteractions(provider);
    }

    @Test
    void missingSourceDegradesToDisplayNameAndLogs() {
        TaskDescriptorFactory factory = new TaskDescriptorFactory(TaskKind.PYTHON,
                TaskCallable.of("interactive", args -> 1), null, cached, sourceTree);

        assertThat(factory.getContentIdentity()).isEqualTo("interactive");
        assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
                    assertThat(event.getFormattedMessage()).contains("Unable to get source code").contains("interactive");
                });
    }

    @Test
    void separateFactoriesForSameCallableShareIdentity() {
        TaskCallable add = MethodTaskCallable.of(SampleTasks.class, "add");

        TaskDescriptorFactory first = new TaskDescriptorFactory(TaskKind.PYTHON, add, null, cached, sourceTree);
        TaskDescriptorFactory second = new TaskDescriptorFactory(TaskKind.BASH, add, null, cached, sourceTree);

        assertThat(first.getContentIdentity()).isEqualTo(second.getContentIdentity());
    }

    @Test
    void signatureFailurePropagates() {
        TaskCallable broken = mock(TaskCallable.class);
        when(broken.getName()).thenReturn("broken");
        when(broken.getSignature()).thenThrow(new IllegalStateException("malformed"));

        assertThatThrownBy(() -> new TaskDescriptorFactory(TaskKind.PYTHON, broken))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("malformed");
    }

    @Test
    void invocationForwardsArgumentsAndParametersToNewWrapper() throws Exception {
        RecordingConstructor recorder = new RecordingConstructor();
        ExecutionContext context = mock(ExecutionContext.class);
        TaskOptions options = TaskOptions.builder()
                .cache(true)
                .executors("local")
                .walltime(Duration.ofSeconds(5))
                .auxiliaryFiles(Collections.singletonList(Paths.get("lib.sh")))
                .build();
        TaskDescriptorFactory factory = new TaskDescriptorFactory(recorder,
                MethodTaskCallable.of(SampleTasks.class, "add"), context, options, sourceTree);
        TaskArguments arguments = TaskArguments.of(1).withKeyword("y", 2);

        TaskHandle handle = factory.call(arguments);

        assertThat(handle.getResult().get()).isEqualTo(arguments);
        assertThat(recorder.configs).hasSize(1);
        TaskWrapperConfig config = recorder.configs.get(0);
        assertThat(config.getExecutionContext()).isSameAs(context);
        assertThat(config.getContentIdentity()).isEqualTo(ADD_SOURCE_MD5);
        assertThat(config.isCache()).isTrue();
        assertThat(config.getExecutors()).isEqualTo(ExecutorSelector.of("local"));
        assertThat(config.getWalltime()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getAuxiliaryFiles()).containsExactly(Paths.get("lib.sh"));
        assertThat(config.getSignature()).isEqualTo(factory.getSignature());
    }

    @Test
    void everyCallAllocatesAFreshWrapperWithTheSameIdentity() {
        RecordingConstructor recorder = new RecordingConstructor();
        TaskDescriptorFactory factory = new TaskDescriptorFactory(recorder, TaskCallable.of("stub", args -> null));

        factory.call("a");
        factory.call("b");

        assertThat(recorder.wrappers).hasSize(2);
        assertThat(recorder.wrappers.get(0)).isNotSameAs(recorder.wrappers.get(1));
        assertThat(recorder.configs).extracting(TaskWrapperConfig::getContentIdentity).containsOnly("stub");
    }

    @Test
    void concurrentInvocationsKeepArgumentsIsolated() throws Exception {
        RecordingConstructor recorder = new RecordingConstructor();
        TaskDescriptorFactory factory = new TaskDescriptorFactory(recorder, TaskCallable.of("stub", args -> null));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        int calls = 200;
        try {
            List<Future<TaskHandle>> handles = new ArrayList<>();
            for (int i = 0; i < calls; i++) {
                TaskArguments arguments = TaskArguments.of(i).withKeyword("tag", "t" + i);
                handles.add(pool.submit(() -> factory.call(arguments)));
            }
            for (int i = 0; i < calls; i++) {
                TaskHandle handle = handles.get(i).get(10, TimeUnit.SECONDS);
                assertThat(handle.getResult().get()).isEqualTo(TaskArguments.of(i).withKeyword("tag", "t" + i));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(recorder.wrappers).hasSize(calls).doesNotHaveDuplicates();
        assertThat(recorder.wrappers).allSatisfy(wrapper -> assertThat(wrapper.received).hasSize(1));
    }

    @Test
    void toStringNamesKindAndTask() {
        TaskDescriptorFactory factory = new TaskDescriptorFactory(TaskKind.BASH, MethodTaskCallable.of(SampleTasks.class, "echo"));

        assertThat(factory.toString()).isEqualTo("TaskDescriptorFactory[BashTaskWrapper for echo]");
    }

    private static Path writeSampleTasks(Path root, String body) throws Exception {
        Path file = root.resolve("com/sailfish/taskfactory/SampleTasks.java");
        Files.createDirectories(file.getParent());
        String source = "package com.sailfish.taskfactory;\n\npublic final class SampleTasks {\n"
                + "    public static int add(int x, int y) {\n        " + body + "\n    }\n}\n";
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
        return root;
    }

    static final class RecordingConstructor implements TaskWrapperConstructor {

        final List<TaskWrapperConfig> configs = new CopyOnWriteArrayList<>();
        final List<RecordingWrapper> wrappers = new CopyOnWriteArrayList<>();

        @Override
        public TaskWrapper create(TaskCallable callable, TaskWrapperConfig config) {
            configs.add(config);
            RecordingWrapper wrapper = new RecordingWrapper(callable.getName());
            wrappers.add(wrapper);
            return wrapper;
        }

        @Override
        public String describe() {
            return "RecordingWrapper";
        }
    }

    static final class RecordingWrapper implements TaskWrapper {

        final String taskName;
        final List<TaskArguments> received = new CopyOnWriteArrayList<>();

        RecordingWrapper(String taskName) {
            this.taskName = taskName;
        }

        @Override
        public TaskHandle call(TaskArguments arguments) {
            received.add(arguments);
            return new TaskHandle(taskName, CompletableFuture.<Object>completedFuture(arguments), Collections.emptyList());
        }
    }
}
