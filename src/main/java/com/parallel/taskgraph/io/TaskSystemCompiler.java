package com.parallel.taskgraph.io;

import com.parallel.taskgraph.TaskSystem;
import com.parallel.taskgraph.TaskSystemConfig;
import com.parallel.taskgraph.api.SharedState;
import com.parallel.taskgraph.api.Task;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a {@link SystemDefinition} into a runnable {@link TaskSystem}.
 *
 * <p>
 * Each task's {@code body} is looked up in the {@link TaskBodyRegistry}; a task
 * without one gets the no-op body. The {@code after} lists become the
 * precedence hints. All graph checks (duplicates, unknown references, cycles)
 * are left to the {@link TaskSystem} constructor.
 */
public final class TaskSystemCompiler {
    private static final Logger log = LogManager.getLogger(TaskSystemCompiler.class);

    private final TaskBodyRegistry registry;

    public TaskSystemCompiler(TaskBodyRegistry registry) {
        this.registry = registry;
    }

    public TaskSystem compile(SystemDefinition def, SharedState state) {
        return compile(def, state, TaskSystemConfig.defaults());
    }

    /**
     * @throws IllegalArgumentException if a task has no name or names an
     *                                  unregistered body.
     */
    public TaskSystem compile(SystemDefinition def, SharedState state, TaskSystemConfig config) {
        SystemDefinition.SystemInfo info = def.getSystem();
        List<SystemDefinition.TaskDef> defs = info.getTasks() != null ? info.getTasks() : List.of();

        List<Task> tasks = new ArrayList<>(defs.size());
        Map<String, List<String>> hints = new LinkedHashMap<>(defs.size() * 2);
        for (int i = 0; i < defs.size(); i++) {
            SystemDefinition.TaskDef td = defs.get(i);
            if (td == null || td.getName() == null)
                throw new IllegalArgumentException("Task #" + i + " of system '" + info.getName() + "' has no name");

            String bodyName = td.getBody() != null ? td.getBody() : TaskBodyRegistry.NOOP;
            tasks.add(new Task(td.getName(), td.getReads(), td.getWrites(), registry.get(bodyName)));
            if (td.getAfter() != null && !td.getAfter().isEmpty())
                hints.put(td.getName(), td.getAfter());
        }

        TaskSystem system = new TaskSystem(tasks, hints, state, config);
        log.info("Compiled system '{}': {} tasks, {} edges", info.getName(), tasks.size(),
                system.graph().edgeCount());
        return system;
    }

    /** Parses and compiles a system file. */
    public TaskSystem load(Path path, SharedState state, TaskSystemConfig config) throws IOException {
        return compile(SystemDefinitionParser.parseFile(path), state, config);
    }
}
