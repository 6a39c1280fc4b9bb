package com.plcmodel.core.extract;

import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.TreeQuery;
import com.plcmodel.core.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads {@code task} declarations of resources.
 *
 * <p>Program instances are reported by {@code typeName}, falling back to the instance name
 * when the type is not given.
 */
public class TaskExtractor {

    private static final Logger log = LoggerFactory.getLogger(TaskExtractor.class);

    private static final String[] TASK_PATHS = {".//resource/task", ".//task"};
    private static final String[] INSTANCE_PATHS = {"./pouInstance"};

    private final TreeQuery query;
    private final NameResolver names;

    public TaskExtractor(TreeQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.names = new NameResolver(query);
    }

    /**
     * Extracts every named task below the given node.
     *
     * @param root document root
     * @return tasks in document order
     */
    public List<TaskRecord> extractTasks(DocumentNode root) {
        List<TaskRecord> tasks = new ArrayList<>();
        for (DocumentNode taskNode : query.findAll(root, TASK_PATHS)) {
            extractTask(taskNode).ifPresent(tasks::add);
        }
        log.debug("Found {} tasks", tasks.size());
        return tasks;
    }

    /**
     * Extracts one task.
     *
     * @param taskNode {@code task} element
     * @return the task, or empty if it has no name
     */
    public Optional<TaskRecord> extractTask(DocumentNode taskNode) {
        Optional<String> name = names.resolve(taskNode);
        if (name.isEmpty()) {
            log.debug("Skipping unnamed task {}", taskNode);
            return Optional.empty();
        }

        List<String> programUnits = new ArrayList<>();
        for (DocumentNode instance : query.findAll(taskNode, INSTANCE_PATHS)) {
            instance.attribute("typeName")
                .or(() -> names.resolve(instance))
                .ifPresent(programUnits::add);
        }

        return Optional.of(new TaskRecord(
            name.get(),
            taskNode.attribute("interval").orElse(null),
            taskNode.attribute("priority").orElse(null),
            programUnits
        ));
    }
}
