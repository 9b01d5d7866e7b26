package com.parallel.taskgraph.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a task system file.
 *
 * <pre>{@code
 * {"system": {"name": "demo", "tasks": [
 *     {"name": "load", "writes": ["raw"], "body": "load"},
 *     {"name": "clean", "reads": ["raw"], "writes": ["data"], "after": ["load"], "body": "clean"}
 * ]}}
 * }</pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SystemDefinition {
    private SystemInfo system;

    /** Meta-information and tasks of the system. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SystemInfo {
        private String name;
        private List<TaskDef> tasks;
    }

    /** Definition of a single task. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class TaskDef {
        private String name, body;
        private List<String> reads, writes, after;
    }
}
