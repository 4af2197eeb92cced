package com.purchasingpower.flowgraph.knowledge.impl;

import com.purchasingpower.flowgraph.core.CatalogEntity;
import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.core.OrderedTask;
import com.purchasingpower.flowgraph.core.RelationshipType;
import com.purchasingpower.flowgraph.core.ScoredKey;
import com.purchasingpower.flowgraph.core.TaskDefinition;
import com.purchasingpower.flowgraph.core.TaskRef;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.core.WorkflowDefinition;
import com.purchasingpower.flowgraph.core.WorkflowMembership;
import com.purchasingpower.flowgraph.exception.ConstraintViolationException;
import com.purchasingpower.flowgraph.exception.NotFoundException;
import com.purchasingpower.flowgraph.knowledge.GraphStore;
import com.purchasingpower.flowgraph.knowledge.TaskRefValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * GraphStore kept in JVM memory, for local runs without a Neo4j server and for tests.
 *
 * <p>Writes take a single store-wide write lock, which also serializes writers of
 * the same workflow. Vector search is brute-force cosine similarity; full-text
 * relevance is the fraction of query tokens found in the indexed text.
 *
 * @since 1.0.0
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, ToolDefinition> tools = new TreeMap<>();
    private final Map<String, TaskDefinition> tasks = new TreeMap<>();
    private final Map<String, WorkflowDefinition> workflows = new TreeMap<>();

    /** task name to tool name */
    private final Map<String, String> uses = new HashMap<>();

    /** workflow name to (task name to order) */
    private final Map<String, Map<String, Integer>> contains = new HashMap<>();

    private final Map<EntityKind, Map<String, Set<String>>> fulltext = new EnumMap<>(EntityKind.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryGraphStore() {
        for (EntityKind kind : EntityKind.values()) {
            fulltext.put(kind, new HashMap<>());
        }
        log.info("Initialized in-memory GraphStore");
    }

    // =========================================================================
    // Generic Node / Relationship Operations
    // =========================================================================

    @Override
    public void upsertNode(EntityKind kind, String key, Map<String, Object> properties) {
        write(() -> {
            switch (kind) {
                case TOOL -> {
                    ToolDefinition tool = tools.computeIfAbsent(key,
                        name -> ToolDefinition.builder().id(newId()).name(name).build());
                    applyCommon(kind, key, properties, tool::setDescription, tool::setEmbedding);
                    if (properties.containsKey("callable")) {
                        tool.setCallable((String) properties.get("callable"));
                    }
                }
                case TASK -> {
                    TaskDefinition task = tasks.computeIfAbsent(key,
                        name -> TaskDefinition.builder().id(newId()).name(name).build());
                    applyCommon(kind, key, properties, task::setDescription, task::setEmbedding);
                    if (properties.containsKey("toolName")) {
                        task.setToolName((String) properties.get("toolName"));
                    }
                }
                case WORKFLOW -> {
                    WorkflowDefinition workflow = workflows.computeIfAbsent(key,
                        name -> WorkflowDefinition.builder().id(newId()).name(name).build());
                    applyCommon(kind, key, properties, workflow::setDescription, workflow::setEmbedding);
                }
            }
            return null;
        });
    }

    @Override
    public void upsertRelationship(String fromKey, String toKey, RelationshipType type, Map<String, Object> properties) {
        write(() -> {
            if (type == RelationshipType.USES) {
                requireTask(fromKey);
                requireTool(toKey);
                uses.put(fromKey, toKey);
                return null;
            }
            requireWorkflow(fromKey);
            requireTask(toKey);
            Object order = properties != null ? properties.get("order") : null;
            if (!(order instanceof Number number)) {
                throw new ConstraintViolationException("CONTAINS relationship requires an integer 'order' property");
            }
            Map<String, Integer> edges = contains.computeIfAbsent(fromKey, name -> new LinkedHashMap<>());
            edges.forEach((taskName, existing) -> {
                if (existing == number.intValue() && !taskName.equals(toKey)) {
                    throw new ConstraintViolationException(String.format(
                        "Order %d of workflow '%s' is already held by task '%s'", existing, fromKey, taskName));
                }
            });
            edges.put(toKey, number.intValue());
            return null;
        });
    }

    // =========================================================================
    // Typed Writes
    // =========================================================================

    @Override
    public void saveTool(ToolDefinition tool) {
        write(() -> {
            ToolDefinition stored = tools.computeIfAbsent(tool.getName(),
                name -> ToolDefinition.builder().id(newId()).name(name).build());
            stored.setDescription(tool.getDescription());
            stored.setCallable(tool.resolveCallable());
            stored.setEmbedding(copy(tool.getEmbedding()));
            index(EntityKind.TOOL, tool.getName(), tool.indexText());
            return null;
        });
    }

    @Override
    public void saveTask(TaskDefinition task) {
        write(() -> {
            requireTool(task.getToolName());
            TaskDefinition stored = tasks.computeIfAbsent(task.getName(),
                name -> TaskDefinition.builder().id(newId()).name(name).build());
            stored.setDescription(task.getDescription());
            stored.setToolName(task.getToolName());
            stored.setEmbedding(copy(task.getEmbedding()));
            uses.put(task.getName(), task.getToolName());
            index(EntityKind.TASK, task.getName(), task.indexText());
            return null;
        });
    }

    @Override
    public void saveWorkflow(WorkflowDefinition workflow, List<TaskRef> refs) {
        TaskRefValidator.validate(workflow.getName(), refs);
        write(() -> {
            for (TaskRef ref : refs) {
                if (!tasks.containsKey(ref.getName())) {
                    throw new NotFoundException(EntityKind.TASK, ref.getName(),
                        "Task not found: " + ref.getName() + " (referenced by workflow " + workflow.getName() + ")");
                }
            }
            WorkflowDefinition stored = workflows.computeIfAbsent(workflow.getName(),
                name -> WorkflowDefinition.builder().id(newId()).name(name).build());
            stored.setDescription(workflow.getDescription());
            stored.setEmbedding(copy(workflow.getEmbedding()));
            index(EntityKind.WORKFLOW, workflow.getName(), workflow.indexText());

            Map<String, Integer> edges = new LinkedHashMap<>();
            refs.forEach(ref -> edges.put(ref.getName(), ref.getOrder()));
            contains.put(workflow.getName(), edges);
            return null;
        });
    }

    @Override
    public void addTaskToWorkflow(String workflowName, String taskName, int order) {
        write(() -> {
            requireWorkflow(workflowName);
            requireTask(taskName);
            Map<String, Integer> edges = contains.computeIfAbsent(workflowName, name -> new LinkedHashMap<>());
            if (edges.containsKey(taskName)) {
                throw new ConstraintViolationException(String.format(
                    "Task '%s' is already part of workflow '%s'", taskName, workflowName));
            }
            edges.replaceAll((name, existing) -> existing >= order ? existing + 1 : existing);
            edges.put(taskName, order);
            return null;
        });
    }

    @Override
    public boolean removeTaskFromWorkflow(String workflowName, String taskName) {
        return write(() -> {
            Map<String, Integer> edges = contains.get(workflowName);
            Integer removed = edges != null ? edges.remove(taskName) : null;
            if (removed == null) {
                return false;
            }
            edges.replaceAll((name, existing) -> existing > removed ? existing - 1 : existing);
            return true;
        });
    }

    // =========================================================================
    // Reads
    // =========================================================================

    @Override
    public Optional<ToolDefinition> findTool(String name) {
        return read(() -> Optional.ofNullable(tools.get(name)).map(tool -> tool.toBuilder().build()));
    }

    @Override
    public Optional<TaskDefinition> findTask(String name) {
        return read(() -> Optional.ofNullable(tasks.get(name)).map(task -> task.toBuilder().build()));
    }

    @Override
    public Optional<WorkflowDefinition> findWorkflow(String name) {
        return read(() -> Optional.ofNullable(workflows.get(name)).map(workflow -> workflow.toBuilder().build()));
    }

    @Override
    public List<ToolDefinition> listTools() {
        return read(() -> tools.values().stream().map(tool -> tool.toBuilder().build()).collect(Collectors.toList()));
    }

    @Override
    public List<TaskDefinition> listTasks() {
        return read(() -> tasks.values().stream().map(task -> task.toBuilder().build()).collect(Collectors.toList()));
    }

    @Override
    public List<WorkflowDefinition> listWorkflows() {
        return read(() -> workflows.values().stream()
            .map(workflow -> workflow.toBuilder().build())
            .collect(Collectors.toList()));
    }

    @Override
    public List<OrderedTask> getOrderedTasks(String workflowName) {
        return read(() -> {
            requireWorkflow(workflowName);
            Map<String, Integer> edges = contains.getOrDefault(workflowName, Map.of());
            List<OrderedTask> ordered = new ArrayList<>();
            edges.forEach((taskName, order) -> ordered.add(OrderedTask.builder()
                .order(order)
                .task(tasks.get(taskName).toBuilder().build())
                .toolName(boundTool(taskName))
                .build()));
            ordered.sort(Comparator.comparingInt(OrderedTask::getOrder));
            return ordered;
        });
    }

    @Override
    public ToolDefinition getToolForTask(String taskName) {
        return read(() -> {
            requireTask(taskName);
            String toolName = uses.get(taskName);
            ToolDefinition tool = toolName != null ? tools.get(toolName) : null;
            if (tool == null) {
                throw new NotFoundException(EntityKind.TOOL, taskName, "Task '" + taskName + "' is not bound to a tool");
            }
            return tool.toBuilder().build();
        });
    }

    @Override
    public List<WorkflowMembership> findWorkflowsContaining(String taskName) {
        return read(() -> contains.entrySet().stream()
            .filter(entry -> entry.getValue().containsKey(taskName))
            .map(entry -> new WorkflowMembership(entry.getKey(), entry.getValue().get(taskName)))
            .sorted(Comparator.comparing(WorkflowMembership::getWorkflowName))
            .collect(Collectors.toList()));
    }

    @Override
    public List<String> findTasksUsingTool(String toolName) {
        return read(() -> uses.entrySet().stream()
            .filter(entry -> entry.getValue().equals(toolName))
            .map(Map.Entry::getKey)
            .sorted()
            .collect(Collectors.toList()));
    }

    // =========================================================================
    // Index Queries
    // =========================================================================

    @Override
    public List<ScoredKey> queryByEmbeddingSimilarity(EntityKind kind, List<Double> vector, int topK) {
        return read(() -> entities(kind).stream()
            .filter(entity -> entity.getEmbedding() != null)
            .map(entity -> new ScoredKey(entity.getName(), cosine(vector, entity.getEmbedding())))
            .filter(candidate -> candidate.score() > 0)
            .sorted(Comparator.comparingDouble(ScoredKey::score).reversed().thenComparing(ScoredKey::key))
            .limit(topK)
            .collect(Collectors.toList()));
    }

    @Override
    public List<ScoredKey> queryByFulltext(EntityKind kind, String text, int topK) {
        Set<String> queryTokens = tokenize(text);
        if (queryTokens.isEmpty()) {
            return List.of();
        }
        return read(() -> fulltext.get(kind).entrySet().stream()
            .map(entry -> {
                long matched = queryTokens.stream().filter(entry.getValue()::contains).count();
                return new ScoredKey(entry.getKey(), (double) matched / queryTokens.size());
            })
            .filter(candidate -> candidate.score() > 0)
            .sorted(Comparator.comparingDouble(ScoredKey::score).reversed().thenComparing(ScoredKey::key))
            .limit(topK)
            .collect(Collectors.toList()));
    }

    // =========================================================================
    // Deletes
    // =========================================================================

    @Override
    public boolean deleteTool(String name) {
        return write(() -> {
            if (tools.remove(name) == null) {
                return false;
            }
            uses.values().removeIf(name::equals);
            fulltext.get(EntityKind.TOOL).remove(name);
            return true;
        });
    }

    @Override
    public boolean deleteTask(String name) {
        return write(() -> {
            if (!tasks.containsKey(name)) {
                return false;
            }
            long containers = contains.values().stream().filter(edges -> edges.containsKey(name)).count();
            if (containers > 0) {
                throw new ConstraintViolationException(String.format(
                    "Task '%s' is still contained by %d workflow(s)", name, containers));
            }
            tasks.remove(name);
            uses.remove(name);
            fulltext.get(EntityKind.TASK).remove(name);
            return true;
        });
    }

    @Override
    public boolean deleteWorkflow(String name) {
        return write(() -> {
            if (workflows.remove(name) == null) {
                return false;
            }
            contains.remove(name);
            fulltext.get(EntityKind.WORKFLOW).remove(name);
            return true;
        });
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("In-memory GraphStore closed");
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private <T> T write(Supplier<T> action) {
        ensureOpen();
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> action) {
        ensureOpen();
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("GraphStore is closed");
        }
    }

    @SuppressWarnings("unchecked")
    private void applyCommon(EntityKind kind, String key, Map<String, Object> properties,
                             Consumer<String> description,
                             Consumer<List<Double>> embedding) {
        if (properties.containsKey("description")) {
            description.accept((String) properties.get("description"));
        }
        if (properties.containsKey("embedding")) {
            embedding.accept(copy((List<Double>) properties.get("embedding")));
        }
        if (properties.containsKey("searchText")) {
            index(kind, key, (String) properties.get("searchText"));
        }
    }

    private List<? extends CatalogEntity> entities(EntityKind kind) {
        return switch (kind) {
            case TOOL -> new ArrayList<>(tools.values());
            case TASK -> new ArrayList<>(tasks.values());
            case WORKFLOW -> new ArrayList<>(workflows.values());
        };
    }

    private String boundTool(String taskName) {
        String toolName = uses.get(taskName);
        return toolName != null && tools.containsKey(toolName) ? toolName : null;
    }

    private void index(EntityKind kind, String name, String text) {
        fulltext.get(kind).put(name, tokenize(text));
    }

    private void requireTool(String name) {
        if (name == null || !tools.containsKey(name)) {
            throw new NotFoundException(EntityKind.TOOL, name);
        }
    }

    private void requireTask(String name) {
        if (!tasks.containsKey(name)) {
            throw new NotFoundException(EntityKind.TASK, name);
        }
    }

    private void requireWorkflow(String name) {
        if (!workflows.containsKey(name)) {
            throw new NotFoundException(EntityKind.WORKFLOW, name);
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static List<Double> copy(List<Double> embedding) {
        return embedding == null ? null : List.copyOf(embedding);
    }

    static Set<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
            .filter(token -> !token.isBlank())
            .collect(Collectors.toSet());
    }

    static double cosine(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.size() != b.size() || a.isEmpty()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            dot += a.get(i) * b.get(i);
            normA += a.get(i) * a.get(i);
            normB += b.get(i) * b.get(i);
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
