package com.purchasingpower.flowgraph.knowledge.impl;

import com.purchasingpower.flowgraph.configuration.GraphProperties;
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
import com.purchasingpower.flowgraph.exception.FlowGraphException;
import com.purchasingpower.flowgraph.exception.GraphStoreException;
import com.purchasingpower.flowgraph.exception.NotFoundException;
import com.purchasingpower.flowgraph.knowledge.GraphStore;
import com.purchasingpower.flowgraph.knowledge.TaskRefValidator;
import com.purchasingpower.flowgraph.util.NamedLockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.types.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Neo4j implementation of GraphStore interface.
 *
 * <p>Each public write runs in a single managed write transaction, so a failure
 * anywhere inside it leaves the graph untouched.
 *
 * @since 1.0.0
 */
@Slf4j
public class Neo4jGraphStoreImpl implements GraphStore {

    private static final String CONSTRAINT_VALIDATION_FAILED = "Neo.ClientError.Schema.ConstraintValidationFailed";
    private static final Set<String> LUCENE_OPERATORS = Set.of("AND", "OR", "NOT");

    private final GraphProperties properties;
    private final NamedLockRegistry workflowLocks = new NamedLockRegistry();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Driver driver;

    public Neo4jGraphStoreImpl(GraphProperties properties) {
        this.properties = properties;
    }

    public void init() {
        log.info("Initializing Neo4j GraphStore at: {} (database: {})", properties.getUri(), properties.getDatabase());
        driver = GraphDatabase.driver(properties.getUri(),
                AuthTokens.basic(properties.getUsername(), properties.getPassword()));
        createSchema();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && driver != null) {
            driver.close();
            log.info("Neo4j GraphStore connection closed");
        }
    }

    private void createSchema() {
        try (Session session = session()) {
            for (EntityKind kind : EntityKind.values()) {
                String label = kind.getLabel();
                session.run("CREATE CONSTRAINT " + label.toLowerCase() + "_name IF NOT EXISTS "
                    + "FOR (n:" + label + ") REQUIRE n.name IS UNIQUE");
            }
            log.info("Neo4j uniqueness constraints created");

            createSearchIndexes(session);

        } catch (Exception e) {
            log.warn("Failed to create schema: {}", e.getMessage());
        }
    }

    private void createSearchIndexes(Session session) {
        try {
            for (EntityKind kind : EntityKind.values()) {
                String vectorIndex = """
                    CREATE VECTOR INDEX %s IF NOT EXISTS
                    FOR (n:%s) ON (n.embedding)
                    OPTIONS {indexConfig: {
                      `vector.dimensions`: %d,
                      `vector.similarity_function`: 'cosine'
                    }}
                    """.formatted(kind.getVectorIndex(), kind.getLabel(), properties.getEmbeddingDimensions());
                session.run(vectorIndex);

                String fulltextIndex = """
                    CREATE FULLTEXT INDEX %s IF NOT EXISTS
                    FOR (n:%s) ON EACH [n.name, n.description, n.searchText]
                    """.formatted(kind.getFulltextIndex(), kind.getLabel());
                session.run(fulltextIndex);

                log.info("Created search indexes: {}, {}", kind.getVectorIndex(), kind.getFulltextIndex());
            }
        } catch (Exception e) {
            log.warn("Failed to create search indexes (requires Neo4j 5.11+): {}", e.getMessage());
        }
    }

    // =========================================================================
    // Generic Node / Relationship Operations
    // =========================================================================

    @Override
    public void upsertNode(EntityKind kind, String key, Map<String, Object> nodeProperties) {
        Map<String, Object> props = new HashMap<>(nodeProperties);
        props.remove("name");
        props.remove("id");

        write(tx -> {
            mergeNode(tx, kind, key, props);
            return null;
        });
    }

    @Override
    public void upsertRelationship(String fromKey, String toKey, RelationshipType type, Map<String, Object> relProperties) {
        if (type == RelationshipType.CONTAINS) {
            int order = requireOrder(relProperties);
            workflowLocks.withLock(fromKey, () -> write(tx -> {
                requireNode(tx, EntityKind.WORKFLOW, fromKey);
                requireNode(tx, EntityKind.TASK, toKey);
                Result conflict = tx.run("""
                    MATCH (w:Workflow {name: $workflow})-[r:CONTAINS]->(t:Task)
                    WHERE r.order = $order AND t.name <> $task
                    RETURN t.name AS name
                    """, params("workflow", fromKey, "task", toKey, "order", order));
                if (conflict.hasNext()) {
                    throw new ConstraintViolationException(String.format(
                        "Order %d of workflow '%s' is already held by task '%s'",
                        order, fromKey, conflict.next().get("name").asString()));
                }
                tx.run("""
                    MATCH (w:Workflow {name: $workflow}), (t:Task {name: $task})
                    MERGE (w)-[r:CONTAINS]->(t)
                    SET r += $props
                    """, params("workflow", fromKey, "task", toKey, "props", relProperties));
                return null;
            }));
        } else {
            write(tx -> {
                requireNode(tx, EntityKind.TASK, fromKey);
                requireNode(tx, EntityKind.TOOL, toKey);
                bindTool(tx, fromKey, toKey, relProperties);
                return null;
            });
        }
    }

    // =========================================================================
    // Typed Writes
    // =========================================================================

    @Override
    public void saveTool(ToolDefinition tool) {
        write(tx -> {
            mergeNode(tx, EntityKind.TOOL, tool.getName(), entityProperties(
                "description", tool.getDescription(),
                "callable", tool.resolveCallable(),
                "embedding", tool.getEmbedding(),
                "searchText", tool.indexText()));
            return null;
        });
    }

    @Override
    public void saveTask(TaskDefinition task) {
        write(tx -> {
            requireNode(tx, EntityKind.TOOL, task.getToolName());
            mergeNode(tx, EntityKind.TASK, task.getName(), entityProperties(
                "description", task.getDescription(),
                "toolName", task.getToolName(),
                "embedding", task.getEmbedding(),
                "searchText", task.indexText()));
            bindTool(tx, task.getName(), task.getToolName(), Map.of());
            return null;
        });
    }

    @Override
    public void saveWorkflow(WorkflowDefinition workflow, List<TaskRef> tasks) {
        TaskRefValidator.validate(workflow.getName(), tasks);

        List<Map<String, Object>> refs = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (TaskRef ref : tasks) {
            refs.add(Map.of("name", ref.getName(), "order", ref.getOrder()));
            names.add(ref.getName());
        }

        workflowLocks.withLock(workflow.getName(), () -> write(tx -> {
            Result missing = tx.run("""
                UNWIND $names AS taskName
                OPTIONAL MATCH (t:Task {name: taskName})
                WITH taskName, t WHERE t IS NULL
                RETURN taskName
                """, params("names", names));
            if (missing.hasNext()) {
                String taskName = missing.next().get("taskName").asString();
                throw new NotFoundException(EntityKind.TASK, taskName,
                    "Task not found: " + taskName + " (referenced by workflow " + workflow.getName() + ")");
            }

            mergeNode(tx, EntityKind.WORKFLOW, workflow.getName(), entityProperties(
                "description", workflow.getDescription(),
                "embedding", workflow.getEmbedding(),
                "searchText", workflow.indexText()));

            tx.run("MATCH (:Workflow {name: $name})-[r:CONTAINS]->() DELETE r", params("name", workflow.getName()));
            tx.run("""
                MATCH (w:Workflow {name: $name})
                UNWIND $refs AS ref
                MATCH (t:Task {name: ref.name})
                CREATE (w)-[:CONTAINS {order: ref.order}]->(t)
                """, params("name", workflow.getName(), "refs", refs));
            return null;
        }));
    }

    @Override
    public void addTaskToWorkflow(String workflowName, String taskName, int order) {
        workflowLocks.withLock(workflowName, () -> write(tx -> {
            requireNode(tx, EntityKind.WORKFLOW, workflowName);
            requireNode(tx, EntityKind.TASK, taskName);

            Result existing = tx.run("""
                MATCH (:Workflow {name: $workflow})-[r:CONTAINS]->(:Task {name: $task})
                RETURN r.order AS order
                """, params("workflow", workflowName, "task", taskName));
            if (existing.hasNext()) {
                throw new ConstraintViolationException(String.format(
                    "Task '%s' is already part of workflow '%s'", taskName, workflowName));
            }

            tx.run("""
                MATCH (:Workflow {name: $workflow})-[r:CONTAINS]->(:Task)
                WHERE r.order >= $order
                SET r.order = r.order + 1
                """, params("workflow", workflowName, "order", order));
            tx.run("""
                MATCH (w:Workflow {name: $workflow}), (t:Task {name: $task})
                CREATE (w)-[:CONTAINS {order: $order}]->(t)
                """, params("workflow", workflowName, "task", taskName, "order", order));
            return null;
        }));
    }

    @Override
    public boolean removeTaskFromWorkflow(String workflowName, String taskName) {
        return workflowLocks.withLock(workflowName, () -> write(tx -> {
            Result removed = tx.run("""
                MATCH (:Workflow {name: $workflow})-[r:CONTAINS]->(:Task {name: $task})
                WITH r, r.order AS removedOrder
                DELETE r
                RETURN removedOrder
                """, params("workflow", workflowName, "task", taskName));
            if (!removed.hasNext()) {
                return false;
            }
            int removedOrder = removed.next().get("removedOrder").asInt();
            tx.run("""
                MATCH (:Workflow {name: $workflow})-[r:CONTAINS]->(:Task)
                WHERE r.order > $removedOrder
                SET r.order = r.order - 1
                """, params("workflow", workflowName, "removedOrder", removedOrder));
            return true;
        }));
    }

    // =========================================================================
    // Reads
    // =========================================================================

    @Override
    public Optional<ToolDefinition> findTool(String name) {
        return read(tx -> {
            Result result = tx.run("MATCH (n:Tool {name: $name}) RETURN n", params("name", name));
            return result.hasNext()
                ? Optional.of(nodeToTool(result.next().get("n").asNode()))
                : Optional.empty();
        });
    }

    @Override
    public Optional<TaskDefinition> findTask(String name) {
        return read(tx -> {
            Result result = tx.run("MATCH (n:Task {name: $name}) RETURN n", params("name", name));
            return result.hasNext()
                ? Optional.of(nodeToTask(result.next().get("n").asNode()))
                : Optional.empty();
        });
    }

    @Override
    public Optional<WorkflowDefinition> findWorkflow(String name) {
        return read(tx -> {
            Result result = tx.run("MATCH (n:Workflow {name: $name}) RETURN n", params("name", name));
            return result.hasNext()
                ? Optional.of(nodeToWorkflow(result.next().get("n").asNode()))
                : Optional.empty();
        });
    }

    @Override
    public List<ToolDefinition> listTools() {
        return read(tx -> tx.run("MATCH (n:Tool) RETURN n ORDER BY n.name")
            .list(record -> nodeToTool(record.get("n").asNode())));
    }

    @Override
    public List<TaskDefinition> listTasks() {
        return read(tx -> tx.run("MATCH (n:Task) RETURN n ORDER BY n.name")
            .list(record -> nodeToTask(record.get("n").asNode())));
    }

    @Override
    public List<WorkflowDefinition> listWorkflows() {
        return read(tx -> tx.run("MATCH (n:Workflow) RETURN n ORDER BY n.name")
            .list(record -> nodeToWorkflow(record.get("n").asNode())));
    }

    @Override
    public List<OrderedTask> getOrderedTasks(String workflowName) {
        return read(tx -> {
            requireNode(tx, EntityKind.WORKFLOW, workflowName);
            Result result = tx.run("""
                MATCH (:Workflow {name: $name})-[r:CONTAINS]->(t:Task)
                OPTIONAL MATCH (t)-[:USES]->(tool:Tool)
                RETURN t, r.order AS order, tool.name AS toolName
                ORDER BY r.order ASC
                """, params("name", workflowName));
            return result.list(record -> OrderedTask.builder()
                .order(record.get("order").asInt())
                .task(nodeToTask(record.get("t").asNode()))
                .toolName(record.get("toolName").isNull() ? null : record.get("toolName").asString())
                .build());
        });
    }

    @Override
    public ToolDefinition getToolForTask(String taskName) {
        return read(tx -> {
            Result result = tx.run("""
                MATCH (t:Task {name: $name})
                OPTIONAL MATCH (t)-[:USES]->(tool:Tool)
                RETURN tool
                """, params("name", taskName));
            if (!result.hasNext()) {
                throw new NotFoundException(EntityKind.TASK, taskName);
            }
            Value tool = result.next().get("tool");
            if (tool.isNull()) {
                throw new NotFoundException(EntityKind.TOOL, taskName, "Task '" + taskName + "' is not bound to a tool");
            }
            return nodeToTool(tool.asNode());
        });
    }

    @Override
    public List<WorkflowMembership> findWorkflowsContaining(String taskName) {
        return read(tx -> tx.run("""
                MATCH (w:Workflow)-[r:CONTAINS]->(:Task {name: $name})
                RETURN w.name AS workflow, r.order AS order
                ORDER BY w.name
                """, params("name", taskName))
            .list(record -> new WorkflowMembership(record.get("workflow").asString(), record.get("order").asInt())));
    }

    @Override
    public List<String> findTasksUsingTool(String toolName) {
        return read(tx -> tx.run("""
                MATCH (t:Task)-[:USES]->(:Tool {name: $name})
                RETURN t.name AS task
                ORDER BY t.name
                """, params("name", toolName))
            .list(record -> record.get("task").asString()));
    }

    // =========================================================================
    // Index Queries
    // =========================================================================

    @Override
    public List<ScoredKey> queryByEmbeddingSimilarity(EntityKind kind, List<Double> vector, int topK) {
        return read(tx -> tx.run("""
                CALL db.index.vector.queryNodes($index, $topK, $vector)
                YIELD node, score
                RETURN node.name AS name, score
                """, params("index", kind.getVectorIndex(), "topK", topK, "vector", vector))
            .list(this::toScoredKey));
    }

    @Override
    public List<ScoredKey> queryByFulltext(EntityKind kind, String text, int topK) {
        String query = escapeLucene(text);
        if (query.isBlank()) {
            return List.of();
        }
        return read(tx -> tx.run("""
                CALL db.index.fulltext.queryNodes($index, $query, {limit: $topK})
                YIELD node, score
                RETURN node.name AS name, score
                """, params("index", kind.getFulltextIndex(), "query", query, "topK", topK))
            .list(this::toScoredKey));
    }

    // =========================================================================
    // Deletes
    // =========================================================================

    @Override
    public boolean deleteTool(String name) {
        return write(tx -> tx.run("MATCH (n:Tool {name: $name}) DETACH DELETE n RETURN count(n) AS deleted",
            params("name", name)).single().get("deleted").asLong() > 0);
    }

    @Override
    public boolean deleteTask(String name) {
        return write(tx -> {
            Result result = tx.run("""
                MATCH (n:Task {name: $name})
                OPTIONAL MATCH (w:Workflow)-[:CONTAINS]->(n)
                RETURN count(w) AS containers
                """, params("name", name));
            if (!result.hasNext()) {
                return false;
            }
            long containers = result.next().get("containers").asLong();
            if (containers > 0) {
                throw new ConstraintViolationException(String.format(
                    "Task '%s' is still contained by %d workflow(s)", name, containers));
            }
            return tx.run("MATCH (n:Task {name: $name}) DETACH DELETE n RETURN count(n) AS deleted",
                params("name", name)).single().get("deleted").asLong() > 0;
        });
    }

    @Override
    public boolean deleteWorkflow(String name) {
        return workflowLocks.withLock(name, () -> write(tx ->
            tx.run("MATCH (n:Workflow {name: $name}) DETACH DELETE n RETURN count(n) AS deleted",
                params("name", name)).single().get("deleted").asLong() > 0));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private Session session() {
        if (closed.get()) {
            throw new IllegalStateException("GraphStore is closed");
        }
        return driver.session(SessionConfig.forDatabase(properties.getDatabase()));
    }

    private <T> T write(TransactionCallback<T> work) {
        try (Session session = session()) {
            return session.executeWrite(work);
        } catch (FlowGraphException e) {
            throw e;
        } catch (ClientException e) {
            if (CONSTRAINT_VALIDATION_FAILED.equals(e.code())) {
                throw new ConstraintViolationException(e.getMessage(), e);
            }
            throw new GraphStoreException("Neo4j write failed: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j write failed: " + e.getMessage(), e);
        }
    }

    private <T> T read(TransactionCallback<T> work) {
        try (Session session = session()) {
            return session.executeRead(work);
        } catch (FlowGraphException e) {
            throw e;
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j read failed: " + e.getMessage(), e);
        }
    }

    private void mergeNode(TransactionContext tx, EntityKind kind, String name, Map<String, Object> props) {
        tx.run("MERGE (n:" + kind.getLabel() + " {name: $name}) "
            + "ON CREATE SET n.id = randomUUID() "
            + "SET n += $props", params("name", name, "props", props));
    }

    private void requireNode(TransactionContext tx, EntityKind kind, String name) {
        Result result = tx.run("MATCH (n:" + kind.getLabel() + " {name: $name}) RETURN count(n) AS found",
            params("name", name));
        if (result.single().get("found").asLong() == 0) {
            throw new NotFoundException(kind, name);
        }
    }

    private void bindTool(TransactionContext tx, String taskName, String toolName, Map<String, Object> relProperties) {
        tx.run("MATCH (:Task {name: $task})-[old:USES]->() DELETE old", params("task", taskName));
        tx.run("""
            MATCH (t:Task {name: $task}), (tool:Tool {name: $tool})
            MERGE (t)-[r:USES]->(tool)
            SET r += $props
            """, params("task", taskName, "tool", toolName, "props", relProperties));
    }

    private int requireOrder(Map<String, Object> relProperties) {
        Object order = relProperties != null ? relProperties.get("order") : null;
        if (!(order instanceof Number number)) {
            throw new ConstraintViolationException("CONTAINS relationship requires an integer 'order' property");
        }
        return number.intValue();
    }

    private ScoredKey toScoredKey(Record record) {
        return new ScoredKey(record.get("name").asString(), record.get("score").asDouble());
    }

    private ToolDefinition nodeToTool(Node node) {
        return ToolDefinition.builder()
            .id(stringOrNull(node, "id"))
            .name(node.get("name").asString())
            .description(stringOrNull(node, "description"))
            .callable(stringOrNull(node, "callable"))
            .embedding(embeddingOrNull(node))
            .build();
    }

    private TaskDefinition nodeToTask(Node node) {
        return TaskDefinition.builder()
            .id(stringOrNull(node, "id"))
            .name(node.get("name").asString())
            .description(stringOrNull(node, "description"))
            .toolName(stringOrNull(node, "toolName"))
            .embedding(embeddingOrNull(node))
            .build();
    }

    private WorkflowDefinition nodeToWorkflow(Node node) {
        return WorkflowDefinition.builder()
            .id(stringOrNull(node, "id"))
            .name(node.get("name").asString())
            .description(stringOrNull(node, "description"))
            .embedding(embeddingOrNull(node))
            .build();
    }

    private String stringOrNull(Node node, String key) {
        Value value = node.get(key);
        return value.isNull() ? null : value.asString();
    }

    private List<Double> embeddingOrNull(Node node) {
        Value value = node.get("embedding");
        return value.isNull() ? null : value.asList(Value::asDouble);
    }

    private Map<String, Object> entityProperties(Object... keysAndValues) {
        // HashMap, not Map.of: a null embedding must reach SET += and clear the property
        Map<String, Object> props = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            props.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return props;
    }

    private Map<String, Object> params(Object... keysAndValues) {
        return entityProperties(keysAndValues);
    }

    /**
     * Turns free text into a Lucene query that cannot fail to parse: special
     * characters are escaped and bare AND, OR and NOT become plain terms.
     */
    static String escapeLucene(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (String token : text.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            if (escaped.length() > 0) {
                escaped.append(' ');
            }
            if (LUCENE_OPERATORS.contains(token)) {
                escaped.append(token.toLowerCase(Locale.ROOT));
                continue;
            }
            for (char c : token.toCharArray()) {
                if ("+-&|!(){}[]^\"~*?:\\/".indexOf(c) >= 0) {
                    escaped.append('\\');
                }
                escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
