package com.purchasingpower.flowgraph.service.impl;

import com.purchasingpower.flowgraph.configuration.FlowGraphProperties;
import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.core.OrderedTask;
import com.purchasingpower.flowgraph.core.TaskDefinition;
import com.purchasingpower.flowgraph.core.TaskRef;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.core.WorkflowDefinition;
import com.purchasingpower.flowgraph.exception.ConstraintViolationException;
import com.purchasingpower.flowgraph.exception.EmbeddingServiceException;
import com.purchasingpower.flowgraph.exception.NotFoundException;
import com.purchasingpower.flowgraph.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.flowgraph.knowledge.impl.IndexingServiceImpl;
import com.purchasingpower.flowgraph.model.catalog.WorkflowDetails;
import com.purchasingpower.flowgraph.search.SearchHit;
import com.purchasingpower.flowgraph.search.impl.HybridSearchServiceImpl;
import com.purchasingpower.flowgraph.service.WorkflowExecutionService;
import com.purchasingpower.flowgraph.support.KeywordEmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Tests for WorkflowCatalogServiceImpl wired against the in-memory store.
 */
class WorkflowCatalogServiceImplTest {

    private InMemoryGraphStore store;
    private KeywordEmbeddingService embeddings;
    private FlowGraphProperties properties;
    private WorkflowExecutionService executionService;
    private WorkflowCatalogServiceImpl catalog;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        embeddings = KeywordEmbeddingService.defaults();
        properties = new FlowGraphProperties();
        executionService = mock(WorkflowExecutionService.class);
        catalog = new WorkflowCatalogServiceImpl(store,
            new IndexingServiceImpl(embeddings, store, properties),
            executionService,
            new HybridSearchServiceImpl(embeddings, store, properties));
    }

    @Test
    @DisplayName("Re-creating a tool updates it in place and recomputes its embedding")
    void createTool_twice_updatesInPlace() {
        ToolDefinition first = catalog.createTool("adder", "add numbers", null);
        ToolDefinition second = catalog.createTool("adder", "produce a report", null);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getDescription()).isEqualTo("produce a report");
        assertThat(second.getEmbedding()).isNotEqualTo(first.getEmbedding());
        assertThat(catalog.listTools()).hasSize(1);
    }

    @Test
    void createTask_twice_updatesInPlace() {
        catalog.createTool("adder", "add numbers", null);
        TaskDefinition first = catalog.createTask("crunch", "add numbers", "adder");
        String firstId = first.getId();
        List<Double> firstEmbedding = first.getEmbedding();

        TaskDefinition second = catalog.createTask("crunch", "produce a report", "adder");

        assertThat(second.getId()).isEqualTo(firstId);
        assertThat(second.getDescription()).isEqualTo("produce a report");
        assertThat(second.getEmbedding()).isEqualTo(List.of(0.0, 0.0, 1.0)).isNotEqualTo(firstEmbedding);
        assertThat(catalog.listTasks()).hasSize(1);
    }

    @Test
    void createWorkflow_twice_updatesInPlace() {
        catalog.createTool("adder", "add numbers", null);
        catalog.createTask("crunch", "step", "adder");
        WorkflowDefinition first = catalog.createWorkflow("pipeline", "sum numbers",
            List.of(TaskRef.of("crunch", 0))).getWorkflow();
        String firstId = first.getId();
        List<Double> firstEmbedding = first.getEmbedding();

        WorkflowDefinition second = catalog.createWorkflow("pipeline", "quarterly insights",
            List.of(TaskRef.of("crunch", 0))).getWorkflow();

        assertThat(second.getId()).isEqualTo(firstId);
        assertThat(second.getDescription()).isEqualTo("quarterly insights");
        assertThat(second.getEmbedding()).isEqualTo(List.of(1.0, 0.0, 0.0)).isNotEqualTo(firstEmbedding);
        assertThat(catalog.listWorkflows()).hasSize(1);
    }

    @Test
    void createTool_changingCallable_isRejected() {
        catalog.createTool("adder", "add numbers", "math.add");

        assertThatThrownBy(() -> catalog.createTool("adder", "add numbers", "math.sum"))
            .isInstanceOf(ConstraintViolationException.class);

        ToolDefinition kept = catalog.createTool("adder", "adds two numbers", null);
        assertThat(kept.getCallable()).isEqualTo("math.add");
    }

    @Test
    void createTask_unknownTool_isNotFound() {
        assertThatThrownBy(() -> catalog.createTask("t1", "task", "ghost"))
            .isInstanceOf(NotFoundException.class);

        assertThat(catalog.listTasks()).isEmpty();
    }

    @Test
    @DisplayName("Embedding failure leaves no node behind")
    void createTool_embeddingFailure_writesNothing() {
        embeddings.setFailing(true);

        assertThatThrownBy(() -> catalog.createTool("adder", "add numbers", null))
            .isInstanceOf(EmbeddingServiceException.class);

        assertThat(store.findTool("adder")).isEmpty();
    }

    @Test
    void createTool_embeddingFailure_storedUnindexedWhenSkipping() {
        properties.getIndexing().setSkipOnEmbeddingFailure(true);
        embeddings.setFailing(true);

        ToolDefinition tool = catalog.createTool("adder", "add numbers", null);

        assertThat(tool.getEmbedding()).isNull();

        embeddings.setFailing(false);
        assertThat(catalog.search(EntityKind.TOOL, "adder", 5))
            .extracting(SearchHit::getName).containsExactly("adder");

        catalog.reindex(EntityKind.TOOL, "adder");
        assertThat(store.findTool("adder").orElseThrow().getEmbedding()).containsExactly(0.0, 1.0, 0.0);
    }

    @Test
    void createWorkflow_returnsTasksInOrder() {
        catalog.createTool("adder", "add numbers", null);
        catalog.createTask("first", "step one", "adder");
        catalog.createTask("second", "step two", "adder");

        WorkflowDetails details = catalog.createWorkflow("wf", "two steps",
            List.of(TaskRef.of("second", 2), TaskRef.of("first", 1)));

        assertThat(details.getWorkflow().getName()).isEqualTo("wf");
        assertThat(details.getTasks()).extracting(OrderedTask::getTaskName).containsExactly("first", "second");
    }

    @Test
    void createWorkflow_duplicateTask_isRejected() {
        catalog.createTool("adder", "add numbers", null);
        catalog.createTask("first", "step one", "adder");

        assertThatThrownBy(() -> catalog.createWorkflow("wf", "twice",
            List.of(TaskRef.of("first", 1), TaskRef.of("first", 2))))
            .isInstanceOf(ConstraintViolationException.class);

        assertThat(catalog.listWorkflows()).isEmpty();
    }

    @Test
    void createWorkflow_taskWithoutOrder_isRejected() {
        catalog.createTool("adder", "add numbers", null);
        catalog.createTask("a", "step a", "adder");
        catalog.createTask("b", "step b", "adder");

        assertThatThrownBy(() -> catalog.createWorkflow("wf", "missing order",
            List.of(TaskRef.of("b", 1), TaskRef.builder().name("a").build())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'a'")
            .hasMessageContaining("no order");

        assertThat(catalog.listWorkflows()).isEmpty();
    }

    @Test
    void addAndRemoveTask_reorderWorkflow() {
        catalog.createTool("adder", "add numbers", null);
        catalog.createTask("a", "a", "adder");
        catalog.createTask("b", "b", "adder");
        catalog.createTask("c", "c", "adder");
        catalog.createWorkflow("wf", "steps", List.of(TaskRef.of("a", 0), TaskRef.of("b", 1)));

        WorkflowDetails added = catalog.addTaskToWorkflow("wf", "c", 0);
        assertThat(added.getTasks()).extracting(OrderedTask::getTaskName).containsExactly("c", "a", "b");

        WorkflowDetails removed = catalog.removeTaskFromWorkflow("wf", "a");
        assertThat(removed.getTasks()).extracting(OrderedTask::getTaskName).containsExactly("c", "b");
        assertThat(removed.getTasks()).extracting(OrderedTask::getOrder).containsExactly(0, 1);

        assertThatThrownBy(() -> catalog.removeTaskFromWorkflow("wf", "a"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void deletes_followContainmentRules() {
        catalog.createTool("adder", "add numbers", null);
        catalog.createTask("a", "a", "adder");
        catalog.createWorkflow("wf", "steps", List.of(TaskRef.of("a", 0)));

        assertThatThrownBy(() -> catalog.deleteTask("a")).isInstanceOf(ConstraintViolationException.class);

        catalog.deleteWorkflow("wf");
        catalog.deleteTask("a");
        catalog.deleteTool("adder");

        assertThatThrownBy(() -> catalog.deleteTool("adder")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> catalog.getWorkflow("wf")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void executeWorkflow_delegatesToEngine() {
        catalog.executeWorkflow("wf", Map.of("a", 1));

        verify(executionService).execute("wf", Map.of("a", 1));
    }

    @Test
    void close_isIdempotent() {
        catalog.close();
        catalog.close();

        assertThatThrownBy(() -> store.listTools()).isInstanceOf(IllegalStateException.class);
    }
}
