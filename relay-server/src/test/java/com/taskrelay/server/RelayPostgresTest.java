package com.taskrelay.server;

import com.taskrelay.core.model.NewSubtask;
import com.taskrelay.core.model.NewTask;
import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.StepDefinition;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.WorkerRole;
import com.taskrelay.core.repository.TaskRepository;
import com.taskrelay.engine.service.BoardService;
import com.taskrelay.server.test.TestWorkers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * The same schema and flow against a real PostgreSQL.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@Import(TestWorkers.class)
@Testcontainers(disabledWithoutDocker = true)
class RelayPostgresTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("relay_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private BoardService boardService;

    @Autowired
    private TaskRepository taskRepository;

    @Test
    void subtasksRunInDependencyOrderAndFanIn() {
        Project project = boardService.createProject("PG", "postgres flow", List.of(
            StepDefinition.manual("Backlog"),
            StepDefinition.dispatch("Build", WorkerRole.CODER),
            StepDefinition.manual("Done")));
        Task parent = boardService.createTask(project.projectId(),
            NewTask.of("Parent", "root"));

        List<Task> children = boardService.createSubtasks(parent.taskId(), List.of(
            NewSubtask.of("First", "runs first"),
            NewSubtask.of("Second", "waits for first", 0)));
        Task first = children.get(0);
        Task second = children.get(1);

        assertTrue(boardService.isBlocked(second.taskId()));
        assertTrue(TestWorkers.eventually(Duration.ofSeconds(10), () ->
            !boardService.getRuns(first.taskId()).isEmpty()));
        assertThat(boardService.getRuns(second.taskId())).isEmpty();

        boardService.completeTask(first.taskId());
        assertTrue(TestWorkers.eventually(Duration.ofSeconds(10), () ->
            !boardService.getRuns(second.taskId()).isEmpty()));

        boardService.completeTask(second.taskId());
        assertTrue(TestWorkers.eventually(Duration.ofSeconds(10), () ->
            taskRepository.findSynchronizationTask(parent.taskId()).isPresent()));
    }
}
