package io.maestro.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.maestro.core.plan.KeywordPlanner.Portion;
import io.maestro.core.task.TaskPriority;
import io.maestro.core.task.TaskSpec;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class KeywordPlannerTest {

    private static final Set<String> KNOWN = Set.of("crm", "sales", "inventory", "accounting");

    private KeywordPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new KeywordPlanner(KeywordCapabilityMatcher.standard());
    }

    @Nested
    class SplitTest {

        @Test
        void shouldSplitOnPunctuationAndConnectives() {
            String goal = "check stock; create invoice, email bob and call alice";
            assertThat(KeywordPlanner.split(goal))
                    .extracting(Portion::text)
                    .containsExactly("check stock", "create invoice", "email bob", "call alice");
        }

        @Test
        void shouldMarkPortionsIntroducedBySequencingConnective() {
            assertThat(
                            KeywordPlanner.split(
                                    "create a lead and then create an order after that bill them"))
                    .extracting(Portion::text, Portion::sequential)
                    .containsExactly(
                            tuple("create a lead", false),
                            tuple("create an order", true),
                            tuple("bill them", true));
        }

        @Test
        void shouldNotSplitInsideWords() {
            assertThat(KeywordPlanner.split("call Anderson at the Thenardier inn"))
                    .extracting(Portion::text)
                    .containsExactly("call Anderson at the Thenardier inn");
        }
    }

    @Nested
    class DecomposeTest {

        @Test
        void shouldPlanSingleCapability() {
            // When
            Plan plan = planner.decompose(PlanRequest.of("Create a lead for ACME Corp"), KNOWN);

            // Then
            assertThat(plan.tasks()).hasSize(1);
            TaskSpec task = plan.tasks().get(0);
            assertThat(task.capability()).isEqualTo("crm");
            assertThat(task.dependsOn()).isEmpty();
            assertThat(task.input()).containsEntry("goal", "Create a lead for ACME Corp");
            assertThat(plan.requestType()).isEqualTo("crm");
            assertThat(plan.unroutablePortions()).isEmpty();
        }

        @Test
        void shouldChainSequentialPortions() {
            // When
            Plan plan =
                    planner.decompose(
                            PlanRequest.of("Create a lead for ACME and then create a sales order"),
                            KNOWN);

            // Then
            assertThat(plan.tasks())
                    .extracting(TaskSpec::capability)
                    .containsExactly("crm", "sales");
            assertThat(plan.tasks().get(1).dependsOn()).containsExactly(0);
        }

        @Test
        void shouldKeepIndependentPortionsUnordered() {
            // When
            Plan plan = planner.decompose(PlanRequest.of("check stock and create invoice"), KNOWN);

            // Then
            assertThat(plan.tasks())
                    .extracting(TaskSpec::capability)
                    .containsExactly("inventory", "accounting");
            assertThat(plan.tasks()).allSatisfy(task -> assertThat(task.dependsOn()).isEmpty());
        }

        @Test
        void shouldMergePortionsOfSameCapability() {
            // When
            Plan plan =
                    planner.decompose(PlanRequest.of("create a lead and search leads"), KNOWN);

            // Then
            assertThat(plan.tasks()).hasSize(1);
            assertThat(plan.tasks().get(0).input())
                    .containsEntry("goal", "create a lead; search leads");
        }

        @Test
        void shouldKeepNameContainingConnectiveInOnePortion() {
            // When
            Plan plan =
                    planner.decompose(
                            PlanRequest.of("create a lead for Johnson and Johnson"), KNOWN);

            // Then
            assertThat(plan.tasks()).hasSize(1);
            assertThat(plan.tasks().get(0).input())
                    .containsEntry("goal", "create a lead for Johnson and Johnson");
            assertThat(plan.unroutablePortions()).isEmpty();
            assertThat(plan.isPartial()).isFalse();
        }

        @Test
        void shouldJoinTrailingPortionWithoutKeywordOntoPreviousOne() {
            // When
            Plan plan =
                    planner.decompose(
                            PlanRequest.of("check stock, then email the purchasing team"),
                            KNOWN);

            // Then
            assertThat(plan.tasks())
                    .extracting(TaskSpec::capability)
                    .containsExactly("inventory");
            assertThat(plan.tasks().get(0).description())
                    .isEqualTo("check stock, then email the purchasing team");
            assertThat(plan.unroutablePortions()).isEmpty();
        }

        @Test
        void shouldReportUnmatchedGoalAsUnroutable() {
            // When
            Plan plan = planner.decompose(PlanRequest.of("book a flight to Paris"), KNOWN);

            // Then
            assertThat(plan.isUnroutable()).isTrue();
            assertThat(plan.requestType()).isEqualTo(Plan.GENERAL);
            assertThat(plan.unroutablePortions())
                    .containsExactly(
                            new UnroutablePortion(
                                    "book a flight to Paris",
                                    "no capability matches this portion"));
        }

        @Test
        void shouldReportCapabilityWithoutRegisteredAgent() {
            // When
            Plan plan =
                    planner.decompose(
                            PlanRequest.of("create a lead and list employees"), KNOWN);

            // Then
            assertThat(plan.isPartial()).isTrue();
            assertThat(plan.tasks())
                    .extracting(TaskSpec::capability)
                    .containsExactly("crm");
            assertThat(plan.unroutablePortions().get(0).reason())
                    .isEqualTo("no registered agent declares [hr]");
        }

        @Test
        void shouldNotPlanPortionThatFollowsUnroutableOne() {
            // When
            Plan plan =
                    planner.decompose(PlanRequest.of("book a flight then create a lead"), KNOWN);

            // Then
            assertThat(plan.isUnroutable()).isTrue();
            assertThat(plan.unroutablePortions()).hasSize(2);
            assertThat(plan.unroutablePortions().get(1).reason())
                    .contains("preceding portion");
        }

        @Test
        void shouldReportEmptyGoal() {
            Plan plan = planner.decompose(PlanRequest.of("  ,  "), KNOWN);

            assertThat(plan.isUnroutable()).isTrue();
            assertThat(plan.unroutablePortions().get(0).reason()).isEqualTo("goal is empty");
        }
    }

    @Nested
    class ConstraintsTest {

        @Test
        void shouldCutPlanAtMaxTasks() {
            // Given
            RequestConstraints constraints = RequestConstraints.NONE.withMaxTasks(1);

            // When
            Plan plan =
                    planner.decompose(
                            new PlanRequest(
                                    "create a lead and create an order", Map.of(), constraints),
                            KNOWN);

            // Then
            assertThat(plan.tasks())
                    .extracting(TaskSpec::capability)
                    .containsExactly("crm");
            assertThat(plan.unroutablePortions())
                    .extracting(UnroutablePortion::reason)
                    .containsExactly("exceeds the limit of 1 tasks");
        }

        @Test
        void shouldOrderTasksByExplicitDependencies() {
            // Given
            RequestConstraints constraints =
                    RequestConstraints.fromMap(
                            Map.of("dependencies", Map.of("crm", List.of("sales"))));

            // When
            Plan plan =
                    planner.decompose(
                            new PlanRequest(
                                    "create a lead and create an order", Map.of(), constraints),
                            KNOWN);

            // Then
            assertThat(plan.tasks())
                    .extracting(TaskSpec::capability)
                    .containsExactly("sales", "crm");
            assertThat(plan.tasks().get(1).dependsOn()).containsExactly(0);
        }

        @Test
        void shouldReportDependencyCycle() {
            // Given
            RequestConstraints constraints =
                    RequestConstraints.fromMap(Map.of("dependencies", Map.of("crm", "sales")));

            // When
            Plan plan =
                    planner.decompose(
                            new PlanRequest(
                                    "create a lead then create an order", Map.of(), constraints),
                            KNOWN);

            // Then
            assertThat(plan.isUnroutable()).isTrue();
            assertThat(plan.unroutablePortions())
                    .extracting(UnroutablePortion::reason)
                    .containsOnly("part of a dependency cycle");
        }

        @Test
        void shouldApplyPriorityAndTimeoutToEveryTask() {
            // Given
            RequestConstraints constraints =
                    RequestConstraints.fromMap(Map.of("priority", "urgent", "timeout", 30));

            // When
            Plan plan =
                    planner.decompose(
                            new PlanRequest("check stock and create invoice", null, constraints),
                            KNOWN);

            // Then
            assertThat(plan.tasks())
                    .allSatisfy(
                            task -> {
                                assertThat(task.priority()).isEqualTo(TaskPriority.URGENT);
                                assertThat(task.timeout()).isEqualTo(Duration.ofSeconds(30));
                            });
        }

        @Test
        void shouldPlanStructuredTasksWithoutKeywordMatching() {
            // Given
            RequestConstraints constraints =
                    RequestConstraints.fromMap(
                            Map.of(
                                    "tasks",
                                    List.of(
                                            Map.of(
                                                    "capability",
                                                    "crm",
                                                    "input",
                                                    Map.of("action", "create_lead")),
                                            Map.of("capability", "sales", "dependsOn", List.of(0)),
                                            Map.of("capability", "hr"))));

            // When
            Plan plan =
                    planner.decompose(new PlanRequest("onboard", Map.of(), constraints), KNOWN);

            // Then
            assertThat(plan.tasks())
                    .extracting(TaskSpec::capability)
                    .containsExactly("crm", "sales");
            assertThat(plan.tasks().get(0).input()).containsEntry("action", "create_lead");
            assertThat(plan.tasks().get(1).dependsOn()).containsExactly(0);
            assertThat(plan.unroutablePortions())
                    .extracting(UnroutablePortion::reason)
                    .containsExactly("no registered agent declares [hr]");
        }

        @Test
        void shouldRejectInvalidStructuredDependency() {
            // Given
            RequestConstraints constraints =
                    RequestConstraints.fromMap(
                            Map.of(
                                    "tasks",
                                    List.of(Map.of("capability", "crm", "dependsOn", List.of(5)))));

            // When
            Plan plan =
                    planner.decompose(new PlanRequest("x", Map.of(), constraints), KNOWN);

            // Then
            assertThat(plan.isUnroutable()).isTrue();
            assertThat(plan.unroutablePortions().get(0).reason())
                    .isEqualTo("invalid dependency index 5");
        }
    }
}
