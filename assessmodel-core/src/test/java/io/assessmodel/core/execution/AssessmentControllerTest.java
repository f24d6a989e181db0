package io.assessmodel.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import io.assessmodel.core.exception.DuplicateIdentifierException;
import io.assessmodel.core.exception.NodeNotFoundException;
import io.assessmodel.core.fixture.SurveyFixtures;
import io.assessmodel.core.fixture.TickingClock;
import io.assessmodel.core.navigation.Progress;
import io.assessmodel.core.node.AnswerType;
import io.assessmodel.core.node.Assessment;
import io.assessmodel.core.node.ButtonActionInfo;
import io.assessmodel.core.node.ButtonType;
import io.assessmodel.core.node.ContentStep;
import io.assessmodel.core.node.InterruptionHandling;
import io.assessmodel.core.node.NavigationIdentifier;
import io.assessmodel.core.node.Node;
import io.assessmodel.core.node.NodeType;
import io.assessmodel.core.node.QuestionStep;
import io.assessmodel.core.node.Section;
import io.assessmodel.core.result.AnswerResult;
import io.assessmodel.core.result.AssessmentResult;
import io.assessmodel.core.result.BranchNodeResult;
import io.assessmodel.core.result.Direction;
import io.assessmodel.core.result.PathMarker;
import io.assessmodel.core.result.Result;
import io.assessmodel.core.rule.SurveyRule;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AssessmentControllerTest {

    @Mock private NavigationListener listener;

    @Nested
    class FullInstructionsTest {

        @Test
        void shouldSkipFullInstructionsOnlyStepsByDefault() {
            // Given
            AssessmentController controller = start(SurveyFixtures.fullInstructionsAssessment());

            // When
            controller.goForward();
            controller.goForward();
            controller.goForward();

            // Then
            AssessmentState state = controller.getState();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("completion");
            assertThat(historyIds(state.getAssessmentResult()))
                    .containsExactly("intro", "step2", "step3", "completion");
            assertThat(state.isBackEnabled()).isTrue();
            assertThat(state.getStatus()).isEqualTo(AssessmentStatus.READY_TO_SAVE);
            assertThat(state.getAssessmentResult().getEndDate()).isNotNull();
        }

        @Test
        void shouldShowFullInstructionsWhenConfigured() {
            // Given
            AssessmentConfig config =
                    AssessmentConfig.builder()
                            .showFullInstructions(true)
                            .clock(TickingClock.startingAtEpoch())
                            .build();
            AssessmentController controller =
                    new AssessmentController(
                            SurveyFixtures.fullInstructionsAssessment(),
                            config,
                            null,
                            NavigationListener.NOOP);
            controller.initialize();

            // When
            controller.goForward();

            // Then
            assertThat(controller.getState().getCurrentStep().step().getId()).isEqualTo("step1");
        }

        @Test
        void shouldFinishAfterCompletion() {
            // Given
            AssessmentController controller = start(SurveyFixtures.fullInstructionsAssessment());
            for (int i = 0; i < 3; i++) {
                controller.goForward();
            }

            // When
            controller.goForward();

            // Then
            AssessmentState state = controller.getState();
            assertThat(state.getStatus()).isEqualTo(AssessmentStatus.FINISHED);
            assertThat(state.getCurrentStep()).isNull();
            assertThat(state.hasPartialResults()).isTrue();
            assertThat(state.getAssessmentResult().findResult("completion").getEndDate()).isNotNull();
        }

        @Test
        void shouldReviewInstructionsFromBeginning() {
            // Given
            Assessment assessment =
                    Assessment.builder()
                            .id("review")
                            .interruptionHandling(
                                    new InterruptionHandling(
                                            true, true, true, true, NavigationIdentifier.parse("beginning")))
                            .children(SurveyFixtures.fullInstructionsAssessment().getChildren())
                            .build();
            AssessmentController controller = start(assessment);
            controller.goForward();
            controller.goForward();

            // When
            controller.reviewInstructions();

            // Then
            AssessmentState state = controller.getState();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("intro");
            assertThat(state.getCurrentDirection()).isEqualTo(Direction.BACKWARD);
            assertThat(state.isShowFullInstructions()).isTrue();

            controller.goForward();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("step1");
        }
    }

    @Nested
    class SectionTest {

        @Test
        void shouldNestSectionResults() {
            // Given
            AssessmentController controller = start(SurveyFixtures.sectionAssessment());

            // When
            for (int i = 0; i < 4; i++) {
                controller.goForward();
            }

            // Then
            AssessmentState state = controller.getState();
            AssessmentResult top = state.getAssessmentResult();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("C");
            assertThat(historyIds(top)).containsExactly("A", "B", "C");
            BranchNodeResult section = (BranchNodeResult) top.findResult("B");
            assertThat(historyIds(section)).containsExactly("X", "Y", "Z");

            assertEndedAfterStart(top.findResult("A"));
            assertEndedAfterStart(section);
            section.getPathHistory().forEach(AssessmentControllerTest::assertEndedAfterStart);
            assertThat(top.findResult("C").getEndDate()).isNull();
            assertThat(controller.getCurrentBranchState().identifier()).isEqualTo("sections");
        }

        @Test
        void shouldGoBackAcrossSectionBoundary() {
            // Given
            AssessmentController controller = start(SurveyFixtures.sectionAssessment());
            for (int i = 0; i < 4; i++) {
                controller.goForward();
            }

            // When
            controller.goBack();

            // Then
            AssessmentState state = controller.getState();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("Z");
            assertThat(state.getCurrentStep().parentIdentifier()).isEqualTo("B");
            assertThat(state.getCurrentDirection()).isEqualTo(Direction.BACKWARD);

            controller.goBack();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("Y");
            controller.goBack();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("X");
            assertThat(state.isBackEnabled()).isTrue();
            controller.goBack();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("A");
            assertThat(controller.getCurrentBranchState().identifier()).isEqualTo("sections");
            assertThat(state.isBackEnabled()).isFalse();
        }

        @Test
        void shouldIgnoreBackOnFirstStep() {
            // Given
            AssessmentController controller = start(SurveyFixtures.sectionAssessment());
            AssessmentResult before = controller.getState().getAssessmentResult().deepCopy();

            // When
            controller.goBack();

            // Then
            AssessmentState state = controller.getState();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("A");
            assertThat(state.getStatus()).isEqualTo(AssessmentStatus.RUNNING);
            assertThat(state.getAssessmentResult()).isEqualTo(before);
        }

        @Test
        void shouldDeferPauseEligibilityToParentOnFirstChild() {
            // Given
            AssessmentController controller = start(SurveyFixtures.sectionAssessment());
            assertThat(controller.getState().canPause()).isFalse();

            // When
            controller.goForward();

            // Then
            assertThat(controller.getState().getCurrentStep().step().getId()).isEqualTo("X");
            assertThat(controller.getState().canPause()).isTrue();
            assertThat(controller.getState().getProgress()).isEqualTo(new Progress(0, 3, true));
        }

        @Test
        void shouldResumeRestoredRunInsideSection() {
            // Given
            AssessmentController first = start(SurveyFixtures.sectionAssessment());
            first.goForward();
            first.goForward();
            AssessmentResult saved = first.getState().getAssessmentResult().deepCopy();

            // When
            AssessmentController restored =
                    new AssessmentController(
                            SurveyFixtures.sectionAssessment(),
                            config(),
                            saved,
                            NavigationListener.NOOP);
            restored.initialize();

            // Then
            AssessmentState state = restored.getState();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("Y");
            assertThat(state.getCurrentDirection()).isEqualTo(Direction.FORWARD);
            assertThat(restored.getCurrentBranchState().identifier()).isEqualTo("B");
            assertThat(state.getAssessmentResult().getRunUUID()).isEqualTo(saved.getRunUUID());

            restored.goForward();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("Z");
        }

        @Test
        void shouldLeaveSectionOnExitRule() {
            // Given
            QuestionStep question =
                    QuestionStep.simple()
                            .id("q")
                            .answerType(AnswerType.of(AnswerType.Kind.BOOLEAN))
                            .surveyRule(SurveyRule.equalTo(true, "exit"))
                            .build();
            Assessment assessment =
                    Assessment.builder()
                            .id("exiting")
                            .child(ContentStep.instruction("A"))
                            .child(
                                    Section.builder()
                                            .id("S")
                                            .child(question)
                                            .child(ContentStep.instruction("skipped"))
                                            .build())
                            .child(ContentStep.instruction("C"))
                            .build();
            AssessmentController controller = start(assessment);
            controller.goForward();
            ((AnswerResult) controller.getState().getCurrentStep().result()).setJsonValue(true);

            // When
            controller.goForward();

            // Then
            AssessmentState state = controller.getState();
            assertThat(state.getCurrentStep().step().getId()).isEqualTo("C");
            BranchNodeResult section = (BranchNodeResult) state.getAssessmentResult().findResult("S");
            assertThat(historyIds(section)).containsExactly("q");
            assertThat(section.getPath())
                    .containsExactly(
                            new PathMarker("q", Direction.FORWARD), new PathMarker("q", Direction.EXIT));
            assertThat(section.getEndDate()).isNotNull();
        }
    }

    @Nested
    class SurveyTest {

        @Test
        void shouldBeReadyToSaveAfterSkippingPizza() {
            // Given
            AssessmentController controller = start(SurveyFixtures.surveyA());
            assertThat(controller.getState().hasPartialResults()).isFalse();
            controller.goForward();
            assertThat(controller.getState().hasPartialResults()).isFalse();
            answer(controller, 1);
            controller.goForward();
            assertThat(controller.getState().hasPartialResults()).isTrue();
            assertThat(currentId(controller)).isEqualTo("simpleQ1");
            answer(controller, "I like cake");
            controller.goForward();
            assertThat(currentId(controller)).isEqualTo("followupQ");
            answer(controller, true);
            controller.goForward();
            controller.goForward();
            assertThat(currentId(controller)).isEqualTo("favoriteFood");
            answer(controller, "sushi");

            // When
            controller.goForward();

            // Then
            assertThat(currentId(controller)).isEqualTo("completion");
            assertThat(controller.getState().getStatus()).isEqualTo(AssessmentStatus.READY_TO_SAVE);
            assertThat(historyIds(controller.getState().getAssessmentResult()))
                    .containsExactly(
                            "overview",
                            "choiceQ1",
                            "simpleQ1",
                            "followupQ",
                            "multipleChoice",
                            "favoriteFood",
                            "completion");
        }

        @Test
        void shouldKeepAnswerWhenRevisited() {
            // Given
            AssessmentController controller = start(SurveyFixtures.surveyA());
            controller.goForward();
            answer(controller, 2);
            controller.goForward();

            // When
            controller.goBack();

            // Then
            assertThat(currentId(controller)).isEqualTo("choiceQ1");
            AnswerResult result = (AnswerResult) controller.getState().getCurrentStep().result();
            assertThat(result.getJsonValue()).isEqualTo(2);
            assertThat(result.getEndDate()).isNull();
        }

        @Test
        void shouldResolveButtonsThroughHierarchy() {
            // Given
            AssessmentController controller = start(SurveyFixtures.surveyA());
            ContentStep override =
                    ContentStep.builder(NodeType.INSTRUCTION)
                            .id("override")
                            .button(ButtonType.SKIP, new ButtonActionInfo("Not now"))
                            .build();

            // Then
            Node overview = controller.getState().getCurrentStep().step();
            assertThat(controller.isButtonHidden(ButtonType.PAUSE, overview)).isTrue();
            assertThat(controller.isButtonHidden(ButtonType.GO_FORWARD, overview)).isFalse();
            assertThat(controller.buttonInfo(ButtonType.SKIP, overview))
                    .isEqualTo(new ButtonActionInfo("Skip me"));
            assertThat(controller.buttonInfo(ButtonType.SKIP, override))
                    .isEqualTo(new ButtonActionInfo("Not now"));
            assertThat(controller.getState().canPause()).isFalse();
        }
    }

    @Nested
    class StatusTest {

        @Test
        void shouldPauseAndResume() {
            // Given
            AssessmentController controller = start(SurveyFixtures.sectionAssessment());
            controller.goForward();
            controller.goForward();

            // When
            boolean paused = controller.pause();
            controller.goForward();

            // Then
            assertThat(paused).isTrue();
            assertThat(controller.getState().getStatus()).isEqualTo(AssessmentStatus.PAUSED);
            assertThat(currentId(controller)).isEqualTo("Y");

            controller.resume();
            assertThat(controller.getState().getStatus()).isEqualTo(AssessmentStatus.RUNNING);
        }

        @Test
        void shouldNotPauseOnFirstStep() {
            AssessmentController controller = start(SurveyFixtures.sectionAssessment());

            assertThat(controller.pause()).isFalse();
            assertThat(controller.getState().getStatus()).isEqualTo(AssessmentStatus.RUNNING);
        }

        @Test
        void shouldDeclineAndContinueLater() {
            AssessmentController declined = start(SurveyFixtures.surveyA());
            declined.skipAssessment();
            assertThat(declined.getState().getStatus()).isEqualTo(AssessmentStatus.DECLINED);

            AssessmentController later = start(SurveyFixtures.surveyA());
            later.goForward();
            later.exitAssessment();
            assertThat(later.getState().getStatus()).isEqualTo(AssessmentStatus.CONTINUE_LATER);
            assertThat(currentId(later)).isEqualTo("choiceQ1");
        }

        @Test
        void shouldNotNavigateBeforeInitialize() {
            AssessmentController controller = new AssessmentController(SurveyFixtures.surveyA());

            controller.goForward();

            assertThat(controller.getState().getStatus()).isEqualTo(AssessmentStatus.NOT_STARTED);
            assertThat(controller.getState().getCurrentStep()).isNull();
        }
    }

    @Nested
    class ListenerTest {

        @Test
        void shouldNotifyBranchAndStepEvents() {
            // Given
            AssessmentController controller =
                    new AssessmentController(
                            SurveyFixtures.sectionAssessment(), config(), null, listener);

            // When
            controller.initialize();
            controller.goForward();

            // Then
            verify(listener).onStatusChanged(AssessmentStatus.NOT_STARTED, AssessmentStatus.RUNNING);
            verify(listener)
                    .onBranchEntered(argThat(branch -> branch.getId().equals("B")), eq(Direction.FORWARD));
            verify(listener)
                    .onStepShown(argThat(step -> step.step().getId().equals("X")), eq(Direction.FORWARD));
        }
    }

    @Nested
    class FailureTest {

        @Test
        void shouldEnterErrorOnDuplicateIdentifiersInSection() {
            // Given
            Assessment assessment =
                    Assessment.builder()
                            .id("broken")
                            .child(ContentStep.instruction("A"))
                            .child(
                                    Section.builder()
                                            .id("S")
                                            .child(ContentStep.instruction("X"))
                                            .child(ContentStep.instruction("X"))
                                            .build())
                            .build();
            AssessmentController controller =
                    new AssessmentController(assessment, config(), null, listener);
            controller.initialize();

            // When
            controller.goForward();

            // Then
            AssessmentState state = controller.getState();
            assertThat(state.getStatus()).isEqualTo(AssessmentStatus.ERROR);
            assertThat(state.getNavigationError()).isInstanceOf(DuplicateIdentifierException.class);
            verify(listener).onNavigationError(any(DuplicateIdentifierException.class));
            verify(listener).onStatusChanged(AssessmentStatus.RUNNING, AssessmentStatus.ERROR);
        }

        @Test
        void shouldEnterErrorOnUnknownJumpTarget() {
            // Given
            Assessment assessment =
                    Assessment.builder()
                            .id("dangling")
                            .child(ContentStep.builder(NodeType.INSTRUCTION).id("A").nextNode("nowhere").build())
                            .child(ContentStep.instruction("B"))
                            .build();
            AssessmentController controller = start(assessment);

            // When
            controller.goForward();
            controller.goForward();

            // Then
            AssessmentState state = controller.getState();
            assertThat(state.getStatus()).isEqualTo(AssessmentStatus.ERROR);
            assertThat(state.getNavigationError())
                    .isInstanceOf(NodeNotFoundException.class)
                    .hasMessageContaining("nowhere");
            assertThat(currentId(controller)).isEqualTo("A");
        }

        @Test
        void shouldEnterErrorOnDuplicateTopLevelIdentifiers() {
            Assessment assessment =
                    Assessment.builder()
                            .id("broken")
                            .child(ContentStep.instruction("A"))
                            .child(ContentStep.instruction("A"))
                            .build();
            AssessmentController controller = start(assessment);

            assertThat(controller.getState().getStatus()).isEqualTo(AssessmentStatus.ERROR);
            assertThat(controller.getState().getCurrentStep()).isNull();
        }
    }

    private static AssessmentConfig config() {
        return AssessmentConfig.builder().clock(TickingClock.startingAtEpoch()).build();
    }

    private static AssessmentController start(Assessment assessment) {
        AssessmentController controller =
                new AssessmentController(assessment, config(), null, NavigationListener.NOOP);
        controller.initialize();
        return controller;
    }

    private static String currentId(AssessmentController controller) {
        return controller.getState().getCurrentStep().step().getId();
    }

    private static void answer(AssessmentController controller, Object value) {
        ((AnswerResult) controller.getState().getCurrentStep().result()).setJsonValue(value);
    }

    private static List<String> historyIds(BranchNodeResult result) {
        return result.getPathHistory().stream().map(Result::getIdentifier).toList();
    }

    private static void assertEndedAfterStart(Result result) {
        assertThat(result.getEndDate()).isNotNull();
        assertThat(result.getEndDate()).isAfter(result.getStartDate());
    }
}
