package io.hearthwarrio.mobitium.allure;

import io.hearthwarrio.mobitium.appium.StepReporter;
import io.qameta.allure.Allure;
import io.qameta.allure.AllureLifecycle;
import io.qameta.allure.AllureResultsWriter;
import io.qameta.allure.model.Attachment;
import io.qameta.allure.model.Status;
import io.qameta.allure.model.StepResult;
import io.qameta.allure.model.TestResult;
import io.qameta.allure.model.TestResultContainer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AllureStepReporterTest {

    private final List<TestResult> written = new ArrayList<>();
    private final AllureLifecycle lifecycle = new AllureLifecycle(new AllureResultsWriter() {
        @Override
        public void write(TestResult testResult) {
            written.add(testResult);
        }

        @Override
        public void write(TestResultContainer testResultContainer) {
        }

        @Override
        public void write(String source, InputStream attachment) {
        }
    });

    private AllureLifecycle previous;
    private String testUuid;

    @BeforeEach
    void startTestCase() {
        previous = Allure.getLifecycle();
        Allure.setLifecycle(lifecycle);
        testUuid = UUID.randomUUID().toString();
        lifecycle.scheduleTestCase(new TestResult().setUuid(testUuid).setName("checkout"));
        lifecycle.startTestCase(testUuid);
    }

    @AfterEach
    void restoreLifecycle() {
        Allure.setLifecycle(previous);
    }

    private StepResult onlyStep() {
        lifecycle.stopTestCase(testUuid);
        lifecycle.writeTestCase(testUuid);
        assertEquals(1, written.size());
        List<StepResult> steps = written.get(0).getSteps();
        assertEquals(1, steps.size());
        return steps.get(0);
    }

    @Test
    void passedStepHasNoAttachments() {
        StepReporter reporter = new AllureStepReporter(new ScreenOnlyDevice(false));

        StepReporter.Step step = reporter.start("Click Buy");
        step.close();

        StepResult result = onlyStep();
        assertEquals("Click Buy", result.getName());
        assertEquals(Status.PASSED, result.getStatus());
        assertTrue(result.getAttachments().isEmpty());
    }

    @Test
    void failedStepCarriesEvidence() {
        StepReporter reporter = new AllureStepReporter(new ScreenOnlyDevice(false));

        StepReporter.Step step = reporter.start("Click Buy");
        step.fail(new IllegalStateException("boom"));
        step.close();

        StepResult result = onlyStep();
        assertEquals(Status.BROKEN, result.getStatus());
        assertEquals("boom", result.getStatusDetails().getMessage());
        assertEquals(Arrays.asList("Screenshot", "Page source", "Error"), names(result));
    }

    @Test
    void deadSessionStillReportsFailure() {
        StepReporter reporter = new AllureStepReporter(new ScreenOnlyDevice(true));
        IllegalStateException error = new IllegalStateException("boom");

        StepReporter.Step step = reporter.start("Click Buy");
        step.fail(error);
        step.close();

        StepResult result = onlyStep();
        assertEquals(Arrays.asList("Error"), names(result));
        assertEquals(1, error.getSuppressed().length);
    }

    private static List<String> names(StepResult result) {
        return result.getAttachments().stream().map(Attachment::getName).collect(Collectors.toList());
    }
}
