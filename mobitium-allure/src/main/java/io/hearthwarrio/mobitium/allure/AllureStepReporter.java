package io.hearthwarrio.mobitium.allure;

import io.hearthwarrio.mobitium.appium.DeviceSession;
import io.hearthwarrio.mobitium.appium.StepReporter;
import io.qameta.allure.Allure;
import io.qameta.allure.AllureLifecycle;
import io.qameta.allure.model.Status;
import io.qameta.allure.model.StepResult;
import io.qameta.allure.util.ResultsUtils;
import org.openqa.selenium.WebDriverException;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns every {@link io.hearthwarrio.mobitium.appium.MobileActions} call into an Allure step.
 * <p>
 * A failing step gets a screenshot, the page source and the stack trace attached before it is stopped.
 */
public final class AllureStepReporter implements StepReporter {

    private final DeviceSession device;
    private final boolean attachEvidence;

    public AllureStepReporter(DeviceSession device) {
        this(device, true);
    }

    public AllureStepReporter(DeviceSession device, boolean attachEvidence) {
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.attachEvidence = attachEvidence;
    }

    @Override
    public Step start(String name) {
        AllureLifecycle lifecycle = Allure.getLifecycle();
        String uuid = UUID.randomUUID().toString();
        lifecycle.startStep(uuid, new StepResult().setName(name).setStatus(Status.PASSED));
        return new AllureStep(lifecycle, uuid);
    }

    private final class AllureStep implements Step {

        private final AllureLifecycle lifecycle;
        private final String uuid;

        private AllureStep(AllureLifecycle lifecycle, String uuid) {
            this.lifecycle = lifecycle;
            this.uuid = uuid;
        }

        @Override
        public void fail(Throwable error) {
            if (attachEvidence) {
                attachEvidence(error);
            }
            lifecycle.updateStep(uuid, step -> step
                    .setStatus(ResultsUtils.getStatus(error).orElse(Status.BROKEN))
                    .setStatusDetails(ResultsUtils.getStatusDetails(error).orElse(null)));
        }

        @Override
        public void close() {
            lifecycle.stopStep(uuid);
        }
    }

    private void attachEvidence(Throwable error) {
        // a dead session still reports the original failure
        try {
            attach("Screenshot", "image/png", device.getScreenshot(), ".png");
            attach("Page source", "text/xml", utf8(device.getPageSource()), ".xml");
        } catch (WebDriverException e) {
            error.addSuppressed(e);
        }
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        attach("Error", "text/plain", utf8(trace.toString()), ".txt");
    }

    private static byte[] utf8(String s) {
        return (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
    }

    private static void attach(String name, String type, byte[] content, String extension) {
        if (content == null) {
            return;
        }
        Allure.addAttachment(name, type, new ByteArrayInputStream(content), extension);
    }
}
