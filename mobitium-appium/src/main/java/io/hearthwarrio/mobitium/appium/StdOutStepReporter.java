package io.hearthwarrio.mobitium.appium;

/**
 * Prints step boundaries to stdout.
 */
public final class StdOutStepReporter implements StepReporter {

    @Override
    public Step start(String name) {
        System.out.println("[Mobitium] step: " + name);
        return new Step() {
            @Override
            public void fail(Throwable error) {
                System.out.println("[Mobitium] step failed: " + name + ": " + error.getMessage());
            }

            @Override
            public void close() {
                // nothing to release
            }
        };
    }
}
