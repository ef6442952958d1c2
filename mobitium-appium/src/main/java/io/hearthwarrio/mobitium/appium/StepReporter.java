package io.hearthwarrio.mobitium.appium;

/**
 * Reports every public {@link MobileActions} call as a named step.
 * <p>
 * Usage contract: {@link #start(String)} once, {@link Step#fail(Throwable)} at most once, {@link Step#close()} exactly
 * once, in a {@code finally} block.
 */
@FunctionalInterface
public interface StepReporter {

    StepReporter NO_OP = name -> Step.NO_OP;

    Step start(String name);

    /**
     * One open step.
     */
    interface Step extends AutoCloseable {

        Step NO_OP = new Step() {
            @Override
            public void fail(Throwable error) {
            }

            @Override
            public void close() {
            }
        };

        /**
         * Marks the step as failed. Called before {@link #close()}.
         */
        void fail(Throwable error);

        @Override
        void close();
    }
}
