package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.ActionOptions;
import io.hearthwarrio.mobitium.core.MobitiumConfig;
import io.hearthwarrio.mobitium.core.MobitiumDefaults;
import io.hearthwarrio.mobitium.core.Polling;
import io.hearthwarrio.mobitium.core.event.ConsumptionMode;
import io.hearthwarrio.mobitium.core.event.EventLog;
import io.hearthwarrio.mobitium.core.locator.Platform;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything one test needs to drive a device: the device session, the active platform, app identifiers, the
 * telemetry event log, timing and default options.
 * <p>
 * Passed explicitly to {@link MobileActions}; there is no global driver registry.
 */
public final class MobileSession {

    private final DeviceSession device;
    private final Platform platform;
    private final String appPackage;
    private final String bundleId;
    private final EventLog eventLog;
    private final ConsumptionMode consumptionMode;
    private final Polling polling;
    private final ActionOptions defaultOptions;
    private final Duration eventTimeout;

    private MobileSession(Builder b) {
        this.device = Objects.requireNonNull(b.device, "device must not be null");
        this.platform = Objects.requireNonNull(b.platform, "platform must not be null");
        this.appPackage = b.appPackage;
        this.bundleId = b.bundleId;
        this.eventLog = b.eventLog == null ? new EventLog() : b.eventLog;
        this.consumptionMode = Objects.requireNonNull(b.consumptionMode, "consumptionMode must not be null");
        this.polling = Objects.requireNonNull(b.polling, "polling must not be null");
        this.defaultOptions = Objects.requireNonNull(b.defaultOptions, "defaultOptions must not be null");
        this.eventTimeout = Objects.requireNonNull(b.eventTimeout, "eventTimeout must not be null");
    }

    public static Builder builder(DeviceSession device, Platform platform) {
        return new Builder(device, platform);
    }

    /**
     * Session whose platform, app identifiers and timing come from the configuration.
     */
    public static Builder builder(DeviceSession device, MobitiumConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new Builder(device, config.getPlatform())
                .appPackage(config.getAppPackage())
                .bundleId(config.getBundleId())
                .defaultOptions(config.defaultActionOptions())
                .eventTimeout(config.getEventTimeout());
    }

    public DeviceSession getDevice() {
        return device;
    }

    public Platform getPlatform() {
        return platform;
    }

    /**
     * @return Android application id, or {@code null}
     */
    public String getAppPackage() {
        return appPackage;
    }

    /**
     * @return iOS bundle id, or {@code null}
     */
    public String getBundleId() {
        return bundleId;
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    public ConsumptionMode getConsumptionMode() {
        return consumptionMode;
    }

    public Polling getPolling() {
        return polling;
    }

    public ActionOptions getDefaultOptions() {
        return defaultOptions;
    }

    public Duration getEventTimeout() {
        return eventTimeout;
    }

    public static final class Builder {
        private final DeviceSession device;
        private final Platform platform;
        private String appPackage;
        private String bundleId;
        private EventLog eventLog;
        private ConsumptionMode consumptionMode = ConsumptionMode.GLOBAL;
        private Polling polling = Polling.system();
        private ActionOptions defaultOptions = ActionOptions.defaults();
        private Duration eventTimeout = MobitiumDefaults.EVENT_TIMEOUT;

        private Builder(DeviceSession device, Platform platform) {
            this.device = device;
            this.platform = platform;
        }

        public Builder appPackage(String appPackage) {
            this.appPackage = appPackage;
            return this;
        }

        public Builder bundleId(String bundleId) {
            this.bundleId = bundleId;
            return this;
        }

        /**
         * Shared event log, usually filled by the telemetry receiver; a fresh one is created when not set.
         */
        public Builder eventLog(EventLog eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        public Builder consumptionMode(ConsumptionMode consumptionMode) {
            this.consumptionMode = consumptionMode;
            return this;
        }

        public Builder polling(Polling polling) {
            this.polling = polling;
            return this;
        }

        public Builder defaultOptions(ActionOptions defaultOptions) {
            this.defaultOptions = defaultOptions;
            return this;
        }

        public Builder eventTimeout(Duration eventTimeout) {
            this.eventTimeout = eventTimeout;
            return this;
        }

        public MobileSession build() {
            return new MobileSession(this);
        }
    }
}
