package com.phillippitts.clinicalai.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the backend watchdog.
 */
@ConfigurationProperties(prefix = "clinical-ai.watchdog")
@Validated
public class WatchdogProperties {

    /** Enable/disable watchdog globally. */
    private boolean enabled = true;

    /** Sliding window for counting failures, in minutes. */
    @Positive(message = "Window minutes must be positive")
    private int windowMinutes = 10;

    /** Failures within the window that mark a backend DISABLED. */
    @Positive(message = "Max failures per window must be positive")
    private int maxFailuresPerWindow = 5;

    /** Minutes a DISABLED backend stays disabled before it is checked again. */
    @Positive(message = "Cooldown minutes must be positive")
    private int cooldownMinutes = 5;

    /** Recheck degraded or cooled-down backends on the scheduled sweep. */
    private boolean recheckEnabled = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public int getMaxFailuresPerWindow() {
        return maxFailuresPerWindow;
    }

    public void setMaxFailuresPerWindow(int maxFailuresPerWindow) {
        this.maxFailuresPerWindow = maxFailuresPerWindow;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public boolean isRecheckEnabled() {
        return recheckEnabled;
    }

    public void setRecheckEnabled(boolean recheckEnabled) {
        this.recheckEnabled = recheckEnabled;
    }
}
