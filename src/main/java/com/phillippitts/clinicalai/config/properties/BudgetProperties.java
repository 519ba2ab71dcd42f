package com.phillippitts.clinicalai.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Spend limits and pricing for metered backends.
 *
 * <p>Example application.properties:
 * <pre>
 * clinical-ai.budget.daily-ceiling-usd=25.0
 * clinical-ai.budget.window=1d
 * clinical-ai.budget.organization-ceilings.clinic-oslo=100.0
 * clinical-ai.budget.suspended-organizations=clinic-unpaid
 * </pre>
 */
@ConfigurationProperties(prefix = "clinical-ai.budget")
@Validated
public class BudgetProperties {

    /** Ceiling per organization and window, in dollars. */
    @PositiveOrZero(message = "Ceiling must not be negative")
    private double dailyCeilingUsd = 10.0;

    /** Length of a spend window; windows are aligned to the epoch (UTC midnight for one day). */
    @NotNull
    private Duration window = Duration.ofDays(1);

    /** Input price in dollars per million tokens. */
    @PositiveOrZero
    private double inputPricePerMillion = 3.0;

    /** Output price in dollars per million tokens. */
    @PositiveOrZero
    private double outputPricePerMillion = 15.0;

    /** Organization used when a request carries none. */
    @NotBlank
    private String defaultOrganization = "default";

    /** Per-organization ceilings overriding {@link #dailyCeilingUsd}. */
    private Map<String, Double> organizationCeilings = new HashMap<>();

    /** Organizations denied all metered calls. */
    private Set<String> suspendedOrganizations = new HashSet<>();

    /** Capacity of the usage accounting queue; records beyond it are dropped. */
    @Positive(message = "Queue capacity must be positive")
    private int queueCapacity = 1000;

    public double getDailyCeilingUsd() {
        return dailyCeilingUsd;
    }

    public void setDailyCeilingUsd(double dailyCeilingUsd) {
        this.dailyCeilingUsd = dailyCeilingUsd;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public double getInputPricePerMillion() {
        return inputPricePerMillion;
    }

    public void setInputPricePerMillion(double inputPricePerMillion) {
        this.inputPricePerMillion = inputPricePerMillion;
    }

    public double getOutputPricePerMillion() {
        return outputPricePerMillion;
    }

    public void setOutputPricePerMillion(double outputPricePerMillion) {
        this.outputPricePerMillion = outputPricePerMillion;
    }

    public String getDefaultOrganization() {
        return defaultOrganization;
    }

    public void setDefaultOrganization(String defaultOrganization) {
        this.defaultOrganization = defaultOrganization;
    }

    public Map<String, Double> getOrganizationCeilings() {
        return organizationCeilings;
    }

    public void setOrganizationCeilings(Map<String, Double> organizationCeilings) {
        this.organizationCeilings = organizationCeilings;
    }

    public Set<String> getSuspendedOrganizations() {
        return suspendedOrganizations;
    }

    public void setSuspendedOrganizations(Set<String> suspendedOrganizations) {
        this.suspendedOrganizations = suspendedOrganizations;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public double ceilingFor(String organizationId) {
        Double override = organizationCeilings.get(organizationId);
        return override != null ? override : dailyCeilingUsd;
    }
}
