package com.example.flowcodegen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Optional;

/**
 * Scheduled or webhook entry point.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TriggerData(String triggerType, String cronExpression, String webhookPath) implements NodeData {

    public Optional<TriggerKind> kind() {
        return TriggerKind.fromValue(triggerType);
    }

    public static TriggerData blank() {
        return new TriggerData(null, null, null);
    }
}
