package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.NodeType;
import com.example.flowcodegen.model.TriggerData;
import com.example.flowcodegen.model.TriggerKind;
import com.example.flowcodegen.model.WorkflowNode;

import java.util.Optional;

/**
 * Documents how the workflow is started. Triggers never produce executable code.
 */
public class TriggerEmitter implements NodeEmitter {

    private static final String NOT_SET = "not set";

    @Override
    public NodeType supportedType() {
        return NodeType.TRIGGER;
    }

    @Override
    public void emit(WorkflowNode node, NodeEmission out) {
        TriggerData data = node.dataAs(TriggerData.class, TriggerData::blank);
        Optional<TriggerKind> kind = data.kind();
        if (kind.isEmpty()) {
            out.comment("Trigger: " + (data.triggerType() != null ? data.triggerType() : NOT_SET));
        } else if (kind.get() == TriggerKind.SCHEDULED) {
            out.comment("Trigger: Cron schedule (" + orNotSet(data.cronExpression()) + ")");
        } else {
            out.comment("Trigger: Webhook (" + orNotSet(data.webhookPath()) + ")");
        }
    }

    private static String orNotSet(String value) {
        return value != null && !value.isBlank() ? value : NOT_SET;
    }
}
