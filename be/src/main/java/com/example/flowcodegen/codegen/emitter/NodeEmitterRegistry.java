package com.example.flowcodegen.codegen.emitter;

import com.example.flowcodegen.model.NodeType;

import tools.jackson.databind.json.JsonMapper;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Emitters by node type. Types without a registered emitter fall back to {@link UnknownNodeEmitter}.
 */
public final class NodeEmitterRegistry {

    private final Map<NodeType, NodeEmitter> registry = new EnumMap<>(NodeType.class);
    private final NodeEmitter fallback = new UnknownNodeEmitter();

    public NodeEmitterRegistry(List<NodeEmitter> emitters) {
        emitters.forEach(emitter -> registry.put(emitter.supportedType(), emitter));
    }

    /**
     * Registry with one emitter for every known node type.
     */
    public static NodeEmitterRegistry defaults(JsonMapper jsonMapper) {
        return new NodeEmitterRegistry(List.of(
                new StartEmitter(),
                new EndEmitter(),
                new TriggerEmitter(),
                new AgentEmitter(),
                new ExternalToolEmitter(jsonMapper),
                new ConditionEmitter(),
                new ParallelEmitter(),
                new BoundedLoopEmitter(),
                new TeamEmitter()
        ));
    }

    public NodeEmitter get(NodeType type) {
        return registry.getOrDefault(type, fallback);
    }
}
