package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.verdict.core.tree.Choice;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.Rule;
import java.io.IOException;
import java.io.Serial;

/// Serializes a node as written in tree definitions.
///
/// `id`, `prompt` and `type` are always written. `choices` and `rules` are written
/// only when non-empty, `defaultNextNodeId` only when present, so an absent list
/// and an empty one encode the same way.
///
/// @implNote Package-private. Registered by {@link VerdictJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<DecisionNode> {

    @Serial private static final long serialVersionUID = -6243011957340288816L;

    NodeSerializer() {
        super(DecisionNode.class);
    }

    @Override
    public void serialize(DecisionNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("prompt", node.getPrompt());
        gen.writeStringField("type", node.getType());

        if (!node.getChoices().isEmpty()) {
            gen.writeArrayFieldStart("choices");
            for (Choice choice : node.getChoices()) {
                gen.writeStartObject();
                gen.writeStringField("key", choice.key());
                gen.writeStringField("label", choice.label());
                gen.writeStringField("nextNodeId", choice.nextNodeId());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }

        if (!node.getRules().isEmpty()) {
            gen.writeArrayFieldStart("rules");
            for (Rule rule : node.getRules()) {
                gen.writeStartObject();
                gen.writeStringField("operator", rule.operator());
                gen.writeStringField("value", rule.value());
                gen.writeStringField("nextNodeId", rule.nextNodeId());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }

        if (node.getDefaultNextNodeId() != null) {
            gen.writeStringField("defaultNextNodeId", node.getDefaultNextNodeId());
        }

        gen.writeEndObject();
    }
}
