package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a decision tree into its definition document.
///
/// Writes `id`, `version`, `startNodeId` and a `nodes` object keyed by node id in
/// declaration order. Each node is delegated to {@link NodeSerializer}.
///
/// @implNote Package-private. Registered by {@link VerdictJacksonModule}.
class TreeDefinitionSerializer extends StdSerializer<DecisionTree> {

    @Serial private static final long serialVersionUID = 3316487250933149702L;

    TreeDefinitionSerializer() {
        super(DecisionTree.class);
    }

    @Override
    public void serialize(DecisionTree tree, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", tree.getId());
        gen.writeStringField("version", tree.getVersion());
        gen.writeStringField("startNodeId", tree.getStartNodeId());

        gen.writeObjectFieldStart("nodes");
        for (Map.Entry<String, DecisionNode> entry : tree.getNodes().entrySet()) {
            gen.writeFieldName(entry.getKey());
            provider.defaultSerializeValue(entry.getValue(), gen);
        }
        gen.writeEndObject();

        gen.writeEndObject();
    }
}
