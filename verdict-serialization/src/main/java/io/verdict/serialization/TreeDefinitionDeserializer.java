package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.Map;

/// Deserializes a definition document into a {@link DecisionTree}.
///
/// Top-level fields are matched case-insensitively; unknown fields are ignored.
/// `nodes` must be an object whose members are node objects. A node without an
/// `id` takes its key. No structural validation happens here: dangling edges,
/// cycles and mismatched ids are left for the validator to report.
///
/// @implNote Package-private. Registered by {@link VerdictJacksonModule}.
class TreeDefinitionDeserializer extends StdDeserializer<DecisionTree> {

    @Serial private static final long serialVersionUID = -1587730046920314857L;

    TreeDefinitionDeserializer() {
        super(DecisionTree.class);
    }

    @Override
    public DecisionTree deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        JsonFields.requireObject(root, "Decision tree", DecisionTree.class, ctxt);

        DecisionTree.Builder builder =
                DecisionTree.builder()
                        .id(JsonFields.text(root, "id", DecisionTree.class, ctxt))
                        .version(JsonFields.text(root, "version", DecisionTree.class, ctxt))
                        .startNodeId(
                                JsonFields.text(root, "startNodeId", DecisionTree.class, ctxt));

        JsonNode nodes = JsonFields.get(root, "nodes");
        if (nodes == null || nodes.isNull()) {
            return builder.build();
        }
        JsonFields.requireObject(nodes, "Field 'nodes'", DecisionTree.class, ctxt);

        Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (value.isNull()) {
                return ctxt.reportInputMismatch(
                        DecisionTree.class, "Node '%s' must not be null", key);
            }

            DecisionNode node = mapper.treeToValue(value, DecisionNode.class);
            if (node.getId().isEmpty()) {
                node = node.toBuilder().id(key).build();
            }
            builder.node(key, node);
        }
        return builder.build();
    }
}
