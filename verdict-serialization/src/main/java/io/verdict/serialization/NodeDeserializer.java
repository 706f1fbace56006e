package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.verdict.core.tree.Choice;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.Rule;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes a node object of a tree definition.
///
/// ### Extraction strategy
///
/// All fields are extracted manually from the `JsonNode` tree with case-insensitive
/// names (see {@link JsonFields}); no POJO reflection is involved:
/// - scalar fields `id`, `prompt`, `type`, `defaultNextNodeId`
/// - `choices` array of `{key, label, nextNodeId}`
/// - `rules` array of `{operator, value, nextNodeId}`; numeric `value`s are kept in
///   their textual form
///
/// Unknown fields are ignored. The node type is kept verbatim; an unrecognized type
/// is not an error.
///
/// @implNote Package-private. Registered by {@link VerdictJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<DecisionNode> {

    @Serial private static final long serialVersionUID = 5820917336489204571L;

    NodeDeserializer() {
        super(DecisionNode.class);
    }

    @Override
    public DecisionNode deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        JsonFields.requireObject(root, "Node", DecisionNode.class, ctxt);

        return DecisionNode.builder()
                .id(JsonFields.text(root, "id", DecisionNode.class, ctxt))
                .prompt(JsonFields.text(root, "prompt", DecisionNode.class, ctxt))
                .type(JsonFields.text(root, "type", DecisionNode.class, ctxt))
                .choices(deserializeChoices(root, ctxt))
                .rules(deserializeRules(root, ctxt))
                .defaultNextNodeId(
                        JsonFields.text(root, "defaultNextNodeId", DecisionNode.class, ctxt))
                .build();
    }

    private List<Choice> deserializeChoices(JsonNode root, DeserializationContext ctxt)
            throws IOException {
        JsonNode array = JsonFields.array(root, "choices", DecisionNode.class, ctxt);
        if (array == null) {
            return List.of();
        }
        List<Choice> choices = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            JsonFields.requireObject(element, "Choice", Choice.class, ctxt);
            choices.add(
                    new Choice(
                            JsonFields.text(element, "key", Choice.class, ctxt),
                            JsonFields.text(element, "label", Choice.class, ctxt),
                            JsonFields.text(element, "nextNodeId", Choice.class, ctxt)));
        }
        return choices;
    }

    private List<Rule> deserializeRules(JsonNode root, DeserializationContext ctxt)
            throws IOException {
        JsonNode array = JsonFields.array(root, "rules", DecisionNode.class, ctxt);
        if (array == null) {
            return List.of();
        }
        List<Rule> rules = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            JsonFields.requireObject(element, "Rule", Rule.class, ctxt);
            rules.add(
                    new Rule(
                            JsonFields.text(element, "operator", Rule.class, ctxt),
                            JsonFields.text(element, "value", Rule.class, ctxt),
                            JsonFields.text(element, "nextNodeId", Rule.class, ctxt)));
        }
        return rules;
    }
}
