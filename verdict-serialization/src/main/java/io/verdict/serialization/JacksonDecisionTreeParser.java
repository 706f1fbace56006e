package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.verdict.core.exception.TreeParseException;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.tree.DecisionTreeParser;
import java.util.Objects;

/// Jackson-based implementation of {@link DecisionTreeParser}.
///
/// Reads the JSON definition format:
/// ```json
/// {
///   "id": "billing", "version": "1.0", "startNodeId": "q1",
///   "nodes": {
///     "q1": {"prompt": "Amount?", "type": "Number",
///            "rules": [{"operator": "LessThan", "value": "100", "nextNodeId": "low"}],
///            "defaultNextNodeId": "high"},
///     "low":  {"prompt": "Small", "type": "End"},
///     "high": {"prompt": "Large", "type": "End"}
///   }
/// }
/// ```
///
/// Malformed JSON, a document that is not an object, or fields of the wrong shape
/// are reported as {@link TreeParseException}.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe
/// (Jackson's mapper is, once configured).
///
/// @see DecisionTreeParser for the interface contract
public class JacksonDecisionTreeParser implements DecisionTreeParser {

    private final ObjectMapper objectMapper;

    /// Creates a parser backed by {@link DecisionTreeSerializer#createMapper()}.
    public JacksonDecisionTreeParser() {
        this(DecisionTreeSerializer.createMapper());
    }

    /// Creates a parser backed by the given Jackson mapper.
    ///
    /// @param objectMapper mapper with {@link VerdictJacksonModule} registered, not null
    public JacksonDecisionTreeParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public DecisionTree parse(String text) throws TreeParseException {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isBlank()) {
            throw new TreeParseException("Decision tree definition is empty");
        }

        DecisionTree tree;
        try {
            tree = objectMapper.readValue(text, DecisionTree.class);
        } catch (JsonProcessingException e) {
            throw new TreeParseException(
                    "Failed to parse decision tree JSON: " + e.getOriginalMessage(), e);
        }
        if (tree == null) {
            throw new TreeParseException("Decision tree definition is null");
        }
        return tree;
    }

    @Override
    public String format(DecisionTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        try {
            return objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize decision tree: " + e.getMessage(), e);
        }
    }
}
