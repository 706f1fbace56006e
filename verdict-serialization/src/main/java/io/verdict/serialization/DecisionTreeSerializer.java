package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.verdict.core.tree.DecisionTree;

/// Utility class for serializing and deserializing decision trees to/from JSON.
///
/// ### Usage
/// {@snippet :
/// // Serialize
/// String json = DecisionTreeSerializer.toJson(tree);
///
/// // Deserialize
/// DecisionTree restored = DecisionTreeSerializer.fromJson(json);
///
/// // Custom ObjectMapper
/// ObjectMapper mapper = DecisionTreeSerializer.createMapper();
/// }
///
/// Deserialization performs no structural validation. Use
/// {@link JacksonDecisionTreeParser} with the engine, or {@link DecisionTreeService},
/// to obtain validated trees.
///
/// @implNote Thread-safe. The ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see VerdictJacksonModule for the registered type handlers
public final class DecisionTreeSerializer {

    private DecisionTreeSerializer() {}

    /// Serializes a tree to pretty-printed JSON.
    ///
    /// @param tree the tree to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(DecisionTree tree) {
        try {
            return createMapper().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize decision tree: " + e.getMessage(), e);
        }
    }

    /// Deserializes a tree from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized tree, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static DecisionTree fromJson(String json) {
        try {
            DecisionTree tree = createMapper().readValue(json, DecisionTree.class);
            if (tree == null) {
                throw new IllegalArgumentException("Failed to deserialize decision tree: null");
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize decision tree: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for decision tree serialization.
    ///
    /// Registers:
    /// - `VerdictJacksonModule` for the tree and node types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - `FAIL_ON_TRAILING_TOKENS` enabled, so text after the definition is an error
    /// - indented output, for definitions edited by hand
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new VerdictJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
