package io.verdict.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the decision tree definition format.
///
/// Registers two custom serializer/deserializer pairs:
/// - `DecisionTree` - `TreeDefinitionSerializer` / `TreeDefinitionDeserializer`
/// - `DecisionNode` - `NodeSerializer` / `NodeDeserializer`
///
/// Choices and rules are handled inline by the node pair. Field names are matched
/// case-insensitively on read and written in camel case.
///
/// @implNote All registrations are explicit; no reflection over the domain types.
/// @see DecisionTreeSerializer for the convenience factory API
public class VerdictJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2904175566318423179L;

    public VerdictJacksonModule() {
        super("VerdictJacksonModule");

        addSerializer(DecisionTree.class, new TreeDefinitionSerializer());
        addDeserializer(DecisionTree.class, new TreeDefinitionDeserializer());

        addSerializer(DecisionNode.class, new NodeSerializer());
        addDeserializer(DecisionNode.class, new NodeDeserializer());
    }
}
