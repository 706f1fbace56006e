package io.verdict.serialization;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/// Case-insensitive field access on Jackson object nodes.
///
/// Tree definitions written by hand or by other tools vary in field name casing
/// (`startNodeId`, `StartNodeId`, `startnodeid`); all are accepted. An exact match
/// wins over a case-insensitive one.
///
/// @implNote Package-private helper for the deserializers in this package.
final class JsonFields {

    private JsonFields() {}

    /// Looks up a field ignoring case.
    ///
    /// @param object object node, not null
    /// @param name field name as documented
    /// @return the field value, or null if absent
    static JsonNode get(JsonNode object, String name) {
        JsonNode exact = object.get(name);
        if (exact != null) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equalsIgnoreCase(name)) {
                return field.getValue();
            }
        }
        return null;
    }

    /// Reads a scalar field as text.
    ///
    /// Numbers and booleans are accepted and converted to their textual form.
    ///
    /// @return the text, or null if the field is absent or JSON null
    /// @throws IOException if the field holds an object or array
    static String text(
            JsonNode object, String name, Class<?> owner, DeserializationContext ctxt)
            throws IOException {
        JsonNode value = get(object, name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            return ctxt.reportInputMismatch(
                    owner, "Field '%s' must be a string, found %s", name, value.getNodeType());
        }
        return value.asText();
    }

    /// Reads an array field.
    ///
    /// @return the array node, or null if the field is absent or JSON null
    /// @throws IOException if the field is not an array
    static JsonNode array(
            JsonNode object, String name, Class<?> owner, DeserializationContext ctxt)
            throws IOException {
        JsonNode value = get(object, name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            return ctxt.reportInputMismatch(
                    owner, "Field '%s' must be an array, found %s", name, value.getNodeType());
        }
        return value;
    }

    /// Ensures a node is a JSON object.
    ///
    /// @throws IOException if it is not
    static void requireObject(
            JsonNode node, String what, Class<?> owner, DeserializationContext ctxt)
            throws IOException {
        if (node == null || !node.isObject()) {
            ctxt.reportInputMismatch(
                    owner,
                    "%s must be a JSON object, found %s",
                    what,
                    node == null ? "nothing" : node.getNodeType());
        }
    }
}
