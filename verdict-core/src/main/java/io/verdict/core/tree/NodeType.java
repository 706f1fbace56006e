package io.verdict.core.tree;

import java.util.Locale;

/// Decision node types.
///
/// Each type carries the name used in tree definitions. Names are matched
/// case-insensitively; unrecognized names map to {@link #UNKNOWN}, whose
/// nodes only follow their default edge.
public enum NodeType {
    END("End"),
    SINGLE_CHOICE("SingleChoice"),
    NUMBER("Number"),
    TEXT("Text"),
    UNKNOWN("");

    private final String definitionName;

    NodeType(String definitionName) {
        this.definitionName = definitionName;
    }

    /// Returns the name used for this type in tree definitions.
    ///
    /// @return definition name, empty for {@link #UNKNOWN}
    public String getDefinitionName() {
        return definitionName;
    }

    /// Resolves a definition name to a node type.
    ///
    /// @param name type name as written in a definition, may be null
    /// @return matching type, or {@link #UNKNOWN} if null, blank or unrecognized
    public static NodeType fromDefinitionName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type != UNKNOWN
                    && type.definitionName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
