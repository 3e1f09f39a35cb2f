package org.aascore.codegen.intermediate;

/**
 * Built-in primitive types of the meta-model.
 */
public enum PrimitiveType {
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STR("str"),
    BYTEARRAY("bytearray");

    private final String typeName;

    PrimitiveType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Resolves a primitive type by name.
     *
     * @param name The type name as written in the meta-model
     * @return The corresponding PrimitiveType
     * @throws IllegalArgumentException if no matching type exists
     */
    public static PrimitiveType fromName(String name) {
        for (PrimitiveType type : values()) {
            if (type.typeName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown primitive type: " + name);
    }

    public static boolean isPrimitive(String name) {
        for (PrimitiveType type : values()) {
            if (type.typeName.equals(name)) {
                return true;
            }
        }
        return false;
    }
}
