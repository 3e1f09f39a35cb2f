package org.aascore.codegen.parse;

/**
 * Settings of the {@code json_serialization} marker.
 *
 * @param withModelType Whether serialized instances carry their concrete type
 */
public record JsonSerialization(boolean withModelType) {
}
