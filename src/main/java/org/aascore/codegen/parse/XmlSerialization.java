package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;

/**
 * Settings of the {@code xml_serialization} marker.
 *
 * @param propertyAsText Property serialized as the element text, or null
 */
public record XmlSerialization(Identifier propertyAsText) {
}
