// file: src/main/java/io/scorelite/server/dto/PropertyDto.java
package io.scorelite.server.dto;

import io.scorelite.core.Property;
import io.scorelite.core.PropertyPatch;

/**
 * Property fields as they appear on the wire. Either field may be absent.
 * Example:
 *   { "title": "Sonata", "description": "op. 2" }
 */
public class PropertyDto {
    public String title;
    public String description;

    public static PropertyDto from(Property p) {
        var dto = new PropertyDto();
        dto.title = p.title();
        dto.description = p.description();
        return dto;
    }

    public PropertyPatch toPatch() {
        return new PropertyPatch(title, description);
    }
}
