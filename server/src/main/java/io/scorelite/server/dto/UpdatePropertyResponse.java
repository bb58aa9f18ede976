// file: src/main/java/io/scorelite/server/dto/UpdatePropertyResponse.java
package io.scorelite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON response for a property update: the new property hash and merged fields.
 */
public class UpdatePropertyResponse {
    @JsonProperty("property_hash")
    public String propertyHash;

    public PropertyDto property;
}
