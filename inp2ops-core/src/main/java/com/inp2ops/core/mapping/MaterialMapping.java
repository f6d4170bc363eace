package com.inp2ops.core.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Material Model Map entry.
 *
 * @param ndMaterial multi-dimensional material used by solids and shell sections
 * @param uniaxialMaterial uniaxial material used by trusses
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MaterialMapping(
    @JsonProperty("nd") String ndMaterial,
    @JsonProperty("uniaxial") String uniaxialMaterial
) {}
