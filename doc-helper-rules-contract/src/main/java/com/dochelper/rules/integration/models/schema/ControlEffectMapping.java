package com.dochelper.rules.integration.models.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a source field value to the effect applied on the target field.
 * Keys are canonical string forms of the source value. An exact key match
 * wins over the default; without either the rule has no effect.
 */
@Data
@NoArgsConstructor
public class ControlEffectMapping {

    @JsonProperty("cases")
    private Map<String, Object> cases = new LinkedHashMap<>();

    @JsonProperty("default")
    private Object defaultValue;

    @JsonIgnore
    private boolean defaultDefined;

    public ControlEffectMapping(Map<String, Object> cases) {
        this.cases = new LinkedHashMap<>(cases);
    }

    public ControlEffectMapping(Map<String, Object> cases, Object defaultValue) {
        this(cases);
        setDefaultValue(defaultValue);
    }

    @JsonProperty("default")
    public void setDefaultValue(Object defaultValue) {
        this.defaultValue = defaultValue;
        this.defaultDefined = true;
    }

    public Optional<MappedValue> lookup(String canonicalSourceValue) {
        if (cases != null && cases.containsKey(canonicalSourceValue)) {
            return Optional.of(new MappedValue(cases.get(canonicalSourceValue), true));
        }
        if (defaultDefined) {
            return Optional.of(new MappedValue(defaultValue, false));
        }
        return Optional.empty();
    }

    public record MappedValue(Object value, boolean exactMatch) {
    }
}
