package com.dochelper.rules.core.engine.schema;

import com.dochelper.rules.core.engine.validation.RuleSetDefinitionValidator;
import com.dochelper.rules.core.exception.context.RuleSetDefinitionException;
import com.dochelper.rules.core.util.CommonUtil;
import com.dochelper.rules.integration.models.schema.RuleSetDefinition;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Reads and writes rule set definitions as JSON or YAML.
 *
 * <p>Every rule set read is validated with {@link RuleSetDefinitionValidator}
 * before it is returned. Numbers in field values and mappings are read as
 * BigDecimal.</p>
 */
@Slf4j
public final class RuleSetDefinitionLoader {

    private static final ObjectMapper JSON_MAPPER;
    private static final ObjectMapper YAML_MAPPER;
    private static final RuleSetDefinitionValidator VALIDATOR = new RuleSetDefinitionValidator();

    static {
        JSON_MAPPER = new ObjectMapper();
        configureMapper(JSON_MAPPER);

        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        YAML_MAPPER = new ObjectMapper(yamlFactory);
        configureMapper(YAML_MAPPER);
    }

    private static void configureMapper(ObjectMapper mapper) {
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private RuleSetDefinitionLoader() {
        // Utility class
    }

    public static RuleSetDefinition fromJson(String json) {
        return read(JSON_MAPPER, json, "JSON");
    }

    public static RuleSetDefinition fromYaml(String yaml) {
        return read(YAML_MAPPER, yaml, "YAML");
    }

    /**
     * Loads a rule set from the classpath. Files ending in {@code .yaml} or
     * {@code .yml} are read as YAML, anything else as JSON.
     */
    public static RuleSetDefinition fromClasspath(String location) {
        String content;
        try {
            content = CommonUtil.readResource(location);
        } catch (IOException e) {
            log.error("Failed to read rule set resource [{}]: {}", location, e.getMessage(), e);
            throw new RuleSetDefinitionException("Failed to read rule set resource [" + location + "]", e);
        }
        String extension = CommonUtil.extensionOf(location);
        RuleSetDefinition ruleSet = "yaml".equals(extension) || "yml".equals(extension)
                ? fromYaml(content)
                : fromJson(content);
        log.info("Loaded rule set [{}] from [{}]: {} field(s), {} control rule(s)",
                ruleSet.getId(), location, ruleSet.getFields().size(), ruleSet.getControlRules().size());
        return ruleSet;
    }

    public static String toJson(RuleSetDefinition ruleSet) {
        try {
            return JSON_MAPPER.writeValueAsString(ruleSet);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize rule set to JSON: {}", e.getMessage(), e);
            throw new RuleSetDefinitionException("Failed to serialize rule set to JSON", e);
        }
    }

    public static String toYaml(RuleSetDefinition ruleSet) {
        try {
            return YAML_MAPPER.writeValueAsString(ruleSet);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize rule set to YAML: {}", e.getMessage(), e);
            throw new RuleSetDefinitionException("Failed to serialize rule set to YAML", e);
        }
    }

    private static RuleSetDefinition read(ObjectMapper mapper, String content, String format) {
        RuleSetDefinition ruleSet;
        try {
            ruleSet = mapper.readValue(content, RuleSetDefinition.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize rule set from {}: {}", format, e.getOriginalMessage(), e);
            throw new RuleSetDefinitionException("Failed to deserialize rule set from " + format, e);
        }
        VALIDATOR.validate(ruleSet);
        return ruleSet;
    }
}
