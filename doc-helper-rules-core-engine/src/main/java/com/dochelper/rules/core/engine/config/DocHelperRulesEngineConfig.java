package com.dochelper.rules.core.engine.config;

import com.dochelper.rules.core.exception.DocHelperRulesRuntimeException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Properties;

/**
 * Engine settings.
 *
 * <ul>
 *   <li>{@code doc-helper.rules.control.max-chain-depth}: maximum number of
 *   control rule hops from one edit (default 10)</li>
 *   <li>{@code doc-helper.rules.formula.decimal-precision}: significant digits
 *   of formula arithmetic (default 16)</li>
 * </ul>
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class DocHelperRulesEngineConfig {

    public static final String PROPERTIES_RESOURCE = "doc-helper-rules.properties";
    public static final String MAX_CHAIN_DEPTH_PROPERTY = "doc-helper.rules.control.max-chain-depth";
    public static final String DECIMAL_PRECISION_PROPERTY = "doc-helper.rules.formula.decimal-precision";

    public static final int DEFAULT_MAX_CHAIN_DEPTH = 10;
    public static final int DEFAULT_DECIMAL_PRECISION = 16;

    @Builder.Default
    int maxControlChainDepth = DEFAULT_MAX_CHAIN_DEPTH;
    @Builder.Default
    int decimalPrecision = DEFAULT_DECIMAL_PRECISION;
    @Builder.Default
    Clock clock = Clock.systemUTC();

    public MathContext getMathContext() {
        return new MathContext(decimalPrecision, RoundingMode.HALF_EVEN);
    }

    public static DocHelperRulesEngineConfig defaults() {
        return DocHelperRulesEngineConfig.builder().build();
    }

    /**
     * Reads {@value #PROPERTIES_RESOURCE} from the classpath, falling back to
     * defaults when the resource is absent.
     */
    public static DocHelperRulesEngineConfig load() {
        try (InputStream inputStream = DocHelperRulesEngineConfig.class.getClassLoader()
                .getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (inputStream == null) {
                log.debug("No {} on the classpath, using default engine settings", PROPERTIES_RESOURCE);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(inputStream);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new DocHelperRulesRuntimeException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
    }

    public static DocHelperRulesEngineConfig fromProperties(Properties properties) {
        DocHelperRulesEngineConfig config = DocHelperRulesEngineConfig.builder()
                .maxControlChainDepth(intProperty(properties, MAX_CHAIN_DEPTH_PROPERTY, DEFAULT_MAX_CHAIN_DEPTH))
                .decimalPrecision(intProperty(properties, DECIMAL_PRECISION_PROPERTY, DEFAULT_DECIMAL_PRECISION))
                .build();
        log.info("Engine settings: max control chain depth {}, decimal precision {}",
                config.getMaxControlChainDepth(), config.getDecimalPrecision());
        return config;
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new DocHelperRulesRuntimeException("Property " + key + " must be an integer, got [" + raw + "]", e);
        }
        if (value < 1) {
            throw new DocHelperRulesRuntimeException("Property " + key + " must be at least 1, got " + value);
        }
        return value;
    }
}
