package com.cycleindicators.common.config;

import com.cycleindicators.common.exception.IndicatorConfigurationException;
import com.cycleindicators.common.model.Bounds;
import com.cycleindicators.common.model.IndicatorSpec;
import com.cycleindicators.common.model.Side;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the bounds/weight file into an {@link IndicatorConfiguration}.
 *
 * <pre>
 * {
 *   "bottom": { "cm_vix_fix": { "lower": 0, "upper": 30, "weight": 10 }, ... },
 *   "top":    { "bbwp":       { "lower": 0, "upper": 100, "weight": 10 }, ... }
 * }
 * </pre>
 *
 * <p>Rejected: missing or non-numeric fields, non-finite numbers, negative weights and
 * {@code lower > upper}. {@code lower == upper} is accepted and fails per indicator at run time.
 */
public final class IndicatorConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(IndicatorConfigurationLoader.class);

    private final ObjectMapper objectMapper;

    public IndicatorConfigurationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public IndicatorConfiguration load(InputStream in, String sourceName) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IndicatorConfigurationException("Unreadable indicator configuration: " + sourceName, e);
        }
        if (root == null || !root.isObject()) {
            throw new IndicatorConfigurationException("Indicator configuration must be a JSON object: " + sourceName);
        }

        List<IndicatorSpec> specs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> sections = root.fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> section = sections.next();
            Side side;
            try {
                side = Side.fromKey(section.getKey());
            } catch (IllegalArgumentException e) {
                throw new IndicatorConfigurationException(
                    "Unknown side section '" + section.getKey() + "' in " + sourceName, e);
            }
            Iterator<Map.Entry<String, JsonNode>> entries = section.getValue().fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                specs.add(toSpec(side, entry.getKey(), entry.getValue(), sourceName));
            }
        }

        IndicatorConfiguration configuration = IndicatorConfiguration.of(specs);
        log.info("INDICATOR_CONFIG_LOADED source={} bottom={} top={}",
                 sourceName, configuration.specs(Side.BOTTOM).size(), configuration.specs(Side.TOP).size());
        return configuration;
    }

    private IndicatorSpec toSpec(Side side, String name, JsonNode node, String sourceName) {
        double lower  = number(node, "lower",  side, name, sourceName);
        double upper  = number(node, "upper",  side, name, sourceName);
        double weight = number(node, "weight", side, name, sourceName);

        if (weight < 0.0) {
            throw new IndicatorConfigurationException(String.format(
                "Negative weight %.4f for %s indicator '%s' in %s", weight, side.key(), name, sourceName));
        }
        if (lower > upper) {
            throw new IndicatorConfigurationException(String.format(
                "Bounds lower=%.4f > upper=%.4f for %s indicator '%s' in %s",
                lower, upper, side.key(), name, sourceName));
        }
        if (lower == upper) {
            log.warn("Degenerate bounds for {} indicator '{}' (lower == upper == {}), it will never score",
                     side.key(), name, lower);
        }
        return new IndicatorSpec(name, side, Bounds.of(lower, upper), weight);
    }

    private static double number(JsonNode node, String field, Side side, String name, String sourceName) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IndicatorConfigurationException(String.format(
                "Missing numeric '%s' for %s indicator '%s' in %s", field, side.key(), name, sourceName));
        }
        double d = value.asDouble();
        if (!Double.isFinite(d)) {
            throw new IndicatorConfigurationException(String.format(
                "Non-finite '%s' for %s indicator '%s' in %s", field, side.key(), name, sourceName));
        }
        return d;
    }
}
