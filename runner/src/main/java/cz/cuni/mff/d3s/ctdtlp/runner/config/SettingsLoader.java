package cz.cuni.mff.d3s.ctdtlp.runner.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the factor settings JSON and normalizes it into a {@link FactorModel}.
 *
 * <p>Unknown keys, fractional enum values, duplicate enum values and factors declaring both
 * or neither of {@code ltl} and {@code values} are rejected.
 */
@Slf4j
public final class SettingsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private SettingsLoader() {}

    /**
     * @throws IllegalArgumentException if the document is not valid JSON or describes an invalid model
     * @throws UncheckedIOException if the file cannot be read
     */
    public static FactorModel load(Path settingsPath) {
        log.info("Loading factor settings from {}", settingsPath);
        String json;
        try {
            json = Files.readString(settingsPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings " + settingsPath, e);
        }
        FactorModel model = parse(json);
        log.info("Loaded {} factors: {}", model.size(), model.getFactorNames());
        return model;
    }

    public static FactorModel parse(String json) {
        SettingsDocument document;
        try {
            document = MAPPER.readValue(json, SettingsDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid settings document: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new IllegalArgumentException("Settings document is empty");
        }
        return toFactorModel(document);
    }

    static FactorModel toFactorModel(SettingsDocument document) {
        if (document.getStepVar() == null || document.getStepVar().isBlank()) {
            throw new IllegalArgumentException("Settings must declare 'step_var'");
        }
        if (document.getFactors() == null || document.getFactors().isEmpty()) {
            throw new IllegalArgumentException("Settings must declare at least one factor");
        }

        FactorModel.FactorModelBuilder builder = FactorModel.builder()
                .stepVariable(document.getStepVar().strip())
                .endFlag(document.getEndFlag())
                .testRule(document.getTestRule())
                .noopStep(document.getNoopStep());
        for (SettingsDocument.FactorEntry entry : document.getFactors()) {
            builder.factor(toFactor(entry));
        }
        return builder.build();
    }

    private static Factor toFactor(SettingsDocument.FactorEntry entry) {
        String name = entry.getName();
        boolean hasLtl = entry.getLtl() != null;
        boolean hasValues = entry.getValues() != null;
        if (hasLtl == hasValues) {
            throw new IllegalArgumentException("Factor '" + name + "' must declare exactly one of 'ltl' (boolean) "
                    + "or 'values' (enum)");
        }
        if (hasLtl) {
            return Factor.bool(name, entry.getLtl(), entry.getVar());
        }

        Map<Long, String> predicates = new LinkedHashMap<>();
        for (SettingsDocument.ValueEntry value : entry.getValues()) {
            if (value == null || value.getValue() == null) {
                throw new IllegalArgumentException("Enum factor '" + name + "' has a value without 'value'");
            }
            if (predicates.containsKey(value.getValue())) {
                throw new IllegalArgumentException("Enum factor '" + name + "' declares value " + value.getValue()
                        + " twice");
            }
            predicates.put(value.getValue(), value.getLtl());
        }
        return Factor.enumerated(name, predicates, entry.getVar());
    }
}
