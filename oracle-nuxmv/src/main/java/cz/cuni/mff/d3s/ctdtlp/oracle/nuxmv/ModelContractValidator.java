package cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv;

import cz.cuni.mff.d3s.ctdtlp.model.common.factors.Factor;
import cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that an SMV model declares every variable the generator reads from witness traces:
 * the step variable, the end flag and each factor's backing variable.
 *
 * <p>Declarations are looked up in {@code VAR}, {@code FROZENVAR} and {@code DEFINE} sections only,
 * so a name that merely occurs in a formula or an assignment does not count.
 */
@Slf4j
public final class ModelContractValidator {

    private static final Pattern SECTION_KEYWORD = Pattern.compile(
            "(?m)^\\s*(MODULE|VAR|IVAR|FROZENVAR|DEFINE|ASSIGN|TRANS|INIT|INVAR|LTLSPEC|SPEC|CTLSPEC|INVARSPEC"
                    + "|FAIRNESS|JUSTICE|COMPASSION|CONSTANTS)\\b");
    private static final Set<String> DECLARING_SECTIONS = Set.of("VAR", "FROZENVAR", "DEFINE");
    private static final Pattern COMMENT = Pattern.compile("--[^\\n]*");

    private ModelContractValidator() {}

    /**
     * @return one message per missing identifier, empty when the contract holds
     * @throws UncheckedIOException if the model cannot be read
     */
    public static List<String> validate(Path model, FactorModel factorModel) {
        String text;
        try {
            text = Files.readString(model, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model " + model, e);
        }

        String declarations = declarationSections(COMMENT.matcher(text).replaceAll(""));
        if (declarations.isBlank()) {
            return List.of("No VAR section found in model " + model);
        }

        Map<String, String> required = new LinkedHashMap<>();
        required.put(factorModel.getStepVariable(), "step variable");
        factorModel.getEndFlagVariable().ifPresent(end -> required.putIfAbsent(end, "end flag"));
        for (Factor factor : factorModel.getFactors()) {
            required.putIfAbsent(factor.getBackingVariable(), "backing variable of factor '" + factor.getName() + "'");
        }

        List<String> missing = new ArrayList<>();
        required.forEach((identifier, role) -> {
            if (!isDeclared(declarations, identifier)) {
                missing.add("Missing " + role + " '" + identifier + "'");
            }
        });
        return missing;
    }

    /**
     * @throws IllegalArgumentException listing every missing identifier
     */
    public static void validateOrThrow(Path model, FactorModel factorModel) {
        List<String> missing = validate(model, factorModel);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Model contract violated:\n  - " + String.join("\n  - ", missing));
        }
        log.info("Model contract OK for {}", model);
    }

    private static String declarationSections(String text) {
        StringBuilder declarations = new StringBuilder();
        Matcher matcher = SECTION_KEYWORD.matcher(text);
        String currentSection = null;
        int sectionStart = 0;
        while (matcher.find()) {
            if (currentSection != null && DECLARING_SECTIONS.contains(currentSection)) {
                declarations.append(text, sectionStart, matcher.start()).append('\n');
            }
            currentSection = matcher.group(1);
            sectionStart = matcher.end();
        }
        if (currentSection != null && DECLARING_SECTIONS.contains(currentSection)) {
            declarations.append(text, sectionStart, text.length());
        }
        return declarations.toString();
    }

    private static boolean isDeclared(String declarations, String identifier) {
        Pattern declaration = Pattern.compile("(?<![A-Za-z0-9_$#.])" + Pattern.quote(identifier) + "\\s*:");
        return declaration.matcher(declarations).find();
    }
}
