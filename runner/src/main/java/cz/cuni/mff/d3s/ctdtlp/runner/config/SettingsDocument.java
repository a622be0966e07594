package cz.cuni.mff.d3s.ctdtlp.runner.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * The factor settings JSON as written by the user, before normalization into a
 * {@link cz.cuni.mff.d3s.ctdtlp.model.common.factors.FactorModel}.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
public class SettingsDocument {

    @JsonProperty("step_var")
    private String stepVar;

    @JsonProperty("end_flag")
    private String endFlag;

    @JsonProperty("test_rule")
    private String testRule;

    @JsonProperty("noop_step")
    private String noopStep;

    @JsonProperty("factors")
    private List<FactorEntry> factors = new ArrayList<>();

    /**
     * One factor: {@code ltl} makes it boolean, {@code values} makes it an enum.
     */
    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    public static class FactorEntry {

        @JsonProperty("name")
        private String name;

        @JsonProperty("ltl")
        private String ltl;

        @JsonProperty("values")
        private List<ValueEntry> values;

        @JsonProperty("var")
        private String var;
    }

    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    public static class ValueEntry {

        @JsonProperty("value")
        private Long value;

        @JsonProperty("ltl")
        private String ltl;
    }
}
