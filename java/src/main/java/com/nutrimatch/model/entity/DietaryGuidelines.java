package com.nutrimatch.model.entity;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Guideline tables: restrictions, allergies, health conditions and
 * ingredient substitutions. Lookups of unknown keys return empty rules.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DietaryGuidelines {

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private Map<String, RestrictionRule> dietaryRestrictions = new LinkedHashMap<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private Map<String, AllergyRule> allergies = new LinkedHashMap<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private Map<String, HealthConditionRule> healthConditions = new LinkedHashMap<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private Map<String, SubstitutionRule> ingredientSubstitutions = new LinkedHashMap<>();

    public static DietaryGuidelines empty() {
        return new DietaryGuidelines();
    }

    public RestrictionRule restriction(String key) {
        RestrictionRule rule = key != null && dietaryRestrictions != null ? dietaryRestrictions.get(key) : null;
        return rule != null ? rule : new RestrictionRule();
    }

    public AllergyRule allergy(String key) {
        AllergyRule rule = key != null && allergies != null ? allergies.get(key) : null;
        return rule != null ? rule : new AllergyRule();
    }

    public HealthConditionRule healthCondition(String key) {
        HealthConditionRule rule = key != null && healthConditions != null ? healthConditions.get(key) : null;
        return rule != null ? rule : new HealthConditionRule();
    }

    public SubstitutionRule substitution(String ingredient) {
        SubstitutionRule rule = ingredient != null && ingredientSubstitutions != null
                ? ingredientSubstitutions.get(ingredient) : null;
        return rule != null ? rule : new SubstitutionRule();
    }
}
