package com.nutrimatch.index.filter;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataMatcherTest {

    private static final Map<String, Object> METADATA = Map.of(
            "title", "Lentil Soup",
            "cuisine_type", "indian",
            "dietary_tags", List.of("vegan", "gluten_free"),
            "ingredients", List.of("lentils", "spinach", "onion"));

    @Test
    void equalTo_ComparesWholeValue() {
        assertThat(MetadataMatcher.matches(METADATA, MetadataFilter.of("cuisine_type", FieldConstraint.equalTo("indian"))))
                .isTrue();
        assertThat(MetadataMatcher.matches(METADATA, MetadataFilter.of("cuisine_type", FieldConstraint.equalTo("thai"))))
                .isFalse();
    }

    @Test
    void in_IntersectsCollectionFields() {
        assertThat(MetadataMatcher.matches(METADATA,
                MetadataFilter.of("dietary_tags", FieldConstraint.in(List.of("keto", "vegan"))))).isTrue();
        assertThat(MetadataMatcher.matches(METADATA,
                MetadataFilter.of("dietary_tags", FieldConstraint.in(List.of("keto"))))).isFalse();
        assertThat(MetadataMatcher.matches(METADATA,
                MetadataFilter.of("cuisine_type", FieldConstraint.in(List.of("indian", "thai"))))).isTrue();
    }

    @Test
    void contains_UsesElementEqualityForCollectionsAndSubstringForStrings() {
        assertThat(MetadataMatcher.matches("Lentil Soup", FieldConstraint.contains("Soup"))).isTrue();
        assertThat(MetadataMatcher.matches(List.of("lentils"), FieldConstraint.contains("lentil"))).isFalse();
        assertThat(MetadataMatcher.matches(List.of("lentils"), FieldConstraint.contains("lentils"))).isTrue();
    }

    @Test
    void nullValuesInConstraintListsAreIgnored() {
        FieldConstraint in = FieldConstraint.in(Arrays.asList("vegan", null));
        FieldConstraint notContains = FieldConstraint.notContains(Arrays.asList(null, "tofu"));

        assertThat(((FieldConstraint.In) in).values()).containsExactly("vegan");
        assertThat(MetadataMatcher.matches(METADATA, MetadataFilter.of("dietary_tags", in))).isTrue();
        assertThat(MetadataMatcher.matches(METADATA, MetadataFilter.of("ingredients", notContains))).isTrue();
    }

    @Test
    void notContains_RejectsAnyListedValue() {
        assertThat(MetadataMatcher.matches(METADATA,
                MetadataFilter.of("ingredients", FieldConstraint.notContains(List.of("tofu", "soy sauce"))))).isTrue();
        assertThat(MetadataMatcher.matches(METADATA,
                MetadataFilter.of("ingredients", FieldConstraint.notContains(List.of("tofu", "onion"))))).isFalse();
    }

    @Test
    void missingFieldFailsAndEmptyFilterPasses() {
        assertThat(MetadataMatcher.matches(METADATA, MetadataFilter.of("calories", FieldConstraint.equalTo(100))))
                .isFalse();
        assertThat(MetadataMatcher.matches(METADATA, MetadataFilter.none())).isTrue();
        assertThat(MetadataMatcher.matches(METADATA, (MetadataFilter) null)).isTrue();
    }

    @Test
    void constraintsAreConjunctive() {
        MetadataFilter filter = MetadataFilter.of("dietary_tags", FieldConstraint.in(List.of("vegan")))
                .and("ingredients", FieldConstraint.notContains(List.of("onion")));

        assertThat(MetadataMatcher.matches(METADATA, filter)).isFalse();
    }
}
