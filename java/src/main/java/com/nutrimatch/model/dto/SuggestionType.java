package com.nutrimatch.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SuggestionType {
    @JsonProperty("add_ingredient")
    ADD_INGREDIENT,
    @JsonProperty("substitute_ingredient")
    SUBSTITUTE_INGREDIENT
}
