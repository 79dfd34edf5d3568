package smartlocator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Free-form locator advice an enrichment adapter returned for one element. */
public record ElementSuggestion(
        @JsonProperty("custom_name") String customName,
        @JsonProperty("element_index") int elementIndex,
        @JsonProperty("suggestions") List<String> suggestions) {

    public ElementSuggestion {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
