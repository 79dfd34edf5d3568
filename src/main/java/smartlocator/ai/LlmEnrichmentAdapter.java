package smartlocator.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.model.DomElement;
import smartlocator.model.LocatorCandidate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Asks an LLM for alternative locators for one element, given its markup
 * summary and the candidates already generated.
 *
 * <p>The model is asked for a JSON array of strings; a plain one-per-line
 * answer is accepted too. Suggestions that repeat an existing candidate are
 * dropped. The sentinel {@code NONE}, an empty answer or an LLM error all
 * yield {@link Optional#empty()}.
 */
public class LlmEnrichmentAdapter implements EnrichmentAdapter {

    private static final Logger log = LoggerFactory.getLogger(LlmEnrichmentAdapter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String NONE_SENTINEL   = "NONE";
    static final int    MAX_SUGGESTIONS = 3;

    private static final String SYSTEM_PROMPT = """
            You are a test-automation locator expert. Given one HTML element and the
            locators already generated for it, suggest up to 3 additional locators that
            would be more stable or more readable.

            Rules:
            - Return ONLY a JSON array of strings, e.g. ["[data-testid=\\"save\\"]"]
            - Each string is a CSS selector, an XPath, or a Playwright role selector
              written as role=<role>[name="<name>"s]
            - Never repeat a locator that is already listed
            - If you have nothing better to offer, return exactly: NONE
            """;

    private final LLMClient llm;

    public LlmEnrichmentAdapter(LLMClient llm) {
        this.llm = Objects.requireNonNull(llm, "llm");
    }

    @Override
    public Optional<List<String>> enrich(DomElement element, List<LocatorCandidate> candidates) {
        String userPrompt = """
                Element:
                - Tag: %s
                - Attributes: %s
                - Text: %s
                - Label: %s

                Existing locators:
                %s
                """.formatted(
                        element.getTagName(),
                        element.getAttributes(),
                        element.getText(),
                        element.getLabelText(),
                        candidates.stream()
                                .map(c -> "- " + c.getType().displayName() + ": " + c.getValue())
                                .collect(Collectors.joining("\n")));

        String response;
        try {
            response = llm.complete(List.of(
                    LLMClient.ChatMessage.system(SYSTEM_PROMPT),
                    LLMClient.ChatMessage.user(userPrompt)));
        } catch (IOException e) {
            log.warn("LLM enrichment failed for {}: {}", element, e.getMessage());
            return Optional.empty();
        }

        Set<String> existing = candidates.stream().map(LocatorCandidate::getValue).collect(Collectors.toSet());
        List<String> suggestions = parse(response).stream()
                .filter(s -> !existing.contains(s))
                .limit(MAX_SUGGESTIONS)
                .collect(Collectors.toList());
        log.debug("LLM suggested {} locator(s) for {}", suggestions.size(), element);
        return suggestions.isEmpty() ? Optional.empty() : Optional.of(suggestions);
    }

    /** Accepts a JSON array, a fenced JSON array or one locator per line. */
    static List<String> parse(String response) {
        if (response == null) return List.of();
        String text = stripFence(response.trim());
        if (text.isEmpty() || NONE_SENTINEL.equalsIgnoreCase(text)) return List.of();

        Set<String> out = new LinkedHashSet<>();
        if (text.startsWith("[")) {
            try {
                JsonNode arr = MAPPER.readTree(text);
                if (arr.isArray()) {
                    arr.forEach(n -> {
                        if (n.isTextual() && !n.asText().isBlank()) out.add(n.asText().trim());
                    });
                    return new ArrayList<>(out);
                }
            } catch (JsonProcessingException e) {
                log.debug("LLM answer is not a JSON array, reading it line by line");
            }
        }
        for (String line : text.split("\\R")) {
            String cleaned = line.trim()
                    .replaceFirst("^(?:[-*]|\\d+[.)])\\s*", "")
                    .replaceAll("^`+|`+$", "")
                    .trim();
            if (!cleaned.isEmpty() && !NONE_SENTINEL.equalsIgnoreCase(cleaned)) out.add(cleaned);
        }
        return new ArrayList<>(out);
    }

    private static String stripFence(String text) {
        if (!text.startsWith("```")) return text;
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) return text;
        return text.substring(firstNewline + 1, closing).trim();
    }
}
