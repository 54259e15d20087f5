package com.cellar.readiness.profile;

import com.cellar.readiness.domain.StructuralProfile;
import com.cellar.readiness.dto.WineProfilePayload;
import com.cellar.readiness.entity.WineEntity;
import com.cellar.readiness.repository.WineRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OpenAI structural profile generation.
 * Asks the model for the five axes under a strict JSON schema, recomputes power locally
 * and stores the result on the wine row, where {@link StoredProfileSource} picks it up.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OpenAiProfileGenerator {

    private static final String SYSTEM_PROMPT = """
            You are a professional sommelier. Analyze wines and provide structured profiles.

            For each wine, provide:
            - body (1-5): 1=very light, 3=medium, 5=very full
            - tannin (1-5): 1=low/none, 3=medium, 5=very high (mainly for reds; whites/roses typically 1-2)
            - acidity (1-5): 1=very low, 3=medium, 5=very high
            - oak (1-5): 1=none/unoaked, 3=moderate, 5=heavily oaked
            - sweetness (0-5): 0=bone dry, 1-2=off-dry, 3-4=medium sweet, 5=very sweet
            - alcohol_est (number or null): Estimated ABV if not provided
            - style_tags (array of 3-8 short kebab-case descriptors)
            - confidence (low|med|high): Your confidence in this assessment

            Base your analysis on grape varieties, region and terroir, vintage and any style descriptors.""";

    @Value("${openai.api.key:}")
    private String apiKey;

    @Value("${openai.api.url:https://api.openai.com/v1/chat/completions}")
    private String apiUrl;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.temperature:0.3}")
    private double temperature;

    @Value("${openai.max.tokens:500}")
    private int maxTokens;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final WineRepository wineRepository;
    private final Clock clock;

    /**
     * Generate and store a profile for one wine.
     *
     * @return the stored profile, or empty when the key is missing or the call failed
     * @throws IllegalArgumentException when the wine does not exist
     */
    @Transactional
    public Optional<StructuralProfile> generate(long wineId) {
        WineEntity wine = wineRepository.findById(wineId)
                .orElseThrow(() -> new IllegalArgumentException("Wine not found: " + wineId));

        if (apiKey == null || apiKey.isEmpty()) {
            log.warn("OpenAI API key not configured, wine {} keeps its heuristic profile", wineId);
            return Optional.empty();
        }

        try {
            String content = callOpenAI(buildWineContext(wine));
            WineProfilePayload payload = objectMapper.readValue(content, WineProfilePayload.class);
            if (!payload.hasAllAxes()) {
                log.warn("OpenAI profile for wine {} is missing axes: {}", wineId, content);
                return Optional.empty();
            }

            StructuralProfile profile = StoredProfileSource.toProfile(payload);
            payload.setPower(profile.getPower());
            payload.setSource("ai");
            payload.setConfidence(profile.getConfidence().getValue());
            payload.setUpdatedAt(OffsetDateTime.now(clock).toString());

            wine.setWineProfileJson(objectMapper.writeValueAsString(payload));
            wine.setWineProfileUpdatedAt(LocalDateTime.now(clock));
            wineRepository.save(wine);

            log.info("Stored AI profile for wine {} ({}): power {}, confidence {}",
                    wineId, wine.getWineName(), profile.getPower(), payload.getConfidence());
            return Optional.of(profile);

        } catch (Exception e) {
            log.error("Failed to generate profile for wine {}: {}", wineId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    String buildWineContext(WineEntity wine) {
        StringBuilder context = new StringBuilder("Wine: ").append(wine.getWineName());
        if (wine.getVintage() != null) {
            context.append(" (").append(wine.getVintage()).append(")");
        }
        if (wine.getProducer() != null) {
            context.append(" by ").append(wine.getProducer());
        }
        if (wine.getRegion() != null) {
            context.append(" from ").append(wine.getRegion());
        }
        if (wine.getCountry() != null) {
            context.append(", ").append(wine.getCountry());
        }
        context.append("\nColor: ").append(wine.getColor() != null ? wine.getColor() : "red");
        List<String> grapes = wine.getGrapes();
        context.append("\nGrapes: ").append(grapes == null || grapes.isEmpty() ? "Unknown" : String.join(", ", grapes));
        if (wine.getAppellation() != null) {
            context.append("\nAppellation: ").append(wine.getAppellation());
        }
        return context.toString();
    }

    private String callOpenAI(String wineContext) throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", "Analyze this wine and provide its profile:\n\n" + wineContext)
                ),
                "temperature", temperature,
                "max_tokens", maxTokens,
                "response_format", Map.of(
                        "type", "json_schema",
                        "json_schema", Map.of(
                                "name", "wine_profile",
                                "strict", true,
                                "schema", profileSchema()))
        );

        log.debug("Calling OpenAI API: model={}, temperature={}, max_tokens={}", model, temperature, maxTokens);

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);
        ResponseEntity<String> response = restTemplate.postForEntity(apiUrl, request, String.class);

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new IllegalStateException("OpenAI API returned error: " + response.getStatusCode());
        }

        JsonNode root = objectMapper.readTree(response.getBody());
        if (!root.has("choices") || root.get("choices").size() == 0) {
            throw new IllegalStateException("No choices in OpenAI response");
        }
        JsonNode message = root.get("choices").get(0).get("message");
        if (message == null || !message.has("content")) {
            throw new IllegalStateException("No content in OpenAI response");
        }
        return message.get("content").asText();
    }

    private static Map<String, Object> profileSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("body", axis(1));
        properties.put("tannin", axis(1));
        properties.put("acidity", axis(1));
        properties.put("oak", axis(1));
        properties.put("sweetness", axis(0));
        properties.put("alcohol_est", Map.of("anyOf", List.of(Map.of("type", "number"), Map.of("type", "null"))));
        properties.put("style_tags", Map.of(
                "type", "array",
                "items", Map.of("type", "string"),
                "minItems", 3,
                "maxItems", 8));
        properties.put("confidence", Map.of("type", "string", "enum", List.of("low", "med", "high")));

        return Map.of(
                "type", "object",
                "properties", properties,
                "required", List.copyOf(properties.keySet()),
                "additionalProperties", false);
    }

    private static Map<String, Object> axis(int minimum) {
        return Map.of("type", "integer", "minimum", minimum, "maximum", 5);
    }
}
