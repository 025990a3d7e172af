/* (C)2026 */
package com.ammann.valuation.pass;

import com.ammann.valuation.enumeration.ParseAttempt;
import com.ammann.valuation.enumeration.PassKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Maps stored JSON payloads to the typed variant declared for their pass.
 */
@ApplicationScoped
public class PassOutputMapper {

    private static final Logger LOG = Logger.getLogger(PassOutputMapper.class);

    private static final Map<Integer, Class<? extends PassOutput>> EXTRACTION_TYPES = Map.of(
            0, CompanyBackground.class,
            1, CoreCompanyData.class,
            2, IncomeStatementDetails.class,
            3, BalanceSheetDetails.class,
            4, SpecialItems.class,
            5, BusinessMetrics.class);

    private final ObjectMapper objectMapper;
    private final PassRegistry registry;

    @Inject
    public PassOutputMapper(ObjectMapper objectMapper, PassRegistry registry) {
        this.objectMapper = objectMapper;
        this.registry = registry;
    }

    public PassOutputs mapAll(Collection<StoredPassOutput> stored) {
        Map<Integer, PassOutput> typed = new HashMap<>();
        for (StoredPassOutput output : stored) {
            typed.put(output.passNumber(), map(output));
        }
        return new PassOutputs(typed);
    }

    /**
     * Typed variant of one stored output; {@link RawPassOutput} when the parse failed, the pass
     * is unknown, or the payload does not have the variant's shape.
     */
    public PassOutput map(StoredPassOutput stored) {
        JsonNode payload = readPayload(stored);
        if (payload == null || stored.parseAttempt() == ParseAttempt.FAILED) {
            return new RawPassOutput(payload, stored.parseAttempt());
        }

        PassDefinition definition = registry.find(stored.passNumber()).orElse(null);
        if (definition == null) {
            return new RawPassOutput(payload, stored.parseAttempt());
        }

        if (definition.kind() == PassKind.NARRATIVE) {
            String content = narrativeText(payload, definition.sectionKey());
            return content != null
                    ? new NarrativeSection(definition.sectionKey(), content)
                    : new RawPassOutput(payload, stored.parseAttempt());
        }

        Class<? extends PassOutput> type = EXTRACTION_TYPES.get(stored.passNumber());
        if (type == null || !payload.isObject()) {
            return new RawPassOutput(payload, stored.parseAttempt());
        }
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warnf("Pass %d output does not match %s: %s",
                    stored.passNumber(), type.getSimpleName(), e.getMessage());
            return new RawPassOutput(payload, stored.parseAttempt());
        }
    }

    private JsonNode readPayload(StoredPassOutput stored) {
        if (stored.payload() == null) {
            return null;
        }
        try {
            return objectMapper.readTree(stored.payload());
        } catch (JsonProcessingException e) {
            LOG.warnf("Stored payload of pass %d is not valid JSON: %s", stored.passNumber(), e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Section text from {@code content}, a field named after the section, or the first textual
     * field of the object.
     */
    static String narrativeText(JsonNode payload, String sectionKey) {
        if (payload.isTextual()) {
            return payload.asText();
        }
        if (!payload.isObject()) {
            return null;
        }
        if (payload.hasNonNull("content") && payload.get("content").isTextual()) {
            return payload.get("content").asText();
        }
        if (sectionKey != null && payload.hasNonNull(sectionKey) && payload.get(sectionKey).isTextual()) {
            return payload.get(sectionKey).asText();
        }
        Iterator<JsonNode> values = payload.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
