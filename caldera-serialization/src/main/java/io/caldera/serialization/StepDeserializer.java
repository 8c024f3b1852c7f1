package io.caldera.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.caldera.core.recipe.Step;
import java.io.IOException;
import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

/// Deserializes the `Step` sealed hierarchy using a `"type"` discriminator field.
///
/// Every subtype is constructed directly from `JsonNode` values; `arguments`
/// of an `args` step keeps its JSON key order.
///
/// @implNote Package-private. Registered by {@link CalderaJacksonModule}.
/// @see StepSerializer for the inverse operation
class StepDeserializer extends StdDeserializer<Step> {

    @Serial private static final long serialVersionUID = -6052312749618209744L;

    StepDeserializer() {
        super(Step.class);
    }

    /// @throws IOException if the `"type"` value is unknown or a required field is absent
    @Override
    public Step deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String type = text(root, "type");
        String scope = text(root, "scope");
        int line = root.path("line").asInt(0);

        switch (type) {
            case StepTypes.STATEMENT:
                return new Step.RawStatement(
                        text(root, "text"), root.path("setsStatus").asBoolean(false), scope, line);
            case StepTypes.ENGINE_CALL:
                return new Step.EngineCall(
                        text(root, "engine"),
                        text(root, "operation"),
                        text(root, "arguments"),
                        root.hasNonNull("assignTo") ? root.get("assignTo").asText() : null,
                        scope,
                        line);
            case StepTypes.ENGINE_CHECK:
                return new Step.EngineStatusCheck(
                        text(root, "engine"), text(root, "operation"), text(root, "arguments"), scope, line);
            case StepTypes.STATUS_CHECK:
                return new Step.StatusCheck(scope, line);
            case StepTypes.ARGS:
                Map<String, String> arguments = root.has("arguments")
                        ? mapper.convertValue(
                                root.get("arguments"), new TypeReference<LinkedHashMap<String, String>>() {})
                        : Map.of();
                return new Step.ArgBind(scope, arguments, line);
            case StepTypes.ENTER:
                return new Step.ScopeEnter(scope, text(root, "caller"), line);
            case StepTypes.EXIT:
                return new Step.ScopeExit(scope, line);
            default:
                throw new IOException("Unknown Step type: " + type);
        }
    }

    private static String text(JsonNode root, String field) throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Step is missing required field '" + field + "'");
        }
        return value.asText();
    }
}
