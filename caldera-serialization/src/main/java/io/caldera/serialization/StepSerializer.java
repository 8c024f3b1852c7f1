package io.caldera.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.caldera.core.recipe.Step;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes the `Step` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`RawStatement`**: `{"type":"statement","text":"...","setsStatus":false,...}`
/// - **`EngineCall`**: `{"type":"engine_call","engine":"...","operation":"...","arguments":"..."}`.
///   `assignTo` is omitted for checked calls.
/// - **`EngineStatusCheck`**: `{"type":"engine_check","engine":"...","operation":"...",...}`
/// - **`StatusCheck`**: `{"type":"status_check"}`
/// - **`ArgBind`**: `{"type":"args","arguments":{...}}`
/// - **`ScopeEnter`** / **`ScopeExit`**: `{"type":"enter","caller":"..."}` / `{"type":"exit"}`
///
/// Every object also carries `scope` and `line`.
///
/// @implNote Package-private. Registered by {@link CalderaJacksonModule}.
/// @see StepDeserializer for the inverse operation
class StepSerializer extends StdSerializer<Step> {

    @Serial private static final long serialVersionUID = 3318206440170586823L;

    StepSerializer() {
        super(Step.class);
    }

    @Override
    public void serialize(Step step, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (step instanceof Step.RawStatement s) {
            gen.writeStringField("type", StepTypes.STATEMENT);
            gen.writeStringField("text", s.text());
            gen.writeBooleanField("setsStatus", s.setsStatus());
        } else if (step instanceof Step.EngineCall c) {
            gen.writeStringField("type", StepTypes.ENGINE_CALL);
            writeCall(gen, c.engine(), c.operation(), c.arguments());
            if (c.assignTo() != null) {
                gen.writeStringField("assignTo", c.assignTo());
            }
        } else if (step instanceof Step.EngineStatusCheck c) {
            gen.writeStringField("type", StepTypes.ENGINE_CHECK);
            writeCall(gen, c.engine(), c.operation(), c.arguments());
        } else if (step instanceof Step.StatusCheck) {
            gen.writeStringField("type", StepTypes.STATUS_CHECK);
        } else if (step instanceof Step.ArgBind a) {
            gen.writeStringField("type", StepTypes.ARGS);
            gen.writeObjectFieldStart("arguments");
            for (Map.Entry<String, String> argument : a.arguments().entrySet()) {
                gen.writeStringField(argument.getKey(), argument.getValue());
            }
            gen.writeEndObject();
        } else if (step instanceof Step.ScopeEnter e) {
            gen.writeStringField("type", StepTypes.ENTER);
            gen.writeStringField("caller", e.caller());
        } else if (step instanceof Step.ScopeExit) {
            gen.writeStringField("type", StepTypes.EXIT);
        }

        gen.writeStringField("scope", step.scope());
        gen.writeNumberField("line", step.line());
        gen.writeEndObject();
    }

    private static void writeCall(JsonGenerator gen, String engine, String operation, String arguments)
            throws IOException {
        gen.writeStringField("engine", engine);
        gen.writeStringField("operation", operation);
        gen.writeStringField("arguments", arguments);
    }
}
