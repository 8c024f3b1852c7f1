package io.caldera.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.caldera.core.recipe.CompiledRecipe;
import io.caldera.core.recipe.Step;
import io.caldera.serialization.mixin.CompiledRecipeMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Caldera serialization configuration in one place.
///
/// - `Step`: `StepSerializer` / `StepDeserializer`, discriminator `"type"`
/// - `CompiledRecipe`: field-visibility mixin dropping source modification times
///
/// `RunSummary` is a plain record and needs no registration.
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see RecipeJson for the convenience factory API
public class CalderaJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5264409917325031178L;

    public CalderaJacksonModule() {
        super("CalderaJacksonModule");

        addSerializer(Step.class, new StepSerializer());
        addDeserializer(Step.class, new StepDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(CompiledRecipe.class, CompiledRecipeMixin.class);
    }
}
