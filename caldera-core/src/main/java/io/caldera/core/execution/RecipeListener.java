package io.caldera.core.execution;

import io.caldera.core.engine.EngineResponse;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.Group;

/// Observer of recipe execution.
///
/// All methods default to no-ops so listeners override only what they need.
///
/// ### Callback order for one frame
/// ```
/// onFrameStart(frame, group)
/// onRecipeStart(recipe, frame)
///   onPrimitiveEnter(primitive, caller)
///     onEngineCall(engine, operation, arguments, response)
///   onPrimitiveExit(primitive)
/// onRecipeComplete(recipe, frame, status)
/// ```
public interface RecipeListener {

    /// Listener that ignores every event.
    RecipeListener NOOP = new RecipeListener() {};

    default void onFrameStart(Frame frame, Group group) {}

    default void onRecipeStart(String recipe, Frame frame) {}

    default void onPrimitiveEnter(String primitive, String caller) {}

    default void onPrimitiveExit(String primitive) {}

    /// @param engine engine name
    /// @param operation operation name
    /// @param arguments interpolated arguments
    /// @param response the engine's reply, null if the engine could not be reached
    default void onEngineCall(String engine, String operation, String arguments, EngineResponse response) {}

    default void onRecipeComplete(String recipe, Frame frame, RecipeStatus status) {}
}
