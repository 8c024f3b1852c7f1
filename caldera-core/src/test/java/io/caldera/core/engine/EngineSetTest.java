package io.caldera.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.caldera.core.exception.EngineException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EngineSetTest {

    private EngineLauncher launcher;
    private AlgorithmEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        launcher = mock(EngineLauncher.class);
        engine = mock(AlgorithmEngine.class);
        when(launcher.getName()).thenReturn("mock");
        when(launcher.supports("kappa")).thenReturn(true);
        when(launcher.start("kappa")).thenReturn(engine);
    }

    @Test
    void shouldStartEngineOnceAndReuseIt() throws Exception {
        EngineSet engines = new EngineSet(List.of(launcher));

        AlgorithmEngine first = engines.get("kappa");
        AlgorithmEngine second = engines.get("kappa");

        assertThat(second).isSameAs(first);
        verify(launcher, times(1)).start("kappa");
        assertThat(engines.runningEngines()).containsExactly("kappa");
    }

    @Test
    void shouldRelaunchRemovedEngine() throws Exception {
        EngineSet engines = new EngineSet(List.of(launcher));
        engines.get("kappa");

        engines.remove("kappa");
        engines.get("kappa");

        verify(engine).close();
        verify(launcher, times(2)).start("kappa");
    }

    @Test
    void shouldUseHighestPriorityLauncher() throws Exception {
        EngineLauncher preferred = mock(EngineLauncher.class);
        AlgorithmEngine preferredEngine = mock(AlgorithmEngine.class);
        when(preferred.supports(anyString())).thenReturn(true);
        when(preferred.getPriority()).thenReturn(10);
        when(preferred.getName()).thenReturn("preferred");
        when(preferred.start("kappa")).thenReturn(preferredEngine);

        EngineSet engines = new EngineSet(List.of(launcher, preferred));

        assertThat(engines.get("kappa")).isSameAs(preferredEngine);
    }

    @Test
    void shouldFailForUnsupportedEngine() {
        EngineSet engines = new EngineSet(List.of(launcher));

        assertThatThrownBy(() -> engines.get("figaro"))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("figaro")
                .hasMessageContaining("mock");
    }

    @Test
    void shouldCloseEveryRunningEngine() throws Exception {
        EngineSet engines = new EngineSet(List.of(launcher));
        engines.prestart(List.of("kappa"));

        engines.close();

        verify(engine).close();
        assertThat(engines.isRunning("kappa")).isFalse();
    }
}
