package io.github.yok.eeg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.eeg.core.pipeline.FailureKind;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class EegForwardCheckApplicationTest {

    @Test
    void bindingFailureMapsToConfigurationExitCode() {
        Binder binder = new Binder(
                new MapConfigurationPropertySource(Map.of("eeg.dipole.index", "first")));
        BindException bind = assertThrows(BindException.class,
                () -> binder.bind("eeg.dipole.index", Integer.class));
        BeanCreationException wrapped =
                new BeanCreationException("eegCheckProperties", "設定値を束縛できません", bind);

        assertEquals(FailureKind.CONFIGURATION.exitCode(),
                EegForwardCheckApplication.startupFailureExitCode(wrapped));
    }

    @Test
    void otherStartupFailuresMapToOne() {
        assertEquals(1, EegForwardCheckApplication
                .startupFailureExitCode(new IllegalStateException("context refresh failed")));
    }
}
