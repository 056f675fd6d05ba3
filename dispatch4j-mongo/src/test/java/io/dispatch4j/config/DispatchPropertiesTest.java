package io.dispatch4j.config;

import io.dispatch4j.core.DaemonSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DispatchPropertiesTest {

    @Test
    void defaultsShouldMatchDaemonDefaults() {
        assertEquals(DaemonSettings.defaults(), new DispatchProperties().toDaemonSettings());
    }

    @Test
    void nonPositiveTickShouldBeRejected() {
        DispatchProperties props = new DispatchProperties();
        props.setTickEvery(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, props::toDaemonSettings);
    }

    @Test
    void timezoneShouldFallBackToSystemDefault() {
        DispatchProperties props = new DispatchProperties();
        assertEquals(ZoneId.systemDefault(), props.zoneId());

        props.setTimezone("Europe/Prague");
        assertEquals(ZoneId.of("Europe/Prague"), props.zoneId());

        props.setTimezone("Mars/Olympus");
        assertThrows(IllegalArgumentException.class, props::zoneId);
    }

    @Test
    void instanceIdShouldBeGeneratedWhenMissing() {
        DispatchProperties props = new DispatchProperties();
        assertFalse(props.resolveInstanceId().isBlank());

        props.setInstanceId("scheduler-a");
        assertEquals("scheduler-a", props.resolveInstanceId());
    }
}
