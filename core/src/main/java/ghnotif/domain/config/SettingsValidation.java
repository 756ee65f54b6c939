package ghnotif.domain.config;

import ghnotif.domain.exceptions.ConfigurationFailure;

import java.time.Duration;

/**
 * Range checks shared by the settings records.
 */
final class SettingsValidation {
    private SettingsValidation() {
    }

    static void positive(final String name, final int value) {
        if (value <= 0) {
            throw new ConfigurationFailure("The " + name + " must be greater than zero, but was " + value);
        }
    }

    static void positive(final String name, final Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new ConfigurationFailure("The " + name + " must be greater than zero, but was " + value.toMillis() + " ms");
        }
    }
}
