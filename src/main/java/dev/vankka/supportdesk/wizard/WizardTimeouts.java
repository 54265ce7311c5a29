package dev.vankka.supportdesk.wizard;

import lombok.Value;

import java.time.Duration;

/**
 * How long a configuration session waits for the administrator at each kind of step.
 */
@Value
public class WizardTimeouts {

    public static final WizardTimeouts DEFAULTS = new WizardTimeouts(
            Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofMinutes(5));

    Duration confirmation;
    Duration menu;
    Duration modal;
}
