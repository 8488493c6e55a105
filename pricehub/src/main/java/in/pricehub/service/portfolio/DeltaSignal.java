package in.pricehub.service.portfolio;

import in.pricehub.domain.portfolio.DeltaDirection;

import java.time.Duration;

/**
 * Receiver of portfolio up/down flashes. Presentation code decides how to show them;
 * a flash is meant to be visible for DISPLAY_LIFETIME and then fade.
 */
@FunctionalInterface
public interface DeltaSignal {

    Duration DISPLAY_LIFETIME = Duration.ofMillis(600);

    void emit(DeltaDirection direction);
}
