package com.settleworks.core.progression;

import java.util.List;

/**
 * Answer of the tier gate. Not advanceable is an ordinary outcome; {@link #reason()} says why
 * and {@link #missing()} lists every unmet requirement.
 */
public record AdvancementResult(
        boolean advanceable,
        Reason reason,
        String message,
        Tier currentTier,
        Tier targetTier,
        List<Progress> progress,
        List<Progress> missing
) {

    public enum Reason {
        READY,
        INVALID_TIER,
        SKIP_TIER,
        BACKWARDS,
        MALFORMED_RESOURCES,
        REQUIREMENTS_UNMET
    }

    public enum Kind {
        STRUCTURE,
        RESOURCE
    }

    /**
     * Progress toward one requirement. {@code key} is a structure type id or a resource key.
     */
    public record Progress(Kind kind, String key, double available, double required) {

        public boolean met() {
            return available >= required;
        }

        public double ratio() {
            return required <= 0 ? 1.0 : Math.min(1.0, available / required);
        }
    }

    public AdvancementResult {
        progress = List.copyOf(progress);
        missing = List.copyOf(missing);
    }

    static AdvancementResult rejected(Reason reason, String message, Tier current, Tier target) {
        return new AdvancementResult(false, reason, message, current, target, List.of(), List.of());
    }
}
