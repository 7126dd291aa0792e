package com.mdpilot.orchestrator.memory;

import java.time.Instant;

/**
 * A human-supplied amendment to earlier agent behaviour. Write-once.
 *
 * @param content    Free text, e.g. "use amber14 with tip3p water for this protein".
 * @param context    Capability and gate snapshot the correction was given in.
 * @param recordedAt When it was stored.
 */
public record Correction(String content, CorrectionContext context, Instant recordedAt) {

    public Correction {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Correction content must not be blank");
        }
    }
}
