package com.z254.sentinel.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered escalation levels of an alert rule. Level 0 is the rule's own channel set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationPolicy {

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private List<EscalationLevel> levels = new ArrayList<>();

    /** Minutes before the first escalation */
    private int timeout;

    private int maxEscalations;

    /**
     * Level by its 1-based number. Levels are validated to be contiguous from 1,
     * so this is a direct index.
     */
    @JsonIgnore
    public Optional<EscalationLevel> getLevel(int level) {
        if (level < 1 || level > levels.size()) {
            return Optional.empty();
        }
        EscalationLevel candidate = levels.get(level - 1);
        return candidate.getLevel() == level ? Optional.of(candidate) : Optional.empty();
    }

    public static EscalationPolicy disabled() {
        return EscalationPolicy.builder().enabled(false).build();
    }
}
