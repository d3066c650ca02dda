package org.javai.recovery.substitute;

import org.javai.recovery.RecoveryStrategy;

import java.util.EnumSet;
import java.util.Set;

/**
 * A requirement a substitute tool should meet. Each constraint excludes the
 * alternatives carrying one declared {@link ToolTag}.
 */
public enum SubstitutionConstraint {
    REQUIRE_NO_PRIVILEGES("require_no_privileges", ToolTag.REQUIRES_PRIVILEGES),
    PREFER_FASTER_TOOLS("prefer_faster_tools", ToolTag.SLOW);

    private final String hint;
    private final ToolTag excludedTag;

    SubstitutionConstraint(String hint, ToolTag excludedTag) {
        this.hint = hint;
        this.excludedTag = excludedTag;
    }

    /**
     * The strategy parameter that requests this constraint.
     */
    public String hint() {
        return hint;
    }

    public ToolTag excludedTag() {
        return excludedTag;
    }

    /**
     * Collects the constraints a strategy asks for through its boolean parameters.
     */
    public static Set<SubstitutionConstraint> fromStrategy(RecoveryStrategy strategy) {
        Set<SubstitutionConstraint> constraints = EnumSet.noneOf(SubstitutionConstraint.class);
        if (strategy == null) {
            return constraints;
        }
        for (SubstitutionConstraint constraint : values()) {
            if (strategy.flag(constraint.hint)) {
                constraints.add(constraint);
            }
        }
        return constraints;
    }
}
