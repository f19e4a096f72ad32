package com.keystone.security.access;

import com.keystone.security.DenialReason;
import java.util.Map;

/** Result of a single guard: allow, deny with a reason, or not applicable. */
public sealed interface GuardVerdict permits GuardVerdict.Allow, GuardVerdict.Deny, GuardVerdict.Skip {

    static GuardVerdict allow() {
        return Allow.INSTANCE;
    }

    static GuardVerdict skip() {
        return Skip.INSTANCE;
    }

    static GuardVerdict deny(DenialReason reason, String message) {
        return new Deny(reason, message, Map.of());
    }

    static GuardVerdict deny(DenialReason reason, String message, Map<String, Object> details) {
        return new Deny(reason, message, details);
    }

    default boolean isDeny() {
        return this instanceof Deny;
    }

    record Allow() implements GuardVerdict {
        static final Allow INSTANCE = new Allow();
    }

    record Skip() implements GuardVerdict {
        static final Skip INSTANCE = new Skip();
    }

    /**
     * @param details extra data recorded with security denials
     */
    record Deny(DenialReason reason, String message, Map<String, Object> details) implements GuardVerdict {

        public Deny {
            if (reason == null) {
                throw new IllegalArgumentException("reason must not be null");
            }
            details = details == null ? Map.of() : Map.copyOf(details);
        }
    }
}
