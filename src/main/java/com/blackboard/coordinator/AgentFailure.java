package com.blackboard.coordinator;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * An agent problem contained within one round. Each one is also written to the
 * blackboard as an agent_error fact.
 */
public record AgentFailure(String agent, Type type, String error) {

    public enum Type {
        TRIGGER("trigger"),
        EXCEPTION("exception"),
        TIMEOUT("timeout"),
        VALIDATION("validation");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
