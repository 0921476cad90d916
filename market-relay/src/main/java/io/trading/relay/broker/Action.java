package io.trading.relay.broker;

import java.util.Optional;

/**
 * Subscriber command actions, keyed by their wire code.
 */
public enum Action {
    UNSUBSCRIBE("0"),
    SUBSCRIBE("1");

    private final String code;

    Action(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<Action> fromCode(String code) {
        for (Action action : values()) {
            if (action.code.equals(code)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
