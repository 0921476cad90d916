package io.trading.relay.broker;

import io.trading.marketdata.model.InstrumentIdentification;

import java.util.Arrays;
import java.util.List;

/**
 * A subscribe or unsubscribe request.
 * Wire format: {@code <action>.<channel>.<isin1>,<isin2>,...}, e.g. {@code 1.trade.IRO1FOLD0001,IRO1IKCO0001}.
 *
 * @param action  Subscribe or unsubscribe
 * @param channel Requested channel
 * @param isins   Instruments, each exactly 12 characters
 */
public record SubscriptionCommand(
    Action action,
    SubscriptionChannel channel,
    List<String> isins
) {
    private static final String SEPARATOR = "\\.";

    public SubscriptionCommand {
        if (action == null || channel == null) {
            throw new IllegalArgumentException("action and channel cannot be null");
        }
        if (isins == null || isins.isEmpty()) {
            throw new IllegalArgumentException("isins cannot be null or empty");
        }
        isins = List.copyOf(isins);
        for (String isin : isins) {
            if (!InstrumentIdentification.isValidIsin(isin)) {
                throw new IllegalArgumentException("Isin [" + isin + "] is not acceptable");
            }
        }
    }

    /**
     * Parses a command from its wire format.
     *
     * @throws IllegalArgumentException if the command is malformed
     */
    public static SubscriptionCommand parse(String message) {
        if (message == null) {
            throw new IllegalArgumentException("Message is null");
        }
        String[] parts = message.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Message [" + message + "] has unacceptable format");
        }
        Action action = Action.fromCode(parts[0])
            .orElseThrow(() -> new IllegalArgumentException("Action [" + parts[0] + "] is not acceptable"));
        SubscriptionChannel channel = SubscriptionChannel.fromWireName(parts[1])
            .orElseThrow(() -> new IllegalArgumentException("Channel [" + parts[1] + "] is not acceptable"));
        return new SubscriptionCommand(action, channel, Arrays.asList(parts[2].split(",", -1)));
    }

    /**
     * Renders the command in its wire format.
     */
    public String toWireFormat() {
        return action.getCode() + "." + channel.getWireName() + "." + String.join(",", isins);
    }
}
