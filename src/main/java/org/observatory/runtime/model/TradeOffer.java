package org.observatory.runtime.model;

import java.util.Locale;

/**
 * An open proposal from one agent to another. Nothing moves until the recipient accepts it.
 * <p>
 * The offered quantity is not held back: the offerer keeps using its resources, and acceptance is
 * validated against whatever both agents hold at that time. An offer can be accepted up to and
 * including {@code expiresAtTick} and is dropped at the end of that tick.
 *
 * @param offerId         World-unique identifier, {@code trade-<8 digit serial>}.
 * @param offererId       Agent that made the offer.
 * @param recipientId     The only agent allowed to accept.
 * @param offerResource   Resource the offerer gives.
 * @param offerAmount     Quantity the offerer gives.
 * @param requestResource Resource the recipient gives in return.
 * @param requestAmount   Quantity the recipient gives in return.
 * @param createdTick     Tick the offer was made in.
 * @param expiresAtTick   Last tick in which the offer can be accepted.
 */
public record TradeOffer(
    String offerId,
    String offererId,
    String recipientId,
    ResourceType offerResource,
    long offerAmount,
    ResourceType requestResource,
    long requestAmount,
    long createdTick,
    long expiresAtTick
) {

    public static String idFor(long serial) {
        return String.format(Locale.ROOT, "trade-%08d", serial);
    }

    public boolean names(String agentId) {
        return offererId.equals(agentId) || recipientId.equals(agentId);
    }
}
