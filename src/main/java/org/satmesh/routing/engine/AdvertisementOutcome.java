package org.satmesh.routing.engine;

/**
 * Per-message summary of {@link DistanceVectorEngine#processAdvertisement(RoutingMessage, long)}.
 *
 * @param duplicate {@code (sender, sequence)} was already processed; nothing else was done.
 * @param senderUsable sender was a usable neighbor; when false no route was considered.
 * @param senderRevived sender had been marked inactive and this message reactivated it, so its
 *        suspended routes are visible again.
 * @param accepted routes installed or replaced.
 * @param refreshed routes re-confirmed by their current next hop.
 * @param rejected candidates that lost against the current route.
 * @param rejectedHorizon candidates beyond the hop horizon.
 * @param withdrawn routes through the sender removed because it no longer advertises them.
 */
public record AdvertisementOutcome(
        boolean duplicate,
        boolean senderUsable,
        boolean senderRevived,
        int accepted,
        int refreshed,
        int rejected,
        int rejectedHorizon,
        int withdrawn
) {
    private static final AdvertisementOutcome DUPLICATE = new AdvertisementOutcome(true, false, false, 0, 0, 0, 0, 0);
    private static final AdvertisementOutcome UNUSABLE_SENDER = new AdvertisementOutcome(false, false, false, 0, 0, 0, 0, 0);

    public static AdvertisementOutcome duplicateMessage() {
        return DUPLICATE;
    }

    public static AdvertisementOutcome unusableSender() {
        return UNUSABLE_SENDER;
    }

    /**
     * @return true when the visible routing table changed.
     */
    public boolean changed() {
        return senderRevived || accepted > 0 || withdrawn > 0;
    }
}
