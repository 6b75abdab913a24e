package in.timeos.detector.feed;

import java.time.Instant;

/**
 * One chat message.
 *
 * @param fromClient true when the sender is on the client side of the space
 */
public record ChatMessage(
    String id,
    String spaceId,
    String sender,
    boolean fromClient,
    String text,
    Instant sentAt
) {}
