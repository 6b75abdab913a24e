package in.timeos.detector.feed;

import java.time.Instant;
import java.util.List;

/**
 * A mailbox message header.
 *
 * @param from raw sender, either {@code a@b.com} or {@code Name <a@b.com>}
 * @param labels mailbox labels such as UNREAD and INBOX
 */
public record EmailMessage(
    String id,
    String from,
    String subject,
    String snippet,
    List<String> labels,
    Instant date
) {
    public EmailMessage {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public boolean hasLabel(String label) {
        return labels.contains(label);
    }
}
