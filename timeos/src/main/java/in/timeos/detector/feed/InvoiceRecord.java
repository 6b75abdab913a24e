package in.timeos.detector.feed;

import java.time.Instant;
import java.time.LocalDate;

/**
 * An invoice as synced from the accounting system.
 *
 * @param amountDue outstanding amount; zero once paid
 * @param paidAt null while unpaid
 */
public record InvoiceRecord(
    String id,
    String number,
    String clientId,
    String currency,
    double total,
    double amountDue,
    LocalDate dueDate,
    Instant paidAt
) {
    public boolean isPaid() {
        return paidAt != null;
    }
}
