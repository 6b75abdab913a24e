package in.timeos.detector;

import in.timeos.detector.feed.InvoiceFeed;
import in.timeos.detector.feed.InvoiceRecord;
import in.timeos.domain.signal.ScopeChain;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalSource;
import in.timeos.domain.signal.SignalTypes;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

/**
 * Financial signals from receivables: aging buckets for unpaid invoices and
 * payment timeliness for invoices paid recently.
 */
public final class InvoiceDetector extends AbstractSignalDetector {
    public static final String ID = "invoice";

    static final Duration RECENT_PAYMENT_WINDOW = Duration.ofDays(7);

    private static final Set<String> TYPES = Set.of(
        SignalTypes.INVOICE_OVERDUE_30,
        SignalTypes.INVOICE_OVERDUE_60,
        SignalTypes.INVOICE_OVERDUE_90,
        SignalTypes.PAYMENT_RECEIVED_ONTIME,
        SignalTypes.PAYMENT_RECEIVED_LATE
    );

    private final InvoiceFeed feed;

    public InvoiceDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, InvoiceFeed feed) {
        this(signalRepository, scopeResolver, feed, Clock.systemUTC());
    }

    public InvoiceDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, InvoiceFeed feed,
                           Clock clock) {
        super(signalRepository, scopeResolver, clock);
        this.feed = feed;
    }

    @Override
    public String detectorId() {
        return ID;
    }

    @Override
    public String detectorVersion() {
        return "1.0.0";
    }

    @Override
    public Set<String> signalTypes() {
        return TYPES;
    }

    @Override
    protected void scan(List<Signal> out) {
        Instant paymentCutoff = now().minus(RECENT_PAYMENT_WINDOW);

        for (InvoiceRecord invoice : feed.fetchInvoices()) {
            if (invoice.id() == null) {
                continue;
            }
            if (invoice.isPaid()) {
                if (!invoice.paidAt().isBefore(paymentCutoff)) {
                    paid(out, invoice);
                }
            } else if (invoice.dueDate() != null && invoice.amountDue() > 0) {
                overdue(out, invoice, ChronoUnit.DAYS.between(invoice.dueDate(), today()));
            }
        }
    }

    private void overdue(List<Signal> out, InvoiceRecord invoice, long daysOverdue) {
        String type;
        String bucket;
        if (daysOverdue >= 90) {
            type = SignalTypes.INVOICE_OVERDUE_90;
            bucket = "90+";
        } else if (daysOverdue >= 60) {
            type = SignalTypes.INVOICE_OVERDUE_60;
            bucket = "60+";
        } else if (daysOverdue >= 30) {
            type = SignalTypes.INVOICE_OVERDUE_30;
            bucket = "30+";
        } else {
            return;
        }
        if (signalExists(type, invoice.id())) {
            return;
        }

        emit(out, draft(type, invoice)
            .magnitude(amountMagnitude(invoice.amountDue()))
            .payload("amount", invoice.amountDue())
            .payload("currency", invoice.currency())
            .payload("days_overdue", daysOverdue)
            .payload("bucket", bucket)
            .occurredAt(invoice.dueDate().atStartOfDay(ZoneOffset.UTC).toInstant()));
    }

    private void paid(List<Signal> out, InvoiceRecord invoice) {
        LocalDate paidOn = LocalDate.ofInstant(invoice.paidAt(), ZoneOffset.UTC);
        boolean onTime = invoice.dueDate() == null || !paidOn.isAfter(invoice.dueDate());
        String type = onTime ? SignalTypes.PAYMENT_RECEIVED_ONTIME : SignalTypes.PAYMENT_RECEIVED_LATE;
        if (signalExists(type, invoice.id())) {
            return;
        }

        Signal.Builder builder = draft(type, invoice)
            .magnitude(onTime ? 0.5 : 0.3)
            .payload("amount", invoice.total())
            .payload("currency", invoice.currency())
            .occurredAt(invoice.paidAt());
        if (!onTime) {
            builder.payload("days_late", ChronoUnit.DAYS.between(invoice.dueDate(), paidOn));
        }
        emit(out, builder);
    }

    private Signal.Builder draft(String type, InvoiceRecord invoice) {
        return draft(type, "invoice", invoice.id(), SignalSource.XERO)
            .scope(scopeResolver.forInvoice(invoice.id()).mergeMissing(ScopeChain.ofClient(invoice.clientId())))
            .source(SignalSource.XERO, invoice.id(), null, invoice.number())
            .detectionConfidence(1.0)
            .attributionConfidence(0.95);
    }
}
