package in.timeos.detector;

import in.timeos.detector.feed.EmailFeed;
import in.timeos.detector.feed.EmailMessage;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalSource;
import in.timeos.domain.signal.SignalTypes;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Communication signals from the shared mailbox.
 *
 * Only external senders count; a sender is internal when its domain is in the
 * configured internal domain set.
 */
public final class GmailDetector extends AbstractSignalDetector {
    private static final Logger log = LoggerFactory.getLogger(GmailDetector.class);

    public static final String ID = "gmail";

    public static final Set<String> DEFAULT_INTERNAL_DOMAINS = Set.of("hrmny.co", "hrmny.ae");

    static final Duration UNANSWERED_AFTER = Duration.ofDays(2);
    static final Duration ACTIVE_WINDOW = Duration.ofDays(3);

    static final List<String> URGENT_KEYWORDS = List.of(
        "urgent", "asap", "immediately", "critical", "deadline", "overdue", "past due",
        "final notice", "action required", "time sensitive", "priority", "escalate"
    );

    private static final Pattern DOMAIN = Pattern.compile("@([\\w.-]+)");
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^>]+)>");

    private static final Set<String> TYPES = Set.of(
        SignalTypes.EMAIL_URGENT,
        SignalTypes.EMAIL_UNANSWERED,
        SignalTypes.EMAIL_CLIENT_ACTIVE
    );

    private final EmailFeed feed;
    private final Set<String> internalDomains;

    public GmailDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, EmailFeed feed,
                         Set<String> internalDomains) {
        this(signalRepository, scopeResolver, feed, internalDomains, Clock.systemUTC());
    }

    public GmailDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, EmailFeed feed,
                         Set<String> internalDomains, Clock clock) {
        super(signalRepository, scopeResolver, clock);
        this.feed = feed;
        this.internalDomains = Set.copyOf(internalDomains);
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
        List<EmailMessage> messages = feed.fetchMessages();

        int urgent = 0;
        int unanswered = 0;
        int active = 0;
        Set<String> signaledSenders = new HashSet<>();

        for (EmailMessage message : messages) {
            if (message.id() == null || !isExternal(message.from())) {
                continue;
            }
            if (urgent(out, message)) urgent++;
            if (unanswered(out, message)) unanswered++;
            if (clientActive(out, message, signaledSenders)) active++;
        }

        log.info("[{}] {} urgent, {} unanswered, {} active client emails", ID, urgent, unanswered, active);
    }

    private boolean urgent(List<Signal> out, EmailMessage message) {
        String subject = message.subject() == null ? "" : message.subject();
        String text = (subject + " " + (message.snippet() == null ? "" : message.snippet()))
            .toLowerCase(Locale.ROOT);
        List<String> keywords = ChatDetector.matches(text, URGENT_KEYWORDS);
        if (keywords.isEmpty() || signalExists(SignalTypes.EMAIL_URGENT, message.id())) {
            return false;
        }
        return emit(out, draft(SignalTypes.EMAIL_URGENT, "email", message.id(), SignalSource.EMAIL)
            .magnitude(0.7)
            .source(SignalSource.EMAIL, message.id(), null, TaskDetector.truncate(subject.toLowerCase(Locale.ROOT)))
            .payload("from", message.from())
            .payload("subject", message.subject())
            .payload("keywords", keywords)
            .occurredAt(dateOf(message))
            .detectionConfidence(0.8)
            .attributionConfidence(0.6));
    }

    private boolean unanswered(List<Signal> out, EmailMessage message) {
        if (!message.hasLabel("UNREAD") || !message.hasLabel("INBOX")) {
            return false;
        }
        Instant sent = dateOf(message);
        if (sent.isAfter(now().minus(UNANSWERED_AFTER))
                || signalExists(SignalTypes.EMAIL_UNANSWERED, message.id())) {
            return false;
        }
        long daysOld = Duration.between(sent, now()).toDays();
        return emit(out, draft(SignalTypes.EMAIL_UNANSWERED, "email", message.id(), SignalSource.EMAIL)
            .magnitude(unansweredMagnitude(daysOld))
            .source(SignalSource.EMAIL, message.id(), null, TaskDetector.truncate(message.subject()))
            .payload("from", message.from())
            .payload("subject", message.subject())
            .payload("days_old", daysOld)
            .occurredAt(sent)
            .detectionConfidence(0.9)
            .attributionConfidence(0.5));
    }

    private boolean clientActive(List<Signal> out, EmailMessage message, Set<String> signaledSenders) {
        String sender = senderAddress(message.from());
        if (signaledSenders.contains(sender)) {
            return false;
        }
        Instant sent = dateOf(message);
        if (sent.isBefore(now().minus(ACTIVE_WINDOW))
                || signalExists(SignalTypes.EMAIL_CLIENT_ACTIVE, sender)) {
            return false;
        }
        signaledSenders.add(sender);
        return emit(out, draft(SignalTypes.EMAIL_CLIENT_ACTIVE, "email_thread", sender, SignalSource.EMAIL)
            .magnitude(0.3)
            .source(SignalSource.EMAIL, message.id(), null, null)
            .payload("from", message.from())
            .payload("subject", message.subject())
            .occurredAt(sent)
            .detectionConfidence(0.9)
            .attributionConfidence(0.5));
    }

    static double unansweredMagnitude(long daysOld) {
        return Math.min(0.3 + daysOld * 0.1, 0.8);
    }

    boolean isExternal(String from) {
        if (from == null || from.isBlank()) {
            return false;
        }
        Matcher m = DOMAIN.matcher(from.toLowerCase(Locale.ROOT));
        if (!m.find()) {
            return false;
        }
        return !internalDomains.contains(m.group(1));
    }

    static String senderAddress(String from) {
        Matcher m = ANGLE_ADDRESS.matcher(from);
        return m.find() ? m.group(1) : from;
    }

    private Instant dateOf(EmailMessage message) {
        return message.date() != null ? message.date() : now();
    }
}
