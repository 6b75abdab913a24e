package in.timeos.detector;

import in.timeos.detector.feed.ChatFeed;
import in.timeos.detector.feed.ChatMessage;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalSource;
import in.timeos.domain.signal.SignalTypes;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Communication signals from client chat spaces.
 *
 * Each client message yields at most one of escalation, negative or positive
 * sentiment (checked in that order). Spaces where the client has been silent
 * for a week or more yield a communication gap.
 */
public final class ChatDetector extends AbstractSignalDetector {
    public static final String ID = "chat";

    static final int GAP_MIN_DAYS = 7;
    static final int GAP_MAX_DAYS = 30;

    static final List<String> ESCALATION_KEYWORDS = List.of(
        "escalate", "unacceptable", "very disappointed", "complaint", "not happy",
        "cancel the contract", "legal action", "speak to your manager"
    );

    static final List<String> NEGATIVE_KEYWORDS = List.of(
        "frustrated", "disappointed", "concerned", "delay", "still waiting", "problem",
        "wrong", "not what we asked", "confused"
    );

    static final List<String> POSITIVE_KEYWORDS = List.of(
        "thank you", "thanks", "great work", "love it", "perfect", "excellent",
        "appreciate", "well done", "approved"
    );

    private static final Set<String> TYPES = Set.of(
        SignalTypes.ESCALATION_DETECTED,
        SignalTypes.SENTIMENT_NEGATIVE,
        SignalTypes.SENTIMENT_POSITIVE,
        SignalTypes.COMMUNICATION_GAP
    );

    private final ChatFeed feed;

    public ChatDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, ChatFeed feed) {
        this(signalRepository, scopeResolver, feed, Clock.systemUTC());
    }

    public ChatDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, ChatFeed feed, Clock clock) {
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
        Map<String, Instant> lastClientMessage = new HashMap<>();

        for (ChatMessage message : feed.fetchMessages()) {
            if (message.id() == null || message.spaceId() == null || !message.fromClient()) {
                continue;
            }
            if (message.sentAt() != null) {
                lastClientMessage.merge(message.spaceId(), message.sentAt(),
                    (a, b) -> a.isAfter(b) ? a : b);
            }
            classify(out, message);
        }

        lastClientMessage.forEach((spaceId, lastAt) -> gap(out, spaceId, lastAt));
    }

    private void classify(List<Signal> out, ChatMessage message) {
        String text = message.text() == null ? "" : message.text().toLowerCase(Locale.ROOT);

        List<String> escalation = matches(text, ESCALATION_KEYWORDS);
        if (!escalation.isEmpty()) {
            messageSignal(out, SignalTypes.ESCALATION_DETECTED, 0.8, message, escalation);
            return;
        }
        List<String> negative = matches(text, NEGATIVE_KEYWORDS);
        if (!negative.isEmpty()) {
            messageSignal(out, SignalTypes.SENTIMENT_NEGATIVE, 0.5, message, negative);
            return;
        }
        List<String> positive = matches(text, POSITIVE_KEYWORDS);
        if (!positive.isEmpty()) {
            messageSignal(out, SignalTypes.SENTIMENT_POSITIVE, 0.4, message, positive);
        }
    }

    private void messageSignal(List<Signal> out, String type, double magnitude, ChatMessage message,
                               List<String> keywords) {
        if (signalExists(type, message.id())) {
            return;
        }
        emit(out, draft(type, "chat_message", message.id(), SignalSource.GCHAT)
            .magnitude(magnitude)
            .scope(scopeResolver.forSpace(message.spaceId()))
            .source(SignalSource.GCHAT, message.id(), null, TaskDetector.truncate(message.text()))
            .payload("space_id", message.spaceId())
            .payload("sender", message.sender())
            .payload("keywords", keywords)
            .occurredAt(message.sentAt())
            .detectionConfidence(0.7)
            .attributionConfidence(0.8));
    }

    private void gap(List<Signal> out, String spaceId, Instant lastAt) {
        long days = Duration.between(lastAt, now()).toDays();
        if (days < GAP_MIN_DAYS || signalExists(SignalTypes.COMMUNICATION_GAP, spaceId)) {
            return;
        }
        emit(out, draft(SignalTypes.COMMUNICATION_GAP, "space", spaceId, SignalSource.GCHAT)
            .magnitude(scaleMagnitude(days, GAP_MIN_DAYS, GAP_MAX_DAYS))
            .scope(scopeResolver.forSpace(spaceId))
            .source(SignalSource.GCHAT, spaceId, null, null)
            .payload("gap_days", days)
            .payload("last_client_message_at", lastAt.toString())
            .detectionConfidence(0.9)
            .attributionConfidence(0.8));
    }

    static List<String> matches(String text, List<String> keywords) {
        return keywords.stream().filter(text::contains).toList();
    }
}
