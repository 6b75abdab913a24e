package in.timeos.domain.signal;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Atomic, valenced observation emitted by a detector.
 *
 * Immutable. Valence must be -1, 0 or 1; magnitude and both confidences must lie in [0, 1].
 * Violations throw {@link IllegalArgumentException} at construction.
 */
public record Signal(
    String id,
    String signalType,
    SignalCategory category,
    int valence,
    double magnitude,
    String entityType,
    String entityId,
    ScopeChain scope,
    SignalSource sourceType,
    String sourceId,
    String sourceUrl,
    String sourceExcerpt,
    Map<String, Object> payload,
    double detectionConfidence,
    double attributionConfidence,
    Instant occurredAt,
    Instant detectedAt,
    Instant expiresAt,
    SignalStatus status,
    String consumedByIssueId,
    String balancedBySignalId,
    Instant balancedAt,
    String detectorId,
    String detectorVersion,
    Instant createdAt,
    Instant updatedAt
) {
    public Signal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Signal id is required");
        }
        if (signalType == null || signalType.isBlank()) {
            throw new IllegalArgumentException("Signal type is required");
        }
        if (valence < -1 || valence > 1) {
            throw new IllegalArgumentException("Valence must be -1, 0, or 1, got " + valence);
        }
        checkUnitInterval("Magnitude", magnitude);
        checkUnitInterval("Detection confidence", detectionConfidence);
        checkUnitInterval("Attribution confidence", attributionConfidence);
        if (entityType == null || entityId == null) {
            throw new IllegalArgumentException("Signal entity type and id are required");
        }
        if (detectedAt == null) {
            throw new IllegalArgumentException("Signal detectedAt is required");
        }
        if (category == null) {
            category = SignalTypes.categoryOf(signalType);
        }
        if (scope == null) {
            scope = ScopeChain.EMPTY;
        }
        if (sourceType == null) {
            sourceType = SignalSource.MANUAL;
        }
        if (occurredAt == null) {
            occurredAt = detectedAt;
        }
        if (status == null) {
            status = SignalStatus.ACTIVE;
        }
        payload = payload == null || payload.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    private static void checkUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be 0.0-1.0, got " + value);
        }
    }

    public static String newId() {
        return "sig_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /** Dedup key used by detectors: one active signal per type and entity. */
    public String dedupKey() {
        return dedupKey(signalType, entityId);
    }

    public static String dedupKey(String signalType, String entityId) {
        return signalType + ":" + entityId;
    }

    public boolean isNegative() {
        return valence < 0;
    }

    public boolean isPositive() {
        return valence > 0;
    }

    public boolean isActive() {
        return status == SignalStatus.ACTIVE;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id).signalType(signalType).category(category).valence(valence).magnitude(magnitude)
            .entity(entityType, entityId).scope(scope)
            .source(sourceType, sourceId, sourceUrl, sourceExcerpt).payload(payload)
            .detectionConfidence(detectionConfidence).attributionConfidence(attributionConfidence)
            .occurredAt(occurredAt).detectedAt(detectedAt).expiresAt(expiresAt)
            .status(status).consumedByIssueId(consumedByIssueId)
            .balancedBy(balancedBySignalId, balancedAt)
            .detector(detectorId, detectorVersion)
            .createdAt(createdAt).updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = newId();
        private String signalType;
        private SignalCategory category;
        private Integer valence;
        private double magnitude;
        private String entityType;
        private String entityId;
        private ScopeChain scope = ScopeChain.EMPTY;
        private SignalSource sourceType = SignalSource.MANUAL;
        private String sourceId;
        private String sourceUrl;
        private String sourceExcerpt;
        private Map<String, Object> payload = new LinkedHashMap<>();
        private double detectionConfidence = 1.0;
        private double attributionConfidence = 1.0;
        private Instant occurredAt;
        private Instant detectedAt = Instant.now();
        private Instant expiresAt;
        private SignalStatus status = SignalStatus.ACTIVE;
        private String consumedByIssueId;
        private String balancedBySignalId;
        private Instant balancedAt;
        private String detectorId;
        private String detectorVersion;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder signalType(String signalType) {
            this.signalType = signalType;
            return this;
        }

        public Builder category(SignalCategory category) {
            this.category = category;
            return this;
        }

        public Builder valence(int valence) {
            this.valence = valence;
            return this;
        }

        public Builder magnitude(double magnitude) {
            this.magnitude = magnitude;
            return this;
        }

        public Builder entity(String entityType, String entityId) {
            this.entityType = entityType;
            this.entityId = entityId;
            return this;
        }

        public Builder scope(ScopeChain scope) {
            this.scope = scope;
            return this;
        }

        public Builder source(SignalSource sourceType, String sourceId, String sourceUrl, String sourceExcerpt) {
            this.sourceType = sourceType;
            this.sourceId = sourceId;
            this.sourceUrl = sourceUrl;
            this.sourceExcerpt = sourceExcerpt;
            return this;
        }

        public Builder sourceType(SignalSource sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
            return this;
        }

        public Builder payload(String key, Object value) {
            this.payload.put(key, value);
            return this;
        }

        public Builder detectionConfidence(double detectionConfidence) {
            this.detectionConfidence = detectionConfidence;
            return this;
        }

        public Builder attributionConfidence(double attributionConfidence) {
            this.attributionConfidence = attributionConfidence;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder status(SignalStatus status) {
            this.status = status;
            return this;
        }

        public Builder consumedByIssueId(String consumedByIssueId) {
            this.consumedByIssueId = consumedByIssueId;
            return this;
        }

        public Builder balancedBy(String balancedBySignalId, Instant balancedAt) {
            this.balancedBySignalId = balancedBySignalId;
            this.balancedAt = balancedAt;
            return this;
        }

        public Builder detector(String detectorId, String detectorVersion) {
            this.detectorId = detectorId;
            this.detectorVersion = detectorVersion;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        /**
         * Build the signal. Valence defaults to the registry value for the type.
         *
         * @throws IllegalArgumentException if valence, magnitude or confidence is out of range
         */
        public Signal build() {
            int v = valence != null ? valence : SignalTypes.defaultValenceOf(signalType);
            Instant created = createdAt != null ? createdAt : detectedAt;
            return new Signal(
                id, signalType, category, v, magnitude,
                entityType, entityId, scope,
                sourceType, sourceId, sourceUrl, sourceExcerpt, payload,
                detectionConfidence, attributionConfidence,
                occurredAt, detectedAt, expiresAt,
                status, consumedByIssueId, balancedBySignalId, balancedAt,
                detectorId, detectorVersion,
                created, updatedAt != null ? updatedAt : created
            );
        }
    }
}
