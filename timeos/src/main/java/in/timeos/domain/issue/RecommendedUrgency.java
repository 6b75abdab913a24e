package in.timeos.domain.issue;

public enum RecommendedUrgency {
    IMMEDIATE,
    THIS_WEEK,
    THIS_MONTH
}
