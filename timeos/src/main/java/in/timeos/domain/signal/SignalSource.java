package in.timeos.domain.signal;

/**
 * External system a signal was observed in.
 */
public enum SignalSource {
    ASANA,
    XERO,
    GCHAT,
    CALENDAR,
    GMEET,
    EMAIL,
    MANUAL
}
