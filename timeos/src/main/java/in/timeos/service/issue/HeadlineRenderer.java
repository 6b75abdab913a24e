package in.timeos.service.issue;

import in.timeos.domain.signal.SignalGroup;

import java.util.Locale;

/**
 * Fills pattern templates with values from a signal group.
 *
 * Placeholders the group cannot supply get neutral defaults.
 */
public final class HeadlineRenderer {
    static final String UNKNOWN_SCOPE = "Unknown";
    static final String DEFAULT_CURRENCY = "AED";
    static final String DEFAULT_BUCKET = "30+";
    static final String DEFAULT_GAP_DAYS = "7";

    // outstanding amount is not carried on the group; magnitude units are scaled up
    static final double AMOUNT_PER_MAGNITUDE = 10_000;

    public static String render(String template, SignalGroup group, String scopeName) {
        if (template == null) {
            return null;
        }
        String count = String.valueOf(group.signalCount());
        String amount = String.format(Locale.US, "%,.0f", group.negativeMagnitude() * AMOUNT_PER_MAGNITUDE);

        return template
            .replace("{scope_name}", scopeName == null || scopeName.isBlank() ? UNKNOWN_SCOPE : scopeName)
            .replace("{overdue_count}", count)
            .replace("{approaching_count}", "0")
            .replace("{version_count}", count)
            .replace("{gap_days}", DEFAULT_GAP_DAYS)
            .replace("{amount:,.0f}", amount)
            .replace("{amount}", amount)
            .replace("{currency}", DEFAULT_CURRENCY)
            .replace("{bucket}", DEFAULT_BUCKET);
    }

    private HeadlineRenderer() {}
}
