package in.timeos.service.issue;

import in.timeos.domain.signal.SignalBalance;
import in.timeos.domain.signal.SignalGroup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class HeadlineRendererTest {

    private static SignalGroup group(int count, double negativeMagnitude) {
        List<String> ids = IntStream.range(0, count).mapToObj(i -> "sig_" + i).toList();
        SignalBalance balance = new SignalBalance(count, 0, 0, negativeMagnitude, 0);
        return new SignalGroup("C1", ids, balance, 1);
    }

    @Test
    void fillsScopeNameAndCounts() {
        String headline = HeadlineRenderer.render("{scope_name}: {overdue_count} overdue, {approaching_count} due soon",
            group(3, 1.5), "Acme");

        assertEquals("Acme: 3 overdue, 0 due soon", headline);
    }

    @Test
    void missingScopeName_usesUnknown() {
        assertEquals("Unknown at risk", HeadlineRenderer.render("{scope_name} at risk", group(1, 0.5), null));
        assertEquals("Unknown at risk", HeadlineRenderer.render("{scope_name} at risk", group(1, 0.5), " "));
    }

    @Test
    void amountPlaceholders_useDefaults() {
        String headline = HeadlineRenderer.render("{scope_name}: {currency} {amount:,.0f} overdue {bucket} days",
            group(2, 2.5), "Acme");

        assertEquals("Acme: AED 25,000 overdue 30+ days", headline);
    }

    @Test
    void communicationGap_usesDefaultDays() {
        assertEquals("No contact with Acme for 7 days",
            HeadlineRenderer.render("No contact with {scope_name} for {gap_days} days", group(1, 0.4), "Acme"));
    }

    @Test
    void nullTemplate_rendersNull() {
        assertNull(HeadlineRenderer.render(null, group(1, 1.0), "Acme"));
    }
}
