package in.timeos.detector.feed;

import java.util.List;

public interface InvoiceFeed {
    List<InvoiceRecord> fetchInvoices();
}
