package in.timeos.detector.feed;

import java.util.List;

public interface EmailFeed {
    List<EmailMessage> fetchMessages();
}
