package in.timeos.detector.feed;

import java.util.List;

public interface ChatFeed {
    List<ChatMessage> fetchMessages();
}
