package in.timeos.detector.feed;

import java.util.List;

public interface MeetingFeed {
    List<MeetingRecord> fetchMeetings();
}
