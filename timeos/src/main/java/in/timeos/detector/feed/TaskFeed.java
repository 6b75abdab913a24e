package in.timeos.detector.feed;

import java.util.List;

public interface TaskFeed {
    List<TaskRecord> fetchTasks();
}
