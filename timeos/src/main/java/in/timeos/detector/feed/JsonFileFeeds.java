package in.timeos.detector.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Feeds backed by JSON snapshot files written by the sync jobs.
 *
 * Each file holds a JSON array of snake_case records. A missing file means the
 * sync has not produced data yet and reads as an empty batch; an unreadable file
 * fails the feed.
 */
public final class JsonFileFeeds implements TaskFeed, InvoiceFeed, ChatFeed, MeetingFeed {
    private static final Logger log = LoggerFactory.getLogger(JsonFileFeeds.class);

    public static final String TASKS_FILE = "tasks.json";
    public static final String INVOICES_FILE = "invoices.json";
    public static final String CHAT_FILE = "chat-messages.json";
    public static final String MEETINGS_FILE = "meetings.json";
    public static final String EMAIL_FILE = "gmail-messages.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path feedDir;

    public JsonFileFeeds(Path feedDir) {
        this.feedDir = feedDir;
    }

    @Override
    public List<TaskRecord> fetchTasks() {
        return read(TASKS_FILE, new TypeReference<List<TaskRecord>>() {});
    }

    @Override
    public List<InvoiceRecord> fetchInvoices() {
        return read(INVOICES_FILE, new TypeReference<List<InvoiceRecord>>() {});
    }

    @Override
    public List<ChatMessage> fetchMessages() {
        return read(CHAT_FILE, new TypeReference<List<ChatMessage>>() {});
    }

    @Override
    public List<MeetingRecord> fetchMeetings() {
        return read(MEETINGS_FILE, new TypeReference<List<MeetingRecord>>() {});
    }

    /**
     * Email needs its own accessor since {@link ChatFeed} and {@link EmailFeed} share a method name.
     */
    public EmailFeed emailFeed() {
        return () -> read(EMAIL_FILE, new TypeReference<List<EmailMessage>>() {});
    }

    private <T> List<T> read(String fileName, TypeReference<List<T>> type) {
        Path file = feedDir.resolve(fileName);
        if (!Files.exists(file)) {
            log.warn("[FEED] {} not found, treating as empty", file);
            return List.of();
        }
        try {
            List<T> records = MAPPER.readValue(file.toFile(), type);
            if (records == null) {
                return List.of();
            }
            log.debug("[FEED] Read {} records from {}", records.size(), file);
            return records;
        } catch (IOException e) {
            log.error("[FEED] Failed to read {}: {}", file, e.getMessage());
            throw new FeedUnavailableException("Failed to read feed " + fileName, e);
        }
    }
}
