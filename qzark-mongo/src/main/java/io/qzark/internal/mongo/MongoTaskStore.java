package io.qzark.internal.mongo;

import com.mongodb.MongoException;
import io.qzark.TaskStore;
import io.qzark.core.Task;
import io.qzark.core.TaskStoreException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB-backed FIFO task store.
 *
 * <p>Each queued task is one {@link QueuedTaskDocument} stored as
 * {@code {name, interval_seconds, shell_command}} plus a sequence number taken from a counter
 * document. {@link #pop()} atomically removes the document with the lowest sequence, so queue order
 * and content survive restarts.
 *
 * <p>Several schedulers sharing one collection each pop distinct documents, but no locking protocol
 * coordinates their due checks; running more than one scheduler per collection is not supported.
 */
public class MongoTaskStore implements TaskStore {
    private static final Logger log = LoggerFactory.getLogger(MongoTaskStore.class);

    static final String QUEUE_SEQUENCE = "task_queue_seq";

    private final MongoTemplate mongoTemplate;

    public MongoTaskStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void push(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        call("push", () -> {
            long seq = nextSequence();
            mongoTemplate.insert(QueuedTaskDocument.of(task, seq));
            log.debug("Queued task '{}' seq={}", task.name(), seq);
            return null;
        });
    }

    @Override
    public Optional<Task> pop() {
        while (true) {
            QueuedTaskDocument doc = call("pop", () -> mongoTemplate.findAndRemove(headQuery(), QueuedTaskDocument.class));
            if (doc == null) {
                return Optional.empty();
            }
            Optional<Task> task = toTask(doc);
            if (task.isPresent()) {
                return task;
            }
        }
    }

    @Override
    public void requeue(Task task) {
        push(task);
    }

    @Override
    public List<Task> snapshot() {
        List<QueuedTaskDocument> docs = call("snapshot",
                () -> mongoTemplate.find(new Query().with(Sort.by(Sort.Direction.ASC, "seq")), QueuedTaskDocument.class));
        return docs.stream().map(MongoTaskStore::toTask).flatMap(Optional::stream).toList();
    }

    @Override
    public boolean contains(String name) {
        return call("contains",
                () -> mongoTemplate.exists(new Query(Criteria.where("name").is(name)), QueuedTaskDocument.class));
    }

    /**
     * Ping the server. Fails fast when the backend is unreachable.
     */
    @Override
    public void verifyConnection() {
        call("ping", () -> mongoTemplate.executeCommand(new Document("ping", 1)));
        log.info("Connected to MongoDB task store db={}", mongoTemplate.getDb().getName());
    }

    private long nextSequence() {
        SequenceCounterDocument counter = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(QUEUE_SEQUENCE)),
                new Update().inc("value", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceCounterDocument.class
        );
        if (counter == null) {
            throw new TaskStoreException("sequence counter upsert returned no document");
        }
        return counter.getValue();
    }

    // Entries that no longer form a valid task are dropped from the queue.
    private static Optional<Task> toTask(QueuedTaskDocument doc) {
        try {
            return Optional.of(doc.toTask());
        } catch (IllegalArgumentException | NullPointerException e) {
            log.error("Skipping corrupt queue entry id={} seq={} name={} msg={}",
                    doc.getId(), doc.getSeq(), doc.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Query headQuery() {
        return new Query().with(Sort.by(Sort.Direction.ASC, "seq")).limit(1);
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | MongoException e) {
            throw new TaskStoreException("MongoDB task store " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
