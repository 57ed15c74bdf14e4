package io.qzark.config;

import io.qzark.internal.mongo.QueuedTaskDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the task queue collection.
 *
 * <h3>Required indexes (collection: {@code qzark_task_queue})</h3>
 * <ul>
 *   <li><b>ux_queue_seq</b> (unique): { seq: 1 }
 *       <br/>Head lookup for pop and FIFO ordering; rejects a reused sequence number.</li>
 *   <li><b>idx_queue_name</b>: { name: 1 }
 *       <br/>Used when seeding checks whether a task is already queued.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.qzark_task_queue.createIndex({ seq: 1 }, { name: "ux_queue_seq", unique: true });
 * db.qzark_task_queue.createIndex({ name: 1 }, { name: "idx_queue_name" });
 * </pre>
 */
public class QzarkMongoIndexConfig {

    public static final String UX_QUEUE_SEQ = "ux_queue_seq";
    public static final String IDX_QUEUE_NAME = "idx_queue_name";

    private final MongoTemplate mongoTemplate;

    public QzarkMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the queue indexes if they do not exist yet. Runs when
     * {@code qzark.ensure-indexes-on-startup} is true (the default).
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(QueuedTaskDocument.class).createIndex(sequenceIndex());
        mongoTemplate.indexOps(QueuedTaskDocument.class).createIndex(nameIndex());
    }

    public static Index sequenceIndex() {
        return new Index()
                .on("seq", Sort.Direction.ASC)
                .unique()
                .named(UX_QUEUE_SEQ);
    }

    public static Index nameIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .named(IDX_QUEUE_NAME);
    }
}
