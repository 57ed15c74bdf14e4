package io.qzark.internal.mongo;

import io.qzark.core.Task;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Mongo document model for one queued task.
 *
 * <p>{@code seq} defines FIFO order: the lowest sequence is the head of the queue.
 */
@Document(collection = "qzark_task_queue")
public class QueuedTaskDocument {

    @Id
    private String id;

    private long seq;

    private String name;

    @Field("interval_seconds")
    private long intervalSeconds;

    @Field("shell_command")
    private String shellCommand;

    public QueuedTaskDocument() {
    }

    public static QueuedTaskDocument of(Task task, long seq) {
        QueuedTaskDocument doc = new QueuedTaskDocument();
        doc.setSeq(seq);
        doc.setName(task.name());
        doc.setIntervalSeconds(task.intervalSeconds());
        doc.setShellCommand(task.command());
        return doc;
    }

    public Task toTask() {
        return Task.of(name, intervalSeconds, shellCommand);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getSeq() {
        return seq;
    }

    public void setSeq(long seq) {
        this.seq = seq;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public String getShellCommand() {
        return shellCommand;
    }

    public void setShellCommand(String shellCommand) {
        this.shellCommand = shellCommand;
    }
}
