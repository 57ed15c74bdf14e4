package io.qzark.internal.mongo;

import io.qzark.core.Task;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MongoTaskStoreTest {

    private static QueuedTaskDocument doc(String name, long intervalSeconds, long seq) {
        QueuedTaskDocument doc = new QueuedTaskDocument();
        doc.setSeq(seq);
        doc.setName(name);
        doc.setIntervalSeconds(intervalSeconds);
        doc.setShellCommand("true");
        return doc;
    }

    @Test
    void popShouldDropCorruptHeadAndReturnNextTask() {
        MongoTemplate template = mock(MongoTemplate.class);
        when(template.findAndRemove(any(Query.class), eq(QueuedTaskDocument.class)))
                .thenReturn(doc(null, 10, 1), doc("zero", 0, 2), doc("good", 10, 3), null);

        MongoTaskStore store = new MongoTaskStore(template);

        assertThat(store.pop()).contains(Task.of("good", 10, "true"));
        assertThat(store.pop()).isEmpty();
    }

    @Test
    void snapshotShouldLeaveOutCorruptEntries() {
        MongoTemplate template = mock(MongoTemplate.class);
        when(template.find(any(Query.class), eq(QueuedTaskDocument.class)))
                .thenReturn(List.of(doc("zero", 0, 1), doc("good", 10, 2)));

        MongoTaskStore store = new MongoTaskStore(template);

        assertThat(store.snapshot()).extracting(Task::name).containsExactly("good");
    }
}
