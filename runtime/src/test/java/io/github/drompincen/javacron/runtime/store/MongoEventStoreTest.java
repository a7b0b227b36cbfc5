package io.github.drompincen.javacron.runtime.store;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.javacron.persistence.document.EventDocument;
import io.github.drompincen.javacron.persistence.repository.ConditionalActionRepository;
import io.github.drompincen.javacron.persistence.repository.EventRepository;
import io.github.drompincen.javacron.persistence.repository.ExecutionLogRepository;
import io.github.drompincen.javacron.persistence.repository.ServerRepository;
import io.github.drompincen.javacron.persistence.repository.ToolCredentialRepository;
import io.github.drompincen.javacron.persistence.repository.UserVariableRepository;
import io.github.drompincen.javacron.protocol.api.EventStatus;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoEventStoreTest {

    @Mock private EventRepository eventRepository;
    @Mock private ConditionalActionRepository actionRepository;
    @Mock private ExecutionLogRepository logRepository;
    @Mock private UserVariableRepository variableRepository;
    @Mock private ServerRepository serverRepository;
    @Mock private ToolCredentialRepository toolCredentialRepository;
    @Mock private MongoTemplate mongoTemplate;
    @Captor private ArgumentCaptor<Query> queryCaptor;
    @Captor private ArgumentCaptor<UpdateDefinition> updateCaptor;
    @Captor private ArgumentCaptor<FindAndModifyOptions> optionsCaptor;

    private MongoEventStore store;

    @BeforeEach
    void setUp() {
        store = new MongoEventStore(eventRepository, actionRepository, logRepository, variableRepository,
                serverRepository, toolCredentialRepository, mongoTemplate);
    }

    @Test
    void recordRunIncrementsCountersInOneUpdateAndReturnsTheNewState() {
        EventDocument updated = new EventDocument();
        updated.setEventId("evt-1");
        updated.setExecutionCount(4);
        when(mongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                any(FindAndModifyOptions.class), eq(EventDocument.class))).thenReturn(updated);
        Instant finishedAt = Instant.parse("2026-03-01T10:00:00Z");

        Optional<EventDocument> result = store.recordRun("evt-1", false, finishedAt);

        assertThat(result).containsSame(updated);
        verify(mongoTemplate).findAndModify(queryCaptor.capture(), updateCaptor.capture(),
                optionsCaptor.capture(), eq(EventDocument.class));
        assertThat(queryCaptor.getValue().getQueryObject().get("_id")).isEqualTo("evt-1");
        Document inc = (Document) updateCaptor.getValue().getUpdateObject().get("$inc");
        assertThat(inc).containsEntry("executionCount", 1).containsEntry("failureCount", 1)
                .doesNotContainKey("successCount");
        Document set = (Document) updateCaptor.getValue().getUpdateObject().get("$set");
        assertThat(set).containsEntry("lastRunAt", finishedAt);
        assertThat(optionsCaptor.getValue().isReturnNew()).isTrue();
        verify(eventRepository, never()).save(any());
    }

    @Test
    void recordRunForMissingEventIsEmpty() {
        when(mongoTemplate.findAndModify(any(Query.class), any(UpdateDefinition.class),
                any(FindAndModifyOptions.class), eq(EventDocument.class))).thenReturn(null);

        assertThat(store.recordRun("gone", true, Instant.now())).isEmpty();
    }

    @Test
    void pauseOnlyMatchesActiveEvents() {
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq(EventDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        assertThat(store.pauseIfActive("evt-1")).isTrue();

        verify(mongoTemplate).updateFirst(queryCaptor.capture(), updateCaptor.capture(), eq(EventDocument.class));
        assertThat(queryCaptor.getValue().getQueryObject())
                .containsEntry("_id", "evt-1")
                .containsEntry("status", EventStatus.ACTIVE);
        Document set = (Document) updateCaptor.getValue().getUpdateObject().get("$set");
        assertThat(set).containsEntry("status", EventStatus.PAUSED);
    }

    @Test
    void pauseOfAnEventThatIsNoLongerActiveReportsNoChange() {
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq(EventDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.pauseIfActive("evt-1")).isFalse();
    }
}
