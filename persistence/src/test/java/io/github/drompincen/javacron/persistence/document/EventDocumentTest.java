package io.github.drompincen.javacron.persistence.document;

import io.github.drompincen.javacron.protocol.api.CadenceUnit;
import io.github.drompincen.javacron.protocol.api.EventStatus;
import io.github.drompincen.javacron.protocol.api.EventType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventDocumentTest {

    @Test
    void newEventIsDraftWithZeroCounters() {
        EventDocument doc = new EventDocument();

        assertThat(doc.getStatus()).isEqualTo(EventStatus.DRAFT);
        assertThat(doc.getExecutionCount()).isZero();
        assertThat(doc.getMaxExecutions()).isZero();
    }

    @Test
    void fieldsAreSetCorrectly() {
        EventDocument doc = new EventDocument();
        doc.setEventId("e1");
        doc.setType(EventType.BASH);
        doc.setScheduleNumber(15);
        doc.setScheduleUnit(CadenceUnit.MINUTES);
        doc.setServerId("srv-1");

        assertThat(doc.getEventId()).isEqualTo("e1");
        assertThat(doc.getType()).isEqualTo(EventType.BASH);
        assertThat(doc.getScheduleNumber()).isEqualTo(15);
        assertThat(doc.getScheduleUnit()).isEqualTo(CadenceUnit.MINUTES);
        assertThat(doc.getServerId()).isEqualTo("srv-1");
    }
}
