package com.ogt.tapak.event;

import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.job.TransferJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ImportEventPublisherTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    private TapakProperties properties;
    private ImportEventPublisher publisher;
    private TransferJob job;

    @BeforeEach
    void setUp() {
        properties = new TapakProperties();
        publisher = new ImportEventPublisher(rabbitTemplate, properties);
        job = TransferJob.builder().id(UUID.randomUUID()).fileName("tapak.zip").build();
    }

    @Test
    void sendsEventToConfiguredExchange() {
        publisher.publishImportCompleted(job, 12);

        ArgumentCaptor<ImportCompletedEvent> event = ArgumentCaptor.forClass(ImportCompletedEvent.class);
        verify(rabbitTemplate).convertAndSend(eq("ogt.gis.events"), eq("tapak.import.completed"), event.capture());
        assertThat(event.getValue().getJobId()).isEqualTo(job.getId());
        assertThat(event.getValue().getFileName()).isEqualTo("tapak.zip");
        assertThat(event.getValue().getTargetTable()).isEqualTo("public.tapak_proyek");
        assertThat(event.getValue().getInsertedRows()).isEqualTo(12);
        assertThat(event.getValue().getCompletedAt()).isNotNull();
    }

    @Test
    void brokerFailureDoesNotPropagate() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
                .when(rabbitTemplate).convertAndSend(any(String.class), any(String.class), any(Object.class));

        assertThatCode(() -> publisher.publishImportCompleted(job, 1)).doesNotThrowAnyException();
    }

    @Test
    void disabledEventsSendNothing() {
        properties.getEvents().setEnabled(false);

        publisher.publishImportCompleted(job, 1);

        verifyNoInteractions(rabbitTemplate);
    }
}
