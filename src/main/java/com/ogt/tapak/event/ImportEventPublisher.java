package com.ogt.tapak.event;

import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.job.TransferJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Avisa a los demás servicios que la capa tapak proyek recibió filas nuevas.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportEventPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final TapakProperties properties;

    /**
     * La carga ya está confirmada en la base: un fallo del broker no la revierte, sólo se loguea.
     */
    public void publishImportCompleted(TransferJob job, int insertedRows) {
        TapakProperties.Events events = properties.getEvents();
        if (!events.isEnabled()) {
            return;
        }

        ImportCompletedEvent event = ImportCompletedEvent.builder()
                .jobId(job.getId())
                .fileName(job.getFileName())
                .targetTable(properties.getTargetTable())
                .insertedRows(insertedRows)
                .completedAt(job.getCompletedAt() != null ? job.getCompletedAt() : LocalDateTime.now())
                .build();

        try {
            rabbitTemplate.convertAndSend(events.getExchange(), events.getRoutingKey(), event);
            log.info("🚀 Evento de import publicado. Job ID: {} ({} filas)", job.getId(), insertedRows);
        } catch (AmqpException e) {
            log.warn("⚠️ No se pudo publicar el evento del job {}: {}", job.getId(), e.getMessage());
        }
    }
}
