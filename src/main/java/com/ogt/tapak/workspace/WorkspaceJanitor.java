package com.ogt.tapak.workspace;

import com.ogt.tapak.config.TapakProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Barre workspaces huérfanos (caída del proceso, descarga que nunca empezó).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkspaceJanitor {

    private final WorkspaceManager workspaceManager;
    private final TapakProperties properties;

    @Scheduled(fixedDelayString = "${tapak.workspace.sweep-interval-ms:900000}",
            initialDelayString = "${tapak.workspace.sweep-interval-ms:900000}")
    public void sweep() {
        int removed = sweepOlderThan(Instant.now().minus(properties.getWorkspace().getMaxAge()));
        if (removed > 0) {
            log.info("🧹 Workspaces huérfanos eliminados: {}", removed);
        }
    }

    int sweepOlderThan(Instant cutoff) {
        Path root = workspaceManager.getRoot();
        if (!Files.isDirectory(root)) {
            return 0;
        }
        List<Path> stale;
        try (Stream<Path> children = Files.list(root)) {
            stale = children.filter(p -> isOlderThan(p, cutoff)).toList();
        } catch (IOException e) {
            log.warn("⚠️ No se pudo listar {}: {}", root, e.getMessage());
            return 0;
        }
        stale.forEach(workspaceManager::delete);
        return stale.size();
    }

    private boolean isOlderThan(Path path, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            return false;
        }
    }
}
