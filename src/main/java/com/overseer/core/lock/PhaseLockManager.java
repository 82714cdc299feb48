package com.overseer.core.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.core.OverseerException;
import com.overseer.core.config.OverseerProperties;
import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * File-based mutual exclusion for privileged phases.
 *
 * <p>Each privileged phase has one lock file under the logs directory; its existence is the
 * durable "phase in progress" flag. The file is created with {@code CREATE_NEW}, so two runs
 * racing for the same phase cannot both succeed. While any privileged lock exists, no other
 * run may start.
 */
public class PhaseLockManager {

    private static final Logger log = LoggerFactory.getLogger(PhaseLockManager.class);

    private final Path logsDir;
    private final Set<Phase> privileged;
    private final String mainFileName;
    private final ObjectMapper mapper;
    private final Clock clock;

    public PhaseLockManager(Path logsDir, OverseerProperties.Lock properties, ObjectMapper mapper, Clock clock) {
        this.logsDir = logsDir;
        this.privileged = Set.copyOf(properties.getPrivilegedPhases());
        this.mainFileName = properties.getFileName();
        this.mapper = mapper;
        this.clock = clock;
    }

    /** {@code framework-run.lock} for main, {@code framework-run-<phase>.lock} for other phases. */
    public Path lockFile(Phase phase) {
        if (phase == Phase.MAIN) {
            return logsDir.resolve(mainFileName);
        }
        String stem = mainFileName.endsWith(".lock")
                ? mainFileName.substring(0, mainFileName.length() - ".lock".length())
                : mainFileName;
        return logsDir.resolve(stem + "-" + phase.wireName() + ".lock");
    }

    /**
     * Fails when any privileged phase is currently held.
     *
     * @throws PhaseLockHeldException naming the first held lock
     */
    public void checkAvailable() {
        for (Phase phase : Phase.values()) {
            if (!privileged.contains(phase)) {
                continue;
            }
            Path file = lockFile(phase);
            if (Files.exists(file)) {
                throw new PhaseLockHeldException(file, holder(phase).orElse(null));
            }
        }
    }

    /**
     * Atomically creates the lock file for a phase.
     *
     * @throws PhaseLockHeldException when the lock file already exists
     */
    public PhaseLock acquire(Phase phase, String runId) {
        Path file = lockFile(phase);
        var lock = new PhaseLock(phase.wireName(), runId, clock.instant());
        try {
            Files.createDirectories(logsDir);
            byte[] content = mapper.writeValueAsString(lock).getBytes(StandardCharsets.UTF_8);
            Files.write(file, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new PhaseLockHeldException(file, holder(phase).orElse(null));
        } catch (IOException e) {
            throw new OverseerException("Cannot create lock file " + file + ": " + e.getMessage(), e);
        }
        log.info("Acquired {} phase lock for run {}", phase.wireName(), runId);
        return lock;
    }

    /**
     * Acquires the locks of every privileged phase among {@code phases}. On failure the locks
     * taken so far are released again before the exception propagates.
     *
     * @return the phases whose locks were acquired
     */
    public List<Phase> acquireAll(Set<Phase> phases, String runId) {
        checkAvailable();
        var acquired = new ArrayList<Phase>();
        try {
            for (Phase phase : Phase.values()) {
                if (phases.contains(phase) && privileged.contains(phase)) {
                    acquire(phase, runId);
                    acquired.add(phase);
                }
            }
        } catch (RuntimeException e) {
            for (Phase phase : acquired) {
                release(phase, runId);
            }
            throw e;
        }
        return acquired;
    }

    /**
     * Removes a phase lock held by {@code runId}. A lock held by another run is left alone.
     *
     * @return true if a lock file was removed
     */
    public boolean release(Phase phase, String runId) {
        Optional<PhaseLock> holder = holder(phase);
        if (holder.isPresent() && !runId.equals(holder.get().holderRunId())) {
            log.warn("Not releasing {} phase lock: held by run {}, not {}",
                    phase.wireName(), holder.get().holderRunId(), runId);
            return false;
        }
        return delete(phase);
    }

    /** Removes a phase lock regardless of holder. Used for explicit operator unlocks. */
    public boolean forceRelease(Phase phase) {
        return delete(phase);
    }

    private boolean delete(Phase phase) {
        Path file = lockFile(phase);
        try {
            boolean removed = Files.deleteIfExists(file);
            if (removed) {
                log.info("Released {} phase lock ({})", phase.wireName(), file);
            }
            return removed;
        } catch (IOException e) {
            throw new OverseerException("Cannot remove lock file " + file + ": " + e.getMessage(), e);
        }
    }

    /** Holder recorded in the phase's lock file, if the file exists and is readable. */
    public Optional<PhaseLock> holder(Phase phase) {
        Path file = lockFile(phase);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), PhaseLock.class));
        } catch (IOException e) {
            log.warn("Unreadable lock file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
