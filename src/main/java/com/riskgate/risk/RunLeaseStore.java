package com.riskgate.risk;

import com.riskgate.exception.BestEffort;
import com.riskgate.mapper.JsonHelper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

/**
 * Filesystem-backed lease directory coordinating runs across processes that share no memory.
 *
 * <p>Layout: {@code <state_dir>/running/<kind>_<unix_ts>_<pid>[_<cid prefix>][_<n>].lock}. A lease
 * is live while its file exists and its modification time is no older than the TTL; there is no
 * owner liveness check, so a crashed process's lease is reclaimed only by age.
 *
 * <p>Files are created with {@link StandardOpenOption#CREATE_NEW}, which narrows but does not
 * close the window between counting and creating in {@link RiskManager#acquireRunSlot}: two
 * processes that count at the same instant can both create. Caps are therefore exact under
 * sequential acquisition and approximate under concurrent bursts.
 */
@Component
public class RunLeaseStore {

    private static final Logger log = LoggerFactory.getLogger(RunLeaseStore.class);

    static final String LOCK_SUFFIX = ".lock";
    private static final int MAX_NAME_ATTEMPTS = 100;

    private final RiskConfiguration riskConfiguration;

    public RunLeaseStore(RiskConfiguration riskConfiguration) {
        this.riskConfiguration = riskConfiguration;
    }

    // ========================
    // CREATE
    // ========================

    /**
     * Creates a lease file for {@code kind}. Never throws: if the directory or file cannot be
     * created the failure is logged and a handle is still returned so release stays symmetric.
     */
    public RunLease create(String kind, String correlationId) {
        Instant now = Instant.now();
        Path dir = riskConfiguration.runningDirectory();
        String baseName = RunIdentifiers.processScopedName(kind, now.getEpochSecond(), correlationId);

        BestEffort.run(log, Level.ERROR, "lease_dir_create_error dir=" + dir, () -> Files.createDirectories(dir));

        // tries base, base_2, ..., base_MAX_NAME_ATTEMPTS
        Path path = null;
        for (int attempt = 1; path == null && attempt <= MAX_NAME_ATTEMPTS; attempt++) {
            Path candidate = dir.resolve(leaseFileName(baseName, attempt));
            try {
                Files.createFile(candidate);
                path = candidate;
            } catch (FileAlreadyExistsException e) {
                // same kind, second, pid and correlation prefix as a lease we already hold
                log.debug("lease_name_taken lock={}", candidate);
            } catch (IOException | RuntimeException e) {
                log.error("lease_create_error lock={} error={}", candidate, e.getMessage());
                return new RunLease(kind, candidate, now, correlationId);
            }
        }
        if (path == null) {
            Path last = dir.resolve(leaseFileName(baseName, MAX_NAME_ATTEMPTS));
            log.error("lease_create_error lock={} error=no free lease name", last);
            return new RunLease(kind, last, now, correlationId);
        }

        LeasePayload payload = new LeasePayload(
                kind, RunIdentifiers.currentPid(), IsoTimestamps.format(now), correlationId != null ? correlationId : "");
        Path leasePath = path;
        BestEffort.run(
                log,
                Level.WARN,
                "lease_payload_write_error lock=" + leasePath,
                () -> Files.writeString(
                        leasePath, JsonHelper.toJson(payload), StandardCharsets.UTF_8, StandardOpenOption.WRITE));
        return new RunLease(kind, leasePath, now, correlationId);
    }

    private static String leaseFileName(String baseName, int attempt) {
        return (attempt == 1 ? baseName : baseName + "_" + attempt) + LOCK_SUFFIX;
    }

    // ========================
    // COUNT
    // ========================

    /**
     * Counts live leases of {@code kind}, deleting stale ones on the way. Never throws.
     *
     * <ul>
     *   <li>File vanished before it could be inspected: skipped</li>
     *   <li>File could not be inspected for any other reason: warned and skipped</li>
     *   <li>{@code age > max(1, ttl)}: deleted (errors logged) and not counted</li>
     *   <li>Otherwise counted</li>
     * </ul>
     */
    public int countActive(String kind) {
        return activeLeaseNames(kind).size();
    }

    /**
     * Names of the live leases of {@code kind}, applying the same staleness rule as
     * {@link #countActive(String)}. Sorted by name, which puts older leases first.
     */
    public List<String> listActive(String kind) {
        List<String> names = activeLeaseNames(kind);
        Collections.sort(names);
        return names;
    }

    private List<String> activeLeaseNames(String kind) {
        List<String> active = new ArrayList<>();
        Path dir = riskConfiguration.runningDirectory();
        if (!Files.isDirectory(dir)) {
            return active;
        }

        long ttlMillis = Math.max(1, riskConfiguration.getConcurrencyTtlSeconds()) * 1000L;
        long nowMillis = System.currentTimeMillis();

        try (DirectoryStream<Path> locks = Files.newDirectoryStream(dir, kind + "_*" + LOCK_SUFFIX)) {
            for (Path lock : locks) {
                long ageMillis;
                try {
                    ageMillis = nowMillis - Files.getLastModifiedTime(lock).toMillis();
                } catch (NoSuchFileException e) {
                    continue;
                } catch (IOException | RuntimeException e) {
                    log.warn("lease_inspect_error lock={} error={}", lock.getFileName(), e.getMessage());
                    continue;
                }

                if (ageMillis > ttlMillis) {
                    log.debug(
                            "stale_lock_cleanup lock_file={} age_sec={} ttl_sec={}",
                            lock,
                            ageMillis / 1000.0,
                            ttlMillis / 1000);
                    BestEffort.run(log, Level.ERROR, "stale_lock_remove_error lock=" + lock.getFileName(), () -> Files.delete(lock));
                    continue;
                }

                active.add(lock.getFileName().toString());
            }
        } catch (IOException | RuntimeException e) {
            log.error("lease_dir_list_error dir={} error={}", dir, e.getMessage());
        }
        return active;
    }

    // ========================
    // RELEASE
    // ========================

    /**
     * Deletes the lease file. A file that is already gone is not an error; any other failure is
     * logged and swallowed.
     *
     * @return true if this call removed the file
     */
    public boolean release(RunLease lease) {
        Path path = lease.getPath();
        return BestEffort.getOrDefault(
                log,
                Level.WARN,
                "slot_release_error lock=" + path,
                () -> {
                    boolean removed = Files.deleteIfExists(path);
                    if (!removed) {
                        log.debug("slot_release_missing lock={}", path);
                    }
                    return removed;
                },
                false);
    }
}
