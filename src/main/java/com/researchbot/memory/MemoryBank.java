package com.researchbot.memory;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.model.MemoryEntry;
import com.researchbot.output.ReportJson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only log of completed reports. One writer at a time, concurrent readers.
 * With a storage path the whole log is rewritten as a JSON array after every append.
 */
public final class MemoryBank {
    private static final Logger log = LogManager.getLogger(MemoryBank.class);

    private final Path storagePath;
    private final List<MemoryEntry> entries = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** In-memory only. */
    public MemoryBank() {
        this(null);
    }

    public MemoryBank(Path storagePath) {
        this.storagePath = storagePath;
    }

    /**
     * Opens a file-backed bank, loading existing entries when the file exists.
     */
    public static MemoryBank open(Path storagePath) {
        MemoryBank bank = new MemoryBank(storagePath);
        bank.load();
        return bank;
    }

    public Path storagePath() {
        return storagePath;
    }

    /**
     * Appends the entry. A save fault is reported as PERSISTENCE_FAILED; the entry stays in memory.
     */
    public void record(MemoryEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry is required");
        }
        lock.writeLock().lock();
        try {
            entries.add(entry);
            log.info("[{}] stored analysis for {} (entries={})", entry.sessionId(), entry.ticker(), entries.size());
            if (storagePath != null) {
                writeLocked();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Up to {@code limit} entries for the ticker, most recent first.
     */
    public List<MemoryEntry> query(String ticker, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String key = normalize(ticker);
        lock.readLock().lock();
        try {
            List<MemoryEntry> out = new ArrayList<>();
            for (int i = entries.size() - 1; i >= 0 && out.size() < limit; i--) {
                MemoryEntry e = entries.get(i);
                if (normalize(e.ticker()).equals(key)) {
                    out.add(e);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<MemoryEntry> latest(String ticker) {
        List<MemoryEntry> hit = query(ticker, 1);
        return hit.isEmpty() ? Optional.empty() : Optional.of(hit.get(0));
    }

    public List<MemoryEntry> history(String ticker) {
        return query(ticker, Integer.MAX_VALUE);
    }

    /**
     * A session's entries in write order.
     */
    public List<MemoryEntry> querySession(String sessionId) {
        lock.readLock().lock();
        try {
            List<MemoryEntry> out = new ArrayList<>();
            for (MemoryEntry e : entries) {
                if (e.sessionId() != null && e.sessionId().equals(sessionId)) {
                    out.add(e);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the in-memory log with the file contents. A missing file leaves the bank empty.
     */
    public void load() {
        if (storagePath == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            entries.clear();
            if (!Files.exists(storagePath)) {
                return;
            }
            String text = Files.readString(storagePath, StandardCharsets.UTF_8);
            if (text.isBlank()) {
                return;
            }
            JSONArray arr = new JSONArray(text);
            for (int i = 0; i < arr.length(); i++) {
                JSONObject o = arr.optJSONObject(i);
                if (o != null) {
                    entries.add(ReportJson.entryFromJson(o));
                }
            }
            log.info("memory bank loaded {} entries from {}", entries.size(), storagePath);
        } catch (IOException | JSONException e) {
            throw new ResearchException(
                    FailureKind.PERSISTENCE_FAILED,
                    "failed to load memory bank " + storagePath + ": " + e.getMessage(),
                    e
            );
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void save() {
        if (storagePath == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            writeLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void writeLocked() {
        JSONArray arr = new JSONArray();
        for (MemoryEntry e : entries) {
            arr.put(ReportJson.toJson(e));
        }
        try {
            Path parent = storagePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = storagePath.resolveSibling(storagePath.getFileName() + ".tmp");
            Files.writeString(tmp, arr.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, storagePath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("memory bank save failed path={} err={}", storagePath, e.getMessage());
            throw new ResearchException(
                    FailureKind.PERSISTENCE_FAILED,
                    "failed to save memory bank " + storagePath + ": " + e.getMessage(),
                    e
            );
        }
    }

    private static String normalize(String ticker) {
        return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
    }
}
