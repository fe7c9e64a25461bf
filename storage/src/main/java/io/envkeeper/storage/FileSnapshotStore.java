// file: src/main/java/io/envkeeper/storage/FileSnapshotStore.java
package io.envkeeper.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.envkeeper.core.CorruptSnapshotException;
import io.envkeeper.core.Snapshot;
import io.envkeeper.core.SnapshotIds;
import io.envkeeper.core.SnapshotNotFoundException;
import io.envkeeper.storage.record.SnapshotManifest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Snapshot store laid out so a person can browse it:
 * <pre>
 *   &lt;root&gt;/objects/&lt;id[0..2]&gt;/&lt;id&gt;.payload   raw payload bytes
 *   &lt;root&gt;/objects/&lt;id[0..2]&gt;/&lt;id&gt;.json      pretty-printed {@link SnapshotManifest}
 *   &lt;root&gt;/refs/&lt;name&gt;                      snapshot id as a single text line
 * </pre>
 * Write order: payload, then manifest. The manifest is the commit point, so a
 * crash between the two leaves an orphan payload and no visible snapshot.
 * <p>
 * Atomicity:
 *   - every file is written to a uniquely named "*.tmp" first,
 *   - then moved into place with ATOMIC_MOVE.
 * Concurrent writers of the same id produce byte-identical files, so the last
 * rename wins without changing anything observable.
 */
public final class FileSnapshotStore implements SnapshotStore {
    private static final Pattern REF_NAME = Pattern.compile("[a-z0-9][a-z0-9._-]{0,63}");

    private final Path objects;
    private final Path refs;
    private final ObjectMapper json = JournalCodec.MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);

    public FileSnapshotStore(Path root) {
        this.objects = root.resolve("objects");
        this.refs = root.resolve("refs");
        try {
            Files.createDirectories(objects);
            Files.createDirectories(refs);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean put(Snapshot snapshot) {
        String id = snapshot.snapshotId();
        if (!snapshot.verify()) {
            throw new IllegalArgumentException("snapshot id does not match its contents: " + id);
        }
        if (contains(id)) {
            return false;
        }

        List<String> chain = new ArrayList<>();
        String parent = snapshot.parentSnapshotId();
        if (parent != null) {
            if (!contains(parent)) {
                throw new IllegalArgumentException("unknown parent snapshot " + parent + " for " + id);
            }
            chain.add(parent);
            List<String> ancestors = manifest(parent).chain;
            if (ancestors != null) {
                chain.addAll(ancestors);
            }
        }

        SnapshotManifest m = new SnapshotManifest();
        m.snapshotId = id;
        m.sessionId = snapshot.sessionId();
        m.capturedAtMillis = snapshot.capturedAtMillis();
        m.parentSnapshotId = parent;
        m.encoding = snapshot.encoding();
        m.payloadSize = snapshot.payloadSize();
        m.payloadFile = id + ".payload";
        m.chain = chain;

        try {
            Path dir = Files.createDirectories(objects.resolve(id.substring(0, 2)));
            writeAtomically(dir.resolve(m.payloadFile), snapshot.payload());
            writeAtomically(dir.resolve(id + ".json"), json.writeValueAsBytes(m));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write snapshot " + id, e);
        }
        return true;
    }

    @Override
    public Snapshot get(String snapshotId) {
        SnapshotManifest m = manifest(snapshotId);
        byte[] payload;
        try {
            payload = Files.readAllBytes(payloadPath(snapshotId));
        } catch (NoSuchFileException e) {
            throw new CorruptSnapshotException("payload missing for snapshot " + snapshotId, e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Snapshot s = new Snapshot(m.snapshotId, m.sessionId, m.capturedAtMillis, m.encoding, payload, m.parentSnapshotId);
        if (!snapshotId.equals(m.snapshotId) || !s.verify()) {
            throw new CorruptSnapshotException("snapshot " + snapshotId + " does not match its content hash");
        }
        return s;
    }

    @Override
    public SnapshotManifest manifest(String snapshotId) {
        if (!contains(snapshotId)) {
            throw new SnapshotNotFoundException(snapshotId);
        }
        try {
            return json.readValue(manifestPath(snapshotId).toFile(), SnapshotManifest.class);
        } catch (IOException e) {
            throw new CorruptSnapshotException("unreadable manifest for snapshot " + snapshotId, e);
        }
    }

    @Override
    public boolean contains(String snapshotId) {
        return SnapshotIds.looksValid(snapshotId) && Files.exists(manifestPath(snapshotId));
    }

    @Override
    public List<SnapshotManifest> chain(String snapshotId) {
        List<SnapshotManifest> out = new ArrayList<>();
        SnapshotManifest head = manifest(snapshotId);
        out.add(head);
        if (head.chain != null) {
            for (String ancestor : head.chain) {
                out.add(manifest(ancestor));
            }
        }
        return out;
    }

    @Override
    public String readRef(String name) {
        Path p = refPath(name);
        try {
            String id = Files.readString(p, StandardCharsets.UTF_8).trim();
            return id.isEmpty() ? null : id;
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void writeRef(String name, String snapshotId) {
        if (!contains(snapshotId)) {
            throw new SnapshotNotFoundException(snapshotId);
        }
        try {
            writeAtomically(refPath(name), (snapshotId + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to update ref " + name, e);
        }
    }

    // ----------------- helpers -----------------

    private Path refPath(String name) {
        if (name == null || !REF_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid ref name: " + name);
        }
        return refs.resolve(name);
    }

    private Path manifestPath(String id) {
        return objects.resolve(id.substring(0, 2)).resolve(id + ".json");
    }

    private Path payloadPath(String id) {
        return objects.resolve(id.substring(0, 2)).resolve(id + ".payload");
    }

    private static void writeAtomically(Path dst, byte[] bytes) throws IOException {
        Path tmp = dst.resolveSibling(dst.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tmp, bytes);
            Files.move(tmp, dst, ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
