package com.campaignkeeper;

import com.campaignkeeper.models.Entity;
import com.campaignkeeper.models.EntityInput;
import com.campaignkeeper.models.EntityMetadata;
import com.campaignkeeper.models.EntityUpdate;
import com.campaignkeeper.modules.ModuleDefinition;
import com.campaignkeeper.modules.ModuleRegistry;
import com.campaignkeeper.storage.ContentChangeListener;
import com.campaignkeeper.storage.ContentChangeListener.ChangeType;
import com.campaignkeeper.storage.FrontmatterCodec;
import com.campaignkeeper.storage.FrontmatterCodec.ParsedDocument;
import com.campaignkeeper.storage.IdGenerator;
import com.campaignkeeper.validation.ContentValidationException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * CRUD over campaign entities stored one Markdown file per entity at
 * {@code <campaignsRoot>/<campaignId>/<dataFolder>/<entityId>.md}.
 * Every write runs under the {@link FileLock} keyed by the file's absolute path.
 */
public class ContentStore {

    public static final String EXTENSION = ".md";
    private static final int MAX_ID_ATTEMPTS = 5;
    private static final Comparator<EntityMetadata> BY_NAME =
        Comparator.comparing(EntityMetadata::getName, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(EntityMetadata::getId);

    private final Path campaignsRoot;
    private final ModuleRegistry modules;
    private final FileLock fileLock;
    private final FrontmatterCodec codec;
    private final IdGenerator idGenerator;
    private final List<ContentChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final AppLogger logger = AppLogger.get();

    public ContentStore(Path campaignsRoot, ModuleRegistry modules, FileLock fileLock, FrontmatterCodec codec) {
        this(campaignsRoot, modules, fileLock, codec, new IdGenerator());
    }

    public ContentStore(Path campaignsRoot, ModuleRegistry modules, FileLock fileLock, FrontmatterCodec codec,
                        IdGenerator idGenerator) {
        this.campaignsRoot = campaignsRoot.toAbsolutePath().normalize();
        this.modules = modules;
        this.fileLock = fileLock;
        this.codec = codec;
        this.idGenerator = idGenerator;
    }

    public void addListener(ContentChangeListener listener) {
        listeners.add(listener);
    }

    public Path getCampaignsRoot() {
        return campaignsRoot;
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    /**
     * Entity metadata for the module sorted by name, without configuration records
     * (ids starting with {@code _}). Files that cannot be parsed are skipped.
     */
    public List<EntityMetadata> list(String campaignId, String moduleId) throws IOException {
        List<EntityMetadata> result = listAll(campaignId, moduleId);
        result.removeIf(meta -> isConfigRecord(meta.getId()));
        return result;
    }

    /**
     * Like {@link #list} but keeps configuration records.
     */
    public List<EntityMetadata> listAll(String campaignId, String moduleId) throws IOException {
        Path campaignDir = campaignDir(campaignId);
        Path dir = moduleDir(campaignDir, moduleId);
        List<EntityMetadata> result = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return result;
        }

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + EXTENSION)) {
            for (Path file : stream) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    ParsedDocument doc = codec.parse(Files.readString(file, StandardCharsets.UTF_8));
                    Map<String, Object> frontmatter = doc.getFrontmatter();
                    if (!(frontmatter.get("id") instanceof String) || !(frontmatter.get("name") instanceof String)) {
                        continue;
                    }
                    result.add(new EntityMetadata(frontmatter, relativePath(campaignDir, file), modifiedOf(file)));
                } catch (IOException e) {
                    logger.warn("[ContentStore] Skipping " + relativePath(campaignDir, file) + ": " + e.getMessage());
                }
            }
        }

        result.sort(BY_NAME);
        return result;
    }

    /**
     * @return the entity, or {@code null} when no file in the module carries {@code id}
     */
    public Entity get(String campaignId, String moduleId, String id) throws IOException {
        requireSafeSegment(id, "Entity id");
        Path campaignDir = campaignDir(campaignId);
        Path file = locate(moduleDir(campaignDir, moduleId), id);
        if (file == null) {
            return null;
        }
        try {
            return readEntity(campaignDir, file);
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    // -------------------------------------------------------------------------
    // Writes
    // -------------------------------------------------------------------------

    /**
     * Persists a new entity. Without an explicit {@code frontmatter.id} the id is
     * {@code slug(name)-<random>}, regenerated on collision.
     *
     * @throws ContentValidationException if the name is missing, or an explicit id is
     *     not a slug or is taken
     */
    public Entity create(String campaignId, String moduleId, EntityInput input) throws IOException {
        if (input == null || input.getName() == null || input.getName().isBlank()) {
            throw new ContentValidationException("Name is required");
        }
        Path campaignDir = campaignDir(campaignId);
        Path dir = moduleDir(campaignDir, moduleId);

        Object explicitId = input.getFrontmatter().get("id");
        if (explicitId != null) {
            String id = String.valueOf(explicitId);
            if (!IdGenerator.isValidId(id)) {
                throw new ContentValidationException("Invalid entity id: " + id
                    + " (letters, digits, '-' and '_' only)");
            }
            Entity created = tryCreate(campaignDir, dir, id, input);
            if (created == null) {
                throw new ContentValidationException("An entity with id '" + id + "' already exists");
            }
            notifyListeners(campaignId, moduleId, id, ChangeType.CREATED);
            return created;
        }

        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String id = idGenerator.fileId(input.getName());
            Entity created = tryCreate(campaignDir, dir, id, input);
            if (created != null) {
                notifyListeners(campaignId, moduleId, id, ChangeType.CREATED);
                return created;
            }
            logger.info("[ContentStore] Id collision on " + id + ", regenerating suffix");
        }
        throw new IOException("Could not allocate a unique id for '" + input.getName() + "' in " + moduleId);
    }

    /**
     * Merges {@code update} into the stored entity under its file lock.
     *
     * @return the updated entity, or {@code null} if {@code id} does not exist
     */
    public Entity update(String campaignId, String moduleId, String id, EntityUpdate update) throws IOException {
        requireSafeSegment(id, "Entity id");
        Path campaignDir = campaignDir(campaignId);
        Path file = locate(moduleDir(campaignDir, moduleId), id);
        if (file == null) {
            return null;
        }

        EntityUpdate changes = update != null ? update : new EntityUpdate();
        Entity updated = locked(file, () -> {
            if (!Files.exists(file)) {
                return null;
            }
            ParsedDocument existing = codec.parse(Files.readString(file, StandardCharsets.UTF_8));
            if (!id.equals(existing.getFrontmatter().get("id"))) {
                return null;
            }
            Map<String, Object> frontmatter = mergeFrontmatter(existing.getFrontmatter(), id, changes);
            frontmatter.put("updated", Instant.now().toString());
            String content = changes.getContent() != null ? changes.getContent().trim() : existing.getContent();
            writeAtomic(file, codec.serialize(frontmatter, content));
            return new Entity(frontmatter, content, relativePath(campaignDir, file), modifiedOf(file));
        });

        if (updated != null) {
            notifyListeners(campaignId, moduleId, id, ChangeType.UPDATED);
        }
        return updated;
    }

    /**
     * @return {@code true} if a file was removed
     */
    public boolean delete(String campaignId, String moduleId, String id) throws IOException {
        requireSafeSegment(id, "Entity id");
        Path campaignDir = campaignDir(campaignId);
        Path file = locate(moduleDir(campaignDir, moduleId), id);
        if (file == null) {
            return false;
        }

        boolean deleted = locked(file, () -> Files.deleteIfExists(file));
        if (deleted) {
            logger.info("[ContentStore] Deleted " + relativePath(campaignDir, file));
            notifyListeners(campaignId, moduleId, id, ChangeType.DELETED);
        }
        return deleted;
    }

    /**
     * The frontmatter an update would produce: {@code id} is pinned, a non-null
     * {@code name} replaces the stored one, and null-valued keys are removed.
     * Does not touch {@code existing}.
     */
    public static Map<String, Object> mergeFrontmatter(Map<String, Object> existing, String id, EntityUpdate update) {
        Map<String, Object> merged = new LinkedHashMap<>(existing != null ? existing : Map.of());
        merged.put("id", id);
        if (update == null) {
            return merged;
        }
        if (update.getName() != null) {
            merged.put("name", update.getName());
        }
        if (update.getFrontmatter() != null) {
            for (Map.Entry<String, Object> entry : update.getFrontmatter().entrySet()) {
                if ("id".equals(entry.getKey())) {
                    continue;
                }
                if (entry.getValue() == null) {
                    merged.remove(entry.getKey());
                } else {
                    merged.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return merged;
    }

    public static boolean isConfigRecord(String id) {
        return id != null && id.startsWith("_");
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private Entity tryCreate(Path campaignDir, Path dir, String id, EntityInput input) throws IOException {
        Path target = dir.resolve(id + EXTENSION);
        return locked(target, () -> {
            if (Files.exists(target) || locate(dir, id) != null) {
                return null;
            }
            Files.createDirectories(dir);

            String now = Instant.now().toString();
            Map<String, Object> frontmatter = new LinkedHashMap<>();
            frontmatter.put("id", id);
            frontmatter.put("name", input.getName());
            for (Map.Entry<String, Object> entry : input.getFrontmatter().entrySet()) {
                String key = entry.getKey();
                if (!"id".equals(key) && !"name".equals(key) && entry.getValue() != null) {
                    frontmatter.put(key, entry.getValue());
                }
            }
            frontmatter.putIfAbsent("created", now);
            frontmatter.put("updated", now);

            String content = input.getContent() != null ? input.getContent().trim() : "";
            writeAtomic(target, codec.serialize(frontmatter, content));
            logger.info("[ContentStore] Created " + relativePath(campaignDir, target));
            return new Entity(frontmatter, content, relativePath(campaignDir, target), modifiedOf(target));
        });
    }

    /**
     * Finds the file holding {@code id}: {@code <id>.md} first, then any file whose
     * frontmatter declares that id.
     */
    private Path locate(Path dir, String id) throws IOException {
        if (!Files.isDirectory(dir)) {
            return null;
        }
        Path direct = dir.resolve(id + EXTENSION);
        if (Files.isRegularFile(direct) && id.equals(readIdIfPresent(direct))) {
            return direct;
        }

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + EXTENSION)) {
            for (Path file : stream) {
                if (file.equals(direct) || !Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    if (id.equals(readIdIfPresent(file))) {
                        return file;
                    }
                } catch (IOException e) {
                    logger.warn("[ContentStore] Unreadable file while looking up " + id + ": "
                        + file.getFileName() + " (" + e.getMessage() + ")");
                }
            }
        }
        return null;
    }

    /**
     * @return the file's frontmatter id, or {@code null} if the file was deleted meanwhile
     */
    private Object readIdIfPresent(Path file) throws IOException {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        }
        return codec.parse(text).getFrontmatter().get("id");
    }

    private Entity readEntity(Path campaignDir, Path file) throws IOException {
        ParsedDocument doc = codec.parse(Files.readString(file, StandardCharsets.UTF_8));
        return new Entity(doc.getFrontmatter(), doc.getContent(), relativePath(campaignDir, file), modifiedOf(file));
    }

    /**
     * Atomic write: write to .tmp file, then rename.
     */
    private void writeAtomic(Path target, String text) throws IOException {
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        Files.writeString(tmpFile, text, StandardCharsets.UTF_8);
        Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private <T> T locked(Path file, IoOperation<T> operation) throws IOException {
        try {
            return fileLock.withLock(file.toString(), operation::run);
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for lock on " + file.getFileName());
        } catch (Exception e) {
            throw new IOException(e);
        }
    }

    private void notifyListeners(String campaignId, String moduleId, String entityId, ChangeType type) {
        for (ContentChangeListener listener : listeners) {
            try {
                listener.onContentChanged(campaignId, moduleId, entityId, type);
            } catch (RuntimeException e) {
                logger.error("[ContentStore] Change listener failed for " + moduleId + "/" + entityId, e);
            }
        }
    }

    /**
     * @throws ContentValidationException if the campaign directory does not exist
     */
    Path campaignDir(String campaignId) {
        requireSafeSegment(campaignId, "Campaign id");
        Path dir = campaignsRoot.resolve(campaignId).normalize();
        if (!dir.startsWith(campaignsRoot) || dir.equals(campaignsRoot)) {
            throw new SecurityException("Path escapes campaigns root: " + campaignId);
        }
        if (!Files.isDirectory(dir)) {
            throw new ContentValidationException("Campaign not found: " + campaignId);
        }
        return dir;
    }

    private Path moduleDir(Path campaignDir, String moduleId) {
        ModuleDefinition module = modules.require(moduleId);
        Path dir = campaignDir.resolve(module.getDataFolder()).normalize();
        if (!dir.startsWith(campaignDir)) {
            throw new SecurityException("Module folder escapes campaign: " + module.getDataFolder());
        }
        return dir;
    }

    static void requireSafeSegment(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new ContentValidationException(label + " is required");
        }
        if (value.contains("/") || value.contains("\\") || value.contains("..") || value.indexOf('\0') >= 0) {
            throw new ContentValidationException("Invalid " + label.toLowerCase() + ": " + value);
        }
    }

    private static String relativePath(Path base, Path file) {
        return base.relativize(file).toString().replace('\\', '/');
    }

    private static String modifiedOf(Path file) throws IOException {
        return Files.getLastModifiedTime(file).toInstant().toString();
    }

    @FunctionalInterface
    private interface IoOperation<T> {
        T run() throws IOException;
    }
}
