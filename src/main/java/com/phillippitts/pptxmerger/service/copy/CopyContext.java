package com.phillippitts.pptxmerger.service.copy;

import com.phillippitts.pptxmerger.domain.PartKind;
import com.phillippitts.pptxmerger.service.contenttype.ContentTypeRegistry;
import com.phillippitts.pptxmerger.service.xml.PartPaths;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of one source package's copy pass.
 *
 * <p>Owns the name map from source part path to destination part path. One context is created
 * per source input and dropped when that input is fully merged, so parts shared <em>within</em>
 * a source are copied once, while identical parts of two different sources are copied
 * independently. Not thread-safe; a pass runs on a single thread.
 */
public final class CopyContext {

    private final String sourceName;
    private final Path sourceRoot;
    private final String sourceContentRoot;
    private final ContentTypeRegistry sourceContentTypes;
    private final Path destRoot;
    private final String destContentRoot;
    private final ContentTypeRegistry destContentTypes;
    private final Map<String, String> nameMap = new LinkedHashMap<>();
    private int partsSkipped;

    private CopyContext(Builder builder) {
        this.sourceName = Objects.requireNonNull(builder.sourceName, "sourceName must not be null");
        this.sourceRoot = Objects.requireNonNull(builder.sourceRoot, "sourceRoot must not be null");
        this.sourceContentRoot = Objects.requireNonNull(builder.sourceContentRoot, "sourceContentRoot must not be null");
        this.sourceContentTypes = Objects.requireNonNull(builder.sourceContentTypes, "sourceContentTypes must not be null");
        this.destRoot = Objects.requireNonNull(builder.destRoot, "destRoot must not be null");
        this.destContentRoot = Objects.requireNonNull(builder.destContentRoot, "destContentRoot must not be null");
        this.destContentTypes = Objects.requireNonNull(builder.destContentTypes, "destContentTypes must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> mappedPath(String sourcePartPath) {
        return Optional.ofNullable(nameMap.get(sourcePartPath));
    }

    public boolean isCopied(String sourcePartPath) {
        return nameMap.containsKey(sourcePartPath);
    }

    void record(String sourcePartPath, String destPartPath) {
        nameMap.put(sourcePartPath, destPartPath);
    }

    void recordSkipped() {
        partsSkipped++;
    }

    /**
     * @return read-only view of the name map in copy order
     */
    public Map<String, String> nameMap() {
        return Collections.unmodifiableMap(nameMap);
    }

    /**
     * @return destination paths of copied parts of the given kind, in copy order
     */
    public List<String> copiedOfKind(PartKind kind) {
        return nameMap.values().stream()
                .filter(p -> PartKind.classify(PartPaths.folderOf(p), PartPaths.fileNameOf(p)) == kind)
                .toList();
    }

    public int partsCopied() {
        return nameMap.size();
    }

    public int partsSkipped() {
        return partsSkipped;
    }

    public String getSourceName() {
        return sourceName;
    }

    public Path getSourceRoot() {
        return sourceRoot;
    }

    public String getSourceContentRoot() {
        return sourceContentRoot;
    }

    public ContentTypeRegistry getSourceContentTypes() {
        return sourceContentTypes;
    }

    public Path getDestRoot() {
        return destRoot;
    }

    public String getDestContentRoot() {
        return destContentRoot;
    }

    public ContentTypeRegistry getDestContentTypes() {
        return destContentTypes;
    }

    /**
     * Builder for {@link CopyContext}. Roots are the extracted content-root folders
     * (e.g. {@code .../base/ppt}); content-root names are their package-relative names (e.g. {@code ppt}).
     */
    public static final class Builder {
        private String sourceName;
        private Path sourceRoot;
        private String sourceContentRoot;
        private ContentTypeRegistry sourceContentTypes;
        private Path destRoot;
        private String destContentRoot;
        private ContentTypeRegistry destContentTypes;

        private Builder() {}

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder source(Path root, String contentRoot, ContentTypeRegistry contentTypes) {
            this.sourceRoot = root;
            this.sourceContentRoot = contentRoot;
            this.sourceContentTypes = contentTypes;
            return this;
        }

        public Builder destination(Path root, String contentRoot, ContentTypeRegistry contentTypes) {
            this.destRoot = root;
            this.destContentRoot = contentRoot;
            this.destContentTypes = contentTypes;
            return this;
        }

        public CopyContext build() {
            return new CopyContext(this);
        }
    }
}
