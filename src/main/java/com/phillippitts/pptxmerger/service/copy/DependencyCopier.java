package com.phillippitts.pptxmerger.service.copy;

import com.phillippitts.pptxmerger.domain.PartKind;
import com.phillippitts.pptxmerger.domain.Relationship;
import com.phillippitts.pptxmerger.service.archive.PackageArchiver;
import com.phillippitts.pptxmerger.service.contenttype.ContentTypeRegistry;
import com.phillippitts.pptxmerger.service.naming.PartNameAllocator;
import com.phillippitts.pptxmerger.service.xml.PartPaths;
import com.phillippitts.pptxmerger.service.xml.RelationshipsPart;
import com.phillippitts.pptxmerger.service.xml.XmlPartStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Copies a part and everything it transitively references from a source package tree into the
 * destination tree.
 *
 * <p>For every part reached:
 * <ol>
 *   <li>a part already in the context's name map is not copied again; its mapped path is returned</li>
 *   <li>a part missing from the source tree is skipped and its path returned unchanged</li>
 *   <li>otherwise a fresh destination name is allocated, the bytes are copied and the mapping is
 *       recorded before any recursion, so cyclic graphs (slide and notes slide, master and
 *       layouts) terminate</li>
 *   <li>the content type is registered: an override for known kinds; for everything else the
 *       source's defaults are merged and, when the destination would resolve the new name to a
 *       different type than the source gave the part, an override carrying the source type</li>
 *   <li>the part's relationships part is copied under the new name; each internal target is
 *       copied recursively and rewritten relative to the new owner's folder</li>
 * </ol>
 *
 * <p>External targets (URLs, {@code TargetMode="External"}) are never touched. A target whose
 * part was skipped keeps its original reference.
 */
@Component
public class DependencyCopier {

    private static final Logger LOG = LogManager.getLogger(DependencyCopier.class);

    private final PartNameAllocator allocator;
    private final XmlPartStore store;
    private final PackageArchiver archiver;

    public DependencyCopier(PartNameAllocator allocator, XmlPartStore store, PackageArchiver archiver) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.archiver = Objects.requireNonNull(archiver, "archiver must not be null");
    }

    /**
     * Copies {@code sourcePartPath} and its dependencies.
     *
     * @param context        state of the current source package's pass
     * @param sourcePartPath content-root relative path in the source tree
     * @return content-root relative path in the destination tree, or {@code sourcePartPath}
     *         unchanged when the part does not exist in the source
     */
    public String copyWithDependencies(CopyContext context, String sourcePartPath) {
        Optional<String> mapped = context.mappedPath(sourcePartPath);
        if (mapped.isPresent()) {
            return mapped.get();
        }

        Path sourceFile = context.getSourceRoot().resolve(sourcePartPath);
        if (!Files.isRegularFile(sourceFile)) {
            LOG.debug("Skipping missing part {} referenced in {}", sourcePartPath, context.getSourceName());
            context.recordSkipped();
            return sourcePartPath;
        }

        String folder = PartPaths.folderOf(sourcePartPath);
        String fileName = PartPaths.fileNameOf(sourcePartPath);
        PartKind kind = PartKind.classify(folder, fileName);

        Path destFolder = context.getDestRoot().resolve(folder);
        String destPartPath = PartPaths.join(folder, allocator.nextName(destFolder, kind, fileName));

        archiver.copyPart(sourceFile, context.getDestRoot().resolve(destPartPath));
        context.record(sourcePartPath, destPartPath);
        LOG.debug("Copied {} -> {} ({})", sourcePartPath, destPartPath, kind);

        registerContentType(context, kind, sourcePartPath, destPartPath);
        copyRelationships(context, sourcePartPath, destPartPath);
        return destPartPath;
    }

    private void registerContentType(CopyContext context, PartKind kind, String sourcePartPath, String destPartPath) {
        ContentTypeRegistry dest = context.getDestContentTypes();
        String destPartName = PartPaths.partName(context.getDestContentRoot(), destPartPath);
        if (kind != PartKind.OTHER) {
            dest.registerOverride(destPartName, kind.getContentType());
            return;
        }
        dest.mergeDefaults(context.getSourceContentTypes());
        String sourcePartName = PartPaths.partName(context.getSourceContentRoot(), sourcePartPath);
        Optional<String> sourceType = context.getSourceContentTypes().contentTypeOf(sourcePartName);
        if (sourceType.isEmpty() || sourceType.equals(dest.contentTypeOf(destPartName))) {
            return;
        }
        dest.registerOverride(destPartName, sourceType.get());
        LOG.debug("Registered {} as {} to keep its source type", destPartName, sourceType.get());
    }

    private void copyRelationships(CopyContext context, String sourcePartPath, String destPartPath) {
        Path sourceRels = context.getSourceRoot().resolve(PartPaths.relationshipsPathOf(sourcePartPath));
        if (!Files.isRegularFile(sourceRels)) {
            return;
        }
        Path destRels = context.getDestRoot().resolve(PartPaths.relationshipsPathOf(destPartPath));
        archiver.copyPart(sourceRels, destRels);

        RelationshipsPart rels = RelationshipsPart.of(store.load(destRels));
        String sourceFolder = PartPaths.folderOf(sourcePartPath);
        String destFolder = PartPaths.folderOf(destPartPath);
        boolean changed = false;

        for (Relationship rel : rels.list()) {
            if (!rel.isInternal()) {
                continue;
            }
            String dependency = PartPaths.resolveTarget(context.getSourceContentRoot(), sourceFolder, rel.target());
            String copied = copyWithDependencies(context, dependency);
            if (!context.isCopied(dependency)) {
                LOG.debug("Keeping dangling target {} of {} ({})", rel.target(), sourcePartPath, rel.id());
                continue;
            }
            String newTarget = PartPaths.relativize(destFolder, copied);
            if (!newTarget.equals(rel.target())) {
                rels.setTarget(rel.id(), newTarget);
                changed = true;
            }
        }

        if (changed) {
            store.save(rels.getDocument(), destRels);
        }
    }
}
