package com.phillippitts.pptxmerger.service.merge;

import com.phillippitts.pptxmerger.domain.MergeResult;
import com.phillippitts.pptxmerger.domain.PartKind;
import com.phillippitts.pptxmerger.domain.Relationship;
import com.phillippitts.pptxmerger.exception.ArchiveWriteException;
import com.phillippitts.pptxmerger.exception.MergeExceptionBuilder;
import com.phillippitts.pptxmerger.exception.PptxMergerException;
import com.phillippitts.pptxmerger.service.archive.PackageArchiver;
import com.phillippitts.pptxmerger.service.contenttype.ContentTypeRegistry;
import com.phillippitts.pptxmerger.service.copy.CopyContext;
import com.phillippitts.pptxmerger.service.copy.DependencyCopier;
import com.phillippitts.pptxmerger.service.merge.PresentationDocument.SlideRef;
import com.phillippitts.pptxmerger.service.xml.OoxmlNamespaces;
import com.phillippitts.pptxmerger.service.xml.PartPaths;
import com.phillippitts.pptxmerger.service.xml.RelationshipsPart;
import com.phillippitts.pptxmerger.service.xml.XmlPartStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one merge call: the extracted base package, its manifests, and the running slide id.
 *
 * <p>Lifecycle: {@link #open} extracts and loads the base input, {@link #importSlides} is called
 * once per additional input in order, {@link #finish} persists and archives. A session is used for
 * exactly one merge and never shared between threads.
 */
final class MergeSession {

    private static final Logger LOG = LogManager.getLogger(MergeSession.class);

    private final Collaborators collaborators;
    private final Path workDir;
    private final Path baseTree;
    private final String contentRoot;
    private final Path contentRootDir;
    private final Path presentationFile;
    private final Path presentationRelsFile;
    private final PresentationDocument presentation;
    private final RelationshipsPart presentationRels;
    private final ContentTypeRegistry contentTypes;
    private final MasterRegistrar masterRegistrar;
    private final List<MergeResult.InputSummary> summaries = new ArrayList<>();
    private long maxSlideId;
    private int partsCopied;
    private int partsSkipped;

    /**
     * Services a session works with; bundled so the session can be opened in one call.
     */
    record Collaborators(PackageArchiver archiver, XmlPartStore store, DependencyCopier copier, boolean registerMasters) {}

    private MergeSession(Collaborators collaborators, Path workDir, Path baseTree, String mainPart) {
        this.collaborators = collaborators;
        this.workDir = workDir;
        this.baseTree = baseTree;
        this.contentRoot = PartPaths.folderOf(mainPart);
        this.contentRootDir = baseTree.resolve(contentRoot);
        this.presentationFile = baseTree.resolve(mainPart);
        this.presentationRelsFile = contentRootDir.resolve(PartPaths.relationshipsPathOf(PartPaths.fileNameOf(mainPart)));

        XmlPartStore store = collaborators.store();
        this.presentation = PresentationDocument.of(store.load(presentationFile));
        this.presentationRels = RelationshipsPart.of(store.load(presentationRelsFile));
        this.contentTypes = ContentTypeRegistry.load(store, baseTree);
        this.presentation.ensureSlideIdList();
        this.maxSlideId = presentation.maxSlideId();
        this.masterRegistrar = collaborators.registerMasters()
                ? MasterRegistrar.scan(store, contentRootDir, presentation)
                : null;
    }

    /**
     * Extracts the base input into {@code workDir/base} and loads its manifests.
     */
    static MergeSession open(Collaborators collaborators, Path baseInput, Path workDir) {
        Path baseTree = workDir.resolve("base");
        collaborators.archiver().extract(baseInput, baseTree);
        String mainPart = locateMainPart(collaborators.store(), baseTree);
        MergeSession session = new MergeSession(collaborators, workDir, baseTree, mainPart);
        int baseSlides = session.presentation.slideRefs().size();
        session.summaries.add(new MergeResult.InputSummary(fileName(baseInput), baseSlides, true));
        LOG.info("Base package {} has {} slide(s); next slide id {}", fileName(baseInput), baseSlides,
                session.maxSlideId + 1);
        return session;
    }

    /**
     * Appends every slide of {@code sourceInput}, in its own list order, to the base presentation.
     *
     * @param sourceInput package to import
     * @param index       position of the input in the merge order, used to name its scratch tree
     * @return number of slides imported
     */
    int importSlides(Path sourceInput, int index) {
        XmlPartStore store = collaborators.store();
        Path sourceTree = workDir.resolve("src-" + index);
        collaborators.archiver().extract(sourceInput, sourceTree);

        String sourceMain = locateMainPart(store, sourceTree);
        String sourceContentRoot = PartPaths.folderOf(sourceMain);
        Path sourceContentDir = sourceTree.resolve(sourceContentRoot);
        ContentTypeRegistry sourceTypes = ContentTypeRegistry.load(store, sourceTree);
        PresentationDocument sourcePresentation = PresentationDocument.of(store.load(sourceTree.resolve(sourceMain)));
        RelationshipsPart sourceRels = RelationshipsPart.of(store.load(
                sourceContentDir.resolve(PartPaths.relationshipsPathOf(PartPaths.fileNameOf(sourceMain)))));

        if (sourcePresentation.slideIdList().isEmpty()) {
            LOG.info("{} has no slide list; nothing to import", fileName(sourceInput));
            summaries.add(new MergeResult.InputSummary(fileName(sourceInput), 0, false));
            return 0;
        }

        Map<String, String> slideTargets = new LinkedHashMap<>();
        for (Relationship rel : sourceRels.ofType(OoxmlNamespaces.REL_TYPE_SLIDE)) {
            slideTargets.put(rel.id(), rel.target());
        }

        CopyContext context = CopyContext.builder()
                .sourceName(fileName(sourceInput))
                .source(sourceContentDir, sourceContentRoot, sourceTypes)
                .destination(contentRootDir, contentRoot, contentTypes)
                .build();

        int imported = 0;
        for (SlideRef ref : sourcePresentation.slideRefs()) {
            String target = slideTargets.get(ref.relationshipId());
            if (target == null) {
                LOG.warn("Slide id {} in {} refers to unknown relationship '{}'; skipped",
                        ref.id(), fileName(sourceInput), ref.relationshipId());
                continue;
            }
            String sourceSlide = PartPaths.resolveTarget(sourceContentRoot, "", target);
            String destSlide = copySlide(context, sourceSlide);
            if (!context.isCopied(sourceSlide)) {
                LOG.warn("Slide part {} is missing from {}; skipped", sourceSlide, fileName(sourceInput));
                continue;
            }

            Relationship rel = presentationRels.add(OoxmlNamespaces.REL_TYPE_SLIDE, PartPaths.relativize("", destSlide));
            presentation.appendSlide(++maxSlideId, rel.id());
            contentTypes.registerOverride(PartPaths.partName(contentRoot, destSlide), PartKind.SLIDE.getContentType());
            contentTypes.mergeDefaults(sourceTypes);
            imported++;
            LOG.debug("Imported {} as {} (slide id {}, {})", sourceSlide, destSlide, maxSlideId, rel.id());
        }

        if (masterRegistrar != null) {
            masterRegistrar.register(context.copiedOfKind(PartKind.SLIDE_MASTER), presentation, presentationRels);
        }

        partsCopied += context.partsCopied();
        partsSkipped += context.partsSkipped();
        summaries.add(new MergeResult.InputSummary(fileName(sourceInput), imported, false));
        LOG.info("Imported {} slide(s) from {} ({} part(s) copied, {} missing reference(s) skipped)",
                imported, fileName(sourceInput), context.partsCopied(), context.partsSkipped());
        return imported;
    }

    private String copySlide(CopyContext context, String sourceSlide) {
        try {
            return collaborators.copier().copyWithDependencies(context, sourceSlide);
        } catch (PptxMergerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw MergeExceptionBuilder.create("Failed to copy slide")
                    .source(context.getSourceName())
                    .part(sourceSlide)
                    .cause(e)
                    .build();
        }
    }

    /**
     * Persists the base manifests and archives the base tree to {@code output}.
     *
     * <p>The archive is first written next to {@code output} and then moved into place, so a
     * failure never leaves a partial file at the output path.
     */
    MergeResult finish(Path output, Duration elapsedSoFar) {
        XmlPartStore store = collaborators.store();
        store.save(presentation.getDocument(), presentationFile);
        store.save(presentationRels.getDocument(), presentationRelsFile);
        contentTypes.save(store);

        Path target = output.toAbsolutePath().normalize();
        Path staging = null;
        try {
            Files.createDirectories(target.getParent());
            staging = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".part");
            collaborators.archiver().archive(baseTree, staging);
            moveIntoPlace(staging, target);
        } catch (IOException e) {
            deleteQuietly(staging);
            throw new ArchiveWriteException(target, e);
        } catch (RuntimeException e) {
            deleteQuietly(staging);
            throw e;
        }

        return new MergeResult(target, presentation.slideRefs().size(), summaries, partsCopied, partsSkipped,
                elapsedSoFar);
    }

    private static void moveIntoPlace(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}; falling back to replace", target);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove staging file {}: {}", path, e.toString());
        }
    }

    /**
     * Finds the main presentation part through the package relationships, falling back to the
     * conventional {@code ppt/presentation.xml}.
     */
    static String locateMainPart(XmlPartStore store, Path packageRoot) {
        Path rootRels = packageRoot.resolve(OoxmlNamespaces.ROOT_RELATIONSHIPS_PART);
        if (Files.isRegularFile(rootRels)) {
            for (Relationship rel : RelationshipsPart.of(store.load(rootRels)).ofType(OoxmlNamespaces.REL_TYPE_OFFICE_DOCUMENT)) {
                if (rel.isInternal()) {
                    return PartPaths.resolveTarget("", "", rel.target());
                }
            }
        }
        return OoxmlNamespaces.DEFAULT_MAIN_PART;
    }

    private static String fileName(Path input) {
        return input.getFileName().toString();
    }
}
