package com.phillippitts.pptxmerger.service.merge;

import com.phillippitts.pptxmerger.domain.PartKind;
import com.phillippitts.pptxmerger.domain.Relationship;
import com.phillippitts.pptxmerger.exception.MergeExceptionBuilder;
import com.phillippitts.pptxmerger.service.xml.OoxmlNamespaces;
import com.phillippitts.pptxmerger.service.xml.PartPaths;
import com.phillippitts.pptxmerger.service.xml.RelationshipsPart;
import com.phillippitts.pptxmerger.service.xml.XmlPartStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists imported slide masters in the base presentation's master list.
 *
 * <p>Slide master ids and slide layout ids share one number space that must stay unique across
 * the whole presentation. Every copied master gets a fresh id and its layout entries are
 * renumbered above the highest id in use; nothing else in the master changes.
 */
final class MasterRegistrar {

    private static final Logger LOG = LogManager.getLogger(MasterRegistrar.class);

    private final XmlPartStore store;
    private final Path contentRootDir;
    private long maxId;

    private MasterRegistrar(XmlPartStore store, Path contentRootDir, long maxId) {
        this.store = store;
        this.contentRootDir = contentRootDir;
        this.maxId = maxId;
    }

    /**
     * Scans the base presentation and its slide masters for the highest master/layout id.
     */
    static MasterRegistrar scan(XmlPartStore store, Path contentRootDir, PresentationDocument presentation) {
        long max = presentation.maxMasterId();
        Path mastersDir = contentRootDir.resolve(PartKind.SLIDE_MASTER.getFolder());
        if (Files.isDirectory(mastersDir)) {
            try (Stream<Path> masters = Files.list(mastersDir)) {
                for (Path master : masters.filter(p -> PartKind.SLIDE_MASTER.sequenceOf(p.getFileName().toString()) > 0).toList()) {
                    for (Element entry : PresentationDocument.layoutIdEntries(store.load(master))) {
                        max = Math.max(max, PresentationDocument.parseId(entry.getAttribute("id"), max));
                    }
                }
            } catch (IOException e) {
                throw MergeExceptionBuilder.create("Cannot scan slide masters")
                        .metadata("folder", mastersDir)
                        .cause(e)
                        .build();
            }
        }
        LOG.debug("Highest slide master/layout id in base package: {}", max);
        return new MasterRegistrar(store, contentRootDir, max);
    }

    /**
     * Registers each copied master with the presentation.
     *
     * @param masterPaths   content-root relative paths of masters copied into the base package
     * @param presentation  base presentation
     * @param relationships base presentation's relationships
     * @return number of masters registered
     */
    int register(List<String> masterPaths, PresentationDocument presentation, RelationshipsPart relationships) {
        for (String masterPath : masterPaths) {
            Path masterFile = contentRootDir.resolve(masterPath);
            Document master = store.load(masterFile);
            long masterId = ++maxId;
            for (Element entry : PresentationDocument.layoutIdEntries(master)) {
                entry.setAttribute("id", Long.toString(++maxId));
            }
            store.save(master, masterFile);

            Relationship rel = relationships.add(OoxmlNamespaces.REL_TYPE_SLIDE_MASTER, PartPaths.relativize("", masterPath));
            presentation.appendMaster(masterId, rel.id());
            LOG.debug("Registered slide master {} as id {} ({})", masterPath, masterId, rel.id());
        }
        return masterPaths.size();
    }
}
