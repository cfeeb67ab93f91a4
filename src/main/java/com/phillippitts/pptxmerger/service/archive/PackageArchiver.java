package com.phillippitts.pptxmerger.service.archive;

import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import com.phillippitts.pptxmerger.exception.ArchiveReadException;
import com.phillippitts.pptxmerger.exception.ArchiveWriteException;
import com.phillippitts.pptxmerger.service.xml.OoxmlNamespaces;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Moves packages between their zip form and an extracted working tree.
 *
 * <p>Entry names always use forward slashes regardless of the host file system, as the package
 * format requires. The content-type manifest is written as the first entry and the remaining
 * entries follow in lexical order, so the same tree always produces the same archive layout.
 */
@Component
public class PackageArchiver {

    private static final Logger LOG = LogManager.getLogger(PackageArchiver.class);

    private final int compressionLevel;

    public PackageArchiver(MergeProperties properties) {
        this.compressionLevel = properties.getArchive().getCompressionLevel();
    }

    /**
     * Unpacks every entry of a package archive into a directory, preserving relative paths.
     *
     * @param archivePath package file to read
     * @param destDir     directory to extract into (created if absent)
     * @return number of files extracted
     * @throws ArchiveReadException if the input is not a readable zip archive, holds no entries,
     *                              or contains an entry that would land outside {@code destDir}
     */
    public int extract(Path archivePath, Path destDir) {
        Objects.requireNonNull(archivePath, "archivePath must not be null");
        Objects.requireNonNull(destDir, "destDir must not be null");
        Path root = destDir.toAbsolutePath().normalize();
        int files = 0;
        try (ZipInputStream zin = new ZipInputStream(Files.newInputStream(archivePath))) {
            Files.createDirectories(root);
            ZipEntry entry;
            while ((entry = zin.getNextEntry()) != null) {
                Path target = root.resolve(entry.getName().replace('\\', '/')).normalize();
                if (!target.startsWith(root) || target.equals(root)) {
                    throw new ArchiveReadException(archivePath, "entry escapes the package root: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zin, target);
                    files++;
                }
                zin.closeEntry();
            }
        } catch (ZipException e) {
            throw new ArchiveReadException(archivePath, "not a valid zip archive", e);
        } catch (IOException e) {
            throw new ArchiveReadException(archivePath, e.getMessage(), e);
        }
        if (files == 0) {
            throw new ArchiveReadException(archivePath, "archive contains no entries");
        }
        LOG.debug("Extracted {} entries from {} into {}", files, archivePath.getFileName(), root);
        return files;
    }

    /**
     * Writes every regular file below {@code srcDir} into a new package archive.
     *
     * @param srcDir           root of the working tree
     * @param destArchivePath  archive to create (replaced if it exists)
     * @return number of entries written
     * @throws ArchiveWriteException if the tree cannot be read or the archive cannot be created
     */
    public int archive(Path srcDir, Path destArchivePath) {
        Objects.requireNonNull(srcDir, "srcDir must not be null");
        Objects.requireNonNull(destArchivePath, "destArchivePath must not be null");
        List<Path> files = listFiles(srcDir, destArchivePath);
        try (ZipOutputStream zout = new ZipOutputStream(Files.newOutputStream(destArchivePath))) {
            zout.setLevel(compressionLevel);
            for (Path file : files) {
                zout.putNextEntry(new ZipEntry(entryName(srcDir, file)));
                Files.copy(file, zout);
                zout.closeEntry();
            }
            zout.finish();
        } catch (IOException e) {
            throw new ArchiveWriteException(destArchivePath, e);
        }
        LOG.debug("Archived {} entries into {}", files.size(), destArchivePath);
        return files.size();
    }

    /**
     * Copies a part byte-for-byte. Never overwrites: the caller allocated {@code dest} as unused.
     *
     * @throws ArchiveWriteException if the copy fails, including when {@code dest} already exists
     */
    public void copyPart(Path source, Path dest) {
        try {
            Files.createDirectories(dest.getParent());
            try (InputStream in = Files.newInputStream(source); OutputStream out = Files.newOutputStream(dest,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                in.transferTo(out);
            }
        } catch (IOException e) {
            throw new ArchiveWriteException(dest, e);
        }
    }

    private static List<Path> listFiles(Path srcDir, Path destArchivePath) {
        try (Stream<Path> walk = Files.walk(srcDir)) {
            List<Path> files = new ArrayList<>(walk.filter(Files::isRegularFile).toList());
            files.sort(Comparator.comparing((Path p) -> !isContentTypesPart(srcDir, p))
                    .thenComparing(p -> entryName(srcDir, p)));
            return files;
        } catch (IOException e) {
            throw new ArchiveWriteException(destArchivePath, e);
        }
    }

    private static boolean isContentTypesPart(Path srcDir, Path file) {
        return OoxmlNamespaces.CONTENT_TYPES_PART.equals(entryName(srcDir, file));
    }

    static String entryName(Path root, Path file) {
        Path relative = root.relativize(file);
        List<String> names = new ArrayList<>();
        for (Path name : relative) {
            names.add(name.toString());
        }
        return String.join("/", names);
    }
}
