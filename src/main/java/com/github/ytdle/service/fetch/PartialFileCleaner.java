package com.github.ytdle.service.fetch;

import com.github.ytdle.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Removes the files an unfinished job left behind: partial transfers, fragment pieces, separate streams awaiting a
 * merge and downloaded thumbnails. Files are found from the artifacts the tool announced and from their siblings
 * sharing the same stem.
 */
@Slf4j
@Component
public class PartialFileCleaner {

    private static final Pattern FORMAT_SUFFIX = Pattern.compile("\\.f\\d+$");

    // what may follow the stem of an announced file
    private static final Pattern LEFTOVER_SUFFIX = Pattern.compile(
            "^(\\.f\\d+)?"
                    + "(\\.(mp4|m4a|webm|mkv|mp3|opus|ogg|aac|flv|3gp|webp|jpg|jpeg|png|tmp|temp))?"
                    + "(\\.(part|ytdl))?(-Frag\\d+)?(\\.part)?$"
                    + "|^-(video|audio)\\..+$"
                    + "|^.*\\.(m4s|ts)$");

    /**
     * Delete the given artifacts and their leftovers.
     *
     * @return number of files removed
     */
    public int cleanup(Collection<Path> artifacts) {
        if (artifacts == null || artifacts.isEmpty()) {
            return 0;
        }

        Set<Path> candidates = new LinkedHashSet<>();
        for (Path artifact : artifacts) {
            Path absolute = artifact.toAbsolutePath().normalize();
            candidates.add(absolute);
            candidates.add(absolute.resolveSibling(absolute.getFileName() + ".part"));
            candidates.add(absolute.resolveSibling(absolute.getFileName() + ".ytdl"));
            collectSiblings(absolute, candidates);
        }

        int removed = 0;
        for (Path candidate : candidates) {
            if (deleteFile(candidate)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Removed {} leftover file(s)", removed);
        }
        return removed;
    }

    private void collectSiblings(Path artifact, Set<Path> candidates) {
        Path directory = artifact.getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return;
        }
        String stem = stemOf(artifact);
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory,
                entry -> isLeftover(entry.getFileName().toString(), stem))) {
            for (Path entry : entries) {
                candidates.add(entry);
            }
        } catch (IOException e) {
            log.warn("Failed to scan {} for leftovers of {}", directory, artifact.getFileName(), e);
        }
    }

    /**
     * Stem shared by every file the tool derives from one output name ("Title.f137.mp4" gives "Title").
     */
    static String stemOf(Path artifact) {
        String name = artifact.getFileName().toString();
        for (String suffix : new String[]{".part", ".ytdl"}) {
            if (name.endsWith(suffix)) {
                name = name.substring(0, name.length() - suffix.length());
            }
        }
        String stem = PathUtils.stem(artifact.resolveSibling(name));
        return FORMAT_SUFFIX.matcher(stem).replaceFirst("");
    }

    static boolean isLeftover(String fileName, String stem) {
        if (stem.isEmpty() || !fileName.startsWith(stem)) {
            return false;
        }
        return LEFTOVER_SUFFIX.matcher(fileName.substring(stem.length())).matches();
    }

    private boolean deleteFile(Path file) {
        try {
            if (Files.isRegularFile(file)) {
                Files.delete(file);
                log.debug("Deleted leftover file: {}", file);
                return true;
            }
        } catch (IOException e) {
            log.warn("Failed to delete leftover file: {}", file, e);
        }
        return false;
    }
}
