package com.vaultwave.backend.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Minimal ZIP helpers used to package downloads.
 */
public class ZipUtils {

    public record ZipSource(Path file, String entryName) {}

    /** Write every source into a deflated zip at {@code target}. Duplicate entry names get a numeric suffix. */
    public static void writeZip(List<ZipSource> sources, Path target) throws IOException {
        Set<String> usedNames = new HashSet<>();

        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zos = new ZipOutputStream(out)) {
            for (ZipSource source : sources) {
                String entryName = uniqueName(source.entryName(), usedNames);
                zos.putNextEntry(new ZipEntry(entryName));
                Files.copy(source.file(), zos);
                zos.closeEntry();
            }
        }
    }

    /** Names of all non-directory entries, in archive order. */
    public static List<String> listEntries(InputStream zip) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zis = new ZipInputStream(zip)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (!entry.isDirectory()) names.add(entry.getName());
                zis.closeEntry();
            }
        }
        return names;
    }

    private static String uniqueName(String name, Set<String> usedNames) {
        if (usedNames.add(name)) return name;

        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        int index = 2;
        String candidate;
        do {
            candidate = base + "_" + (index++) + ext;
        } while (!usedNames.add(candidate));
        return candidate;
    }
}
