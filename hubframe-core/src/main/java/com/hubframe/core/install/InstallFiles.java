package com.hubframe.core.install;

import com.hubframe.api.exception.HubException;
import com.hubframe.core.loader.PluginManifestLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * 安装后端共用的文件操作
 */
final class InstallFiles {

    private InstallFiles() {
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    /**
     * 解压到目标目录，拒绝指向目录之外的条目
     */
    static int unzip(InputStream in, Path target) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        Files.createDirectories(root);
        int count = 0;
        try (ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path resolved = root.resolve(entry.getName()).normalize();
                if (!resolved.startsWith(root)) {
                    throw new HubException("Archive entry escapes plugin directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(resolved);
                } else {
                    Files.createDirectories(resolved.getParent());
                    Files.copy(zip, resolved, StandardCopyOption.REPLACE_EXISTING);
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * 清单可能在目录根部，也可能在唯一的子目录里（常见的打包方式）
     */
    static Path locateManifestDir(Path dir) throws IOException {
        if (Files.isRegularFile(dir.resolve(PluginManifestLoader.MANIFEST_FILE))) {
            return dir;
        }
        try (Stream<Path> children = Files.list(dir)) {
            List<Path> candidates = children
                    .filter(Files::isDirectory)
                    .filter(d -> Files.isRegularFile(d.resolve(PluginManifestLoader.MANIFEST_FILE)))
                    .toList();
            if (candidates.size() == 1) {
                return candidates.get(0);
            }
        }
        throw new HubException("No " + PluginManifestLoader.MANIFEST_FILE + " found in " + dir);
    }
}
