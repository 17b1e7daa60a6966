package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.config.ArchiveProperties;
import com.github.nlayna.coldarchive.model.KeyNamingOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builds the object key for an uploaded file: {@code prefix/yyyy/MM/dd/relative/dir/name}, each
 * segment optional except the name.
 */
@Component
public class ObjectKeyGenerator {

    private static final DateTimeFormatter DATE_FOLDER = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final ArchiveProperties archiveProperties;
    private final Clock clock;

    @Autowired
    public ObjectKeyGenerator(ArchiveProperties archiveProperties) {
        this(archiveProperties, Clock.systemUTC());
    }

    ObjectKeyGenerator(ArchiveProperties archiveProperties, Clock clock) {
        this.archiveProperties = archiveProperties;
        this.clock = clock;
    }

    public String generate(Path file, KeyNamingOptions options) {
        KeyNamingOptions opts = options == null ? new KeyNamingOptions() : options;
        String fileName = file.getFileName().toString();
        List<String> segments = new ArrayList<>();

        String prefix = opts.getPrefix() != null ? opts.getPrefix() : archiveProperties.getKeyPrefix();
        if (prefix != null) {
            String trimmed = prefix.replaceAll("/+$", "");
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }

        if (opts.isUseDateFolder()) {
            segments.add(clock.instant().atZone(ZoneOffset.UTC).format(DATE_FOLDER));
        }

        if (opts.isPreserveDirectoryStructure()) {
            String relativeDir = relativeParent(file, opts.getBaseDirectory());
            if (!relativeDir.isEmpty()) {
                segments.add(relativeDir);
            }
        }

        String name = fileName;
        if (opts.getNamingPattern() != null && !opts.getNamingPattern().isBlank()) {
            name = opts.getNamingPattern()
                    .replace("{filename}", fileName)
                    .replace("{timestamp}", String.valueOf(clock.instant().getEpochSecond()))
                    .replace("{uuid}", UUID.randomUUID().toString());
        }
        segments.add(name);

        return String.join("/", segments);
    }

    /**
     * Parent directory of {@code file} relative to the base directory, or empty when the file
     * lies outside it.
     */
    private static String relativeParent(Path file, String baseDirectory) {
        Path base = Paths.get(baseDirectory != null ? baseDirectory : System.getProperty("user.home"))
                .toAbsolutePath().normalize();
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(base)) {
            return "";
        }
        Path parent = base.relativize(absolute).getParent();
        if (parent == null) {
            return "";
        }
        List<String> names = new ArrayList<>();
        parent.forEach(name -> names.add(name.toString()));
        return String.join("/", names);
    }
}
