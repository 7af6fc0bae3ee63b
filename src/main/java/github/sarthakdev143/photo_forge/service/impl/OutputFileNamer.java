package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.ExportOptions;
import github.sarthakdev143.photo_forge.model.FileNaming;

import java.nio.file.Path;

/**
 * Derives export file names: {@code prefix + baseName + suffix [+ _NNN] + extension}.
 */
final class OutputFileNamer {

    private OutputFileNamer() {
    }

    static String outputFileName(String inputFile, int index, ExportOptions options) {
        FileNaming naming = options.fileNaming();
        StringBuilder name = new StringBuilder();
        if (naming.prefix() != null) {
            name.append(naming.prefix());
        }
        name.append(baseName(inputFile));
        if (naming.suffix() != null) {
            name.append(naming.suffix());
        }
        if (naming.includeIndex()) {
            name.append(String.format("_%03d", index + 1));
        }
        return name.append(options.format().extension()).toString();
    }

    static Path outputPath(Path outputDirectory, String inputFile, int index, ExportOptions options) {
        return outputDirectory.resolve(outputFileName(inputFile, index, options));
    }

    static String baseName(String inputFile) {
        Path fileName = Path.of(inputFile).getFileName();
        String name = fileName == null ? inputFile : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
