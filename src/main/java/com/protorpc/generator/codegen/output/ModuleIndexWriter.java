package com.protorpc.generator.codegen.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protorpc.generator.codegen.GenerationException;
import com.protorpc.generator.codegen.util.FileWriteUtil;

/**
 * Maintains the shared index listing every generated module, one per line.
 *
 * The index is rewritten only when its content changes, so incremental builds watching
 * it are not retriggered by a run that produced the same modules.
 */
public class ModuleIndexWriter {
    private static final Logger log = LoggerFactory.getLogger(ModuleIndexWriter.class);

    private final Path indexPath;

    public ModuleIndexWriter(Path outDir, String indexFileName) {
        Objects.requireNonNull(outDir, "outDir");
        Objects.requireNonNull(indexFileName, "indexFileName");
        this.indexPath = outDir.resolve(indexFileName);
    }

    public Path getIndexPath() {
        return indexPath;
    }

    public static String render(List<String> modules) {
        StringBuilder sb = new StringBuilder();
        for (String module : modules) {
            sb.append(module).append('\n');
        }
        return sb.toString();
    }

    /**
     * @return true if the index file was written, false if it already had this content
     * @throws GenerationException if the index cannot be read or written
     */
    public boolean writeIfChanged(List<String> modules) {
        try {
            boolean written = FileWriteUtil.writeIfChanged(indexPath, render(modules));
            if (written) {
                log.info("Wrote module index {} ({} module(s))", indexPath, modules.size());
            } else {
                log.info("Module index {} is up to date", indexPath);
            }
            return written;
        } catch (IOException e) {
            throw new GenerationException("Failed to write module index " + indexPath + ": " + e.getMessage(), e);
        }
    }
}
